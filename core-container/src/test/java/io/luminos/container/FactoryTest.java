/*
 * Copyright (C) 2024 Luminos.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.luminos.container;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

public final class FactoryTest {
	private final Container container = new Container();

	@Test
	public void onInstanceSeesEveryInstance() {
		List<StringBuilder> seen = new ArrayList<>();
		Factory<StringBuilder> factory = resolver -> new StringBuilder("value");
		container.bind(StringBuilder.class, factory.onInstance(seen::add));

		StringBuilder first = container.resolveTransient(StringBuilder.class);
		StringBuilder second = container.resolveTransient(StringBuilder.class);

		assertEquals(2, seen.size());
		assertEquals(first, seen.get(0));
		assertEquals(second, seen.get(1));
		assertNotSame(first, second);
	}

	@Test
	public void mapInstance() {
		Factory<String> factory = resolver -> "value";
		container.bind(String.class, factory.mapInstance(String::toUpperCase));

		assertEquals("VALUE", container.resolveTransient(String.class));
	}

	@Test
	public void decoratorsKeepTheOriginal() {
		Factory<String> factory = resolver -> "value";
		Factory<String> mapped = factory.mapInstance(s -> s + "!");

		assertEquals("value", factory.create(container));
		assertEquals("value!", mapped.create(container));
	}
}
