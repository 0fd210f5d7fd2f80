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

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Produces a new instance each time it is invoked.
 * <p>
 * The {@link Resolver} argument lets a factory look up its own dependencies
 * from the same container it is registered in.
 */
@FunctionalInterface
public interface Factory<T> {
	@NotNull
	T create(@NotNull Resolver resolver);

	default Factory<T> onInstance(@NotNull Consumer<? super T> consumer) {
		return resolver -> {
			T instance = create(resolver);
			consumer.accept(instance);
			return instance;
		};
	}

	default Factory<T> mapInstance(@NotNull Function<? super T, ? extends T> fn) {
		return resolver -> fn.apply(create(resolver));
	}
}
