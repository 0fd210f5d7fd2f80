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

import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public final class ThreadSafeContainerTest {
	private static final String THREAD_SAFE_PROPERTY = "Container.threadSafe";
	private static final int THREADS = 8;

	@After
	public void tearDown() {
		System.clearProperty(THREAD_SAFE_PROPERTY);
	}

	@Test
	public void createHonoursSetting() {
		assertFalse(Container.create().isThreadSafe());

		System.setProperty(THREAD_SAFE_PROPERTY, "true");
		assertTrue(Container.create().isThreadSafe());
		assertTrue(Container.createThreadSafe().isThreadSafe());
	}

	@Test
	public void concurrentFirstResolutionMaterializesOnce() throws Exception {
		Container container = Container.createThreadSafe();
		AtomicInteger invocations = new AtomicInteger();
		container.singletonFactory(StringBuilder.class, resolver -> {
			invocations.incrementAndGet();
			try {
				Thread.sleep(20);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			return new StringBuilder("singleton");
		});

		ExecutorService executor = Executors.newFixedThreadPool(THREADS);
		try {
			CountDownLatch start = new CountDownLatch(1);
			List<Future<StringBuilder>> futures = new ArrayList<>();
			for (int i = 0; i < THREADS; i++) {
				futures.add(executor.submit(() -> {
					start.await();
					return container.resolve(StringBuilder.class);
				}));
			}
			start.countDown();

			StringBuilder first = futures.get(0).get(5, TimeUnit.SECONDS);
			for (Future<StringBuilder> future : futures) {
				assertSame(first, future.get(5, TimeUnit.SECONDS));
			}
		} finally {
			executor.shutdownNow();
		}

		assertEquals(1, invocations.get());
	}

	@Test
	public void reentrantResolutionDoesNotDeadlock() {
		Container container = Container.createThreadSafe();
		container.singletonFactory(Integer.class, resolver -> 42);
		container.singletonFactory(String.class, resolver -> "value: " + resolver.resolve(Integer.class));

		assertEquals("value: 42", container.resolve(String.class));
	}

	@Test
	public void providersWorkOnThreadSafeContainer() {
		Container container = Container.createThreadSafe()
				.registerProvider(resolver -> resolver.singleton(String.class, "registered"));

		container.registerAndBoot();

		assertEquals("registered", container.resolve(String.class));
	}
}
