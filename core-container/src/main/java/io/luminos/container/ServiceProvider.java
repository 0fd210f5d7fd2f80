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

/**
 * A unit of container configuration.
 * <p>
 * All providers of a container are {@link #register registered} first, in the
 * order they were added, and only then {@link #boot booted} in the same order.
 * Nothing orders providers against each other beyond that: a provider whose
 * {@code boot} resolves a key bound by another provider relies on that
 * provider having been added to the container.
 */
public interface ServiceProvider {
	/**
	 * Contributes bindings and singletons. Should not resolve anything
	 * registered by other providers, those may not be there yet.
	 */
	void register(Resolver resolver);

	/**
	 * Runs after every provider has been registered.
	 */
	default void boot(Resolver resolver) {
	}
}
