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

import io.luminos.container.error.UnresolvedTypeException;
import io.luminos.container.error.UnresolvedTypeException.Resolution;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The part of a {@link Container} that factories and service providers get to see.
 * <p>
 * It allows registering and resolving by key, but not driving the provider
 * lifecycle or inspecting the container's tables. Typed methods are
 * shortcuts over the type-erased ones.
 */
public interface Resolver {
	void bindAny(@NotNull Key<?> key, @NotNull Factory<?> factory);

	/**
	 * Stores a ready instance under the given key, same as {@link #singleton(Key, Object)}
	 * without the compile-time type check.
	 */
	void bindAny(@NotNull Key<?> key, @NotNull Object instance);

	void singletonFactoryAny(@NotNull Key<?> key, @NotNull Factory<?> factory);

	/**
	 * Looks the key up in singleton instances, then pending singleton factories,
	 * then transient bindings.
	 *
	 * @return the instance, or {@code null} if none of them has the key
	 */
	@Nullable
	Object resolveAnyOrNull(@NotNull Key<?> key);

	/**
	 * Invokes the transient binding for the key, producing a new instance.
	 * Singletons are not consulted.
	 *
	 * @throws UnresolvedTypeException if there is no transient binding for the key
	 */
	@NotNull
	Object resolveTransientAny(@NotNull Key<?> key);

	boolean hasBinding(@NotNull Key<?> key);

	/**
	 * @return whether {@link #resolveAny} would find something for the key
	 */
	boolean isResolvable(@NotNull Key<?> key);

	default <T> void bind(@NotNull Key<T> key, @NotNull Factory<? extends T> factory) {
		bindAny(key, factory);
	}

	default <T> void bind(@NotNull Class<T> type, @NotNull Factory<? extends T> factory) {
		bindAny(Key.of(type), factory);
	}

	/**
	 * Binds a factory under the key of the sample's runtime class.
	 * Only the sample's class is used, the sample itself is dropped.
	 * <p>
	 * The factory is only typed against the sample's static type, so every
	 * instance it produces is checked against the key's type.
	 *
	 * @throws IllegalStateException on resolution, if the factory produced an instance of another class
	 */
	default <T> void bindLike(@NotNull T sample, @NotNull Factory<? extends T> factory) {
		Key<T> key = Key.ofInstance(sample);
		Class<T> type = key.getRawType();
		bindAny(key, resolver -> {
			T instance = factory.create(resolver);
			if (instance != null && !type.isInstance(instance)) {
				throw new IllegalStateException("Factory for " + key.getDisplayString() +
						" produced an instance of " + instance.getClass().getName());
			}
			return instance;
		});
	}

	default <T> void singleton(@NotNull Key<T> key, @NotNull T instance) {
		bindAny(key, (Object) instance);
	}

	default <T> void singleton(@NotNull Class<T> type, @NotNull T instance) {
		bindAny(Key.of(type), (Object) instance);
	}

	default <T> void singletonFactory(@NotNull Key<T> key, @NotNull Factory<? extends T> factory) {
		singletonFactoryAny(key, factory);
	}

	default <T> void singletonFactory(@NotNull Class<T> type, @NotNull Factory<? extends T> factory) {
		singletonFactoryAny(Key.of(type), factory);
	}

	/**
	 * @throws UnresolvedTypeException if the key has no singleton, singleton factory or binding
	 */
	@NotNull
	default Object resolveAny(@NotNull Key<?> key) {
		Object instance = resolveAnyOrNull(key);
		if (instance == null) {
			throw new UnresolvedTypeException(key, Resolution.SHARED);
		}
		return instance;
	}

	@NotNull
	default <T> T resolve(@NotNull Key<T> key) {
		return key.cast(resolveAny(key));
	}

	@NotNull
	default <T> T resolve(@NotNull Class<T> type) {
		return resolve(Key.of(type));
	}

	@Nullable
	default <T> T resolveOrNull(@NotNull Key<T> key) {
		return key.cast(resolveAnyOrNull(key));
	}

	@Nullable
	default <T> T resolveOr(@NotNull Key<T> key, @Nullable T defaultValue) {
		T instance = resolveOrNull(key);
		return instance != null ? instance : defaultValue;
	}

	@NotNull
	default <T> T resolveTransient(@NotNull Key<T> key) {
		return key.cast(resolveTransientAny(key));
	}

	@NotNull
	default <T> T resolveTransient(@NotNull Class<T> type) {
		return resolveTransient(Key.of(type));
	}
}
