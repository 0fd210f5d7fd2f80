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

import io.luminos.common.ApplicationSettings;
import io.luminos.container.error.UnresolvedTypeException;
import io.luminos.container.error.UnresolvedTypeException.Resolution;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.luminos.common.Preconditions.checkNotNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Keyed registry of transient bindings, singleton instances and lazily
 * materialized singleton factories, populated by {@link ServiceProvider}s.
 * <p>
 * {@link #resolveAny} looks a key up in this order:
 * <ol>
 * <li>a singleton instance, returned as is</li>
 * <li>a pending singleton factory, invoked once and its result kept as the singleton instance</li>
 * <li>a transient binding, invoked on every call</li>
 * </ol>
 * {@link #resolveTransientAny} only looks at transient bindings.
 * <p>
 * A plain container is not thread-safe: two threads resolving the same
 * pending singleton may both run its factory. Use {@link #createThreadSafe()}
 * when a container is shared between threads.
 * <p>
 * Factories and providers receive a {@link Resolver} view of the container,
 * which can be used to resolve dependencies re-entrantly. Cycles between
 * factories are not detected.
 */
public class Container implements Resolver {
	private static final Logger logger = getLogger(Container.class);

	private final Map<Key<?>, Factory<?>> bindings = new HashMap<>();
	private final Map<Key<?>, Object> instances = new HashMap<>();
	private final Map<Key<?>, Factory<?>> singletonFactories = new HashMap<>();
	private final ServiceProviders providers = new ServiceProviders();

	private final Resolver view = new ResolverView();

	private static final class SynchronizedContainer extends Container {
		@Override
		synchronized public void bindAny(@NotNull Key<?> key, @NotNull Factory<?> factory) {
			super.bindAny(key, factory);
		}

		@Override
		synchronized public void bindAny(@NotNull Key<?> key, @NotNull Object instance) {
			super.bindAny(key, instance);
		}

		@Override
		synchronized public void singletonFactoryAny(@NotNull Key<?> key, @NotNull Factory<?> factory) {
			super.singletonFactoryAny(key, factory);
		}

		@Override
		synchronized public @Nullable Object resolveAnyOrNull(@NotNull Key<?> key) {
			return super.resolveAnyOrNull(key);
		}

		@Override
		synchronized public @NotNull Object resolveTransientAny(@NotNull Key<?> key) {
			return super.resolveTransientAny(key);
		}

		@Override
		synchronized public boolean hasBinding(@NotNull Key<?> key) {
			return super.hasBinding(key);
		}

		@Override
		synchronized public boolean isResolvable(@NotNull Key<?> key) {
			return super.isResolvable(key);
		}

		@Override
		synchronized public boolean hasSingletonFactory(@NotNull Key<?> key) {
			return super.hasSingletonFactory(key);
		}

		@Override
		synchronized public boolean hasInstance(@NotNull Key<?> key) {
			return super.hasInstance(key);
		}

		@Override
		synchronized public <T> @Nullable T peekInstance(@NotNull Key<T> key) {
			return super.peekInstance(key);
		}

		@Override
		synchronized public Map<Key<?>, Object> peekInstances() {
			return super.peekInstances();
		}

		@Override
		synchronized public Container registerProvider(@NotNull ServiceProvider provider) {
			return super.registerProvider(provider);
		}

		@Override
		synchronized public void register() {
			super.register();
		}

		@Override
		synchronized public void boot() {
			super.boot();
		}

		@Override
		synchronized public List<ServiceProvider> getProviders() {
			return super.getProviders();
		}

		@Override
		synchronized public ProviderState getProviderState(@NotNull ServiceProvider provider) {
			return super.getProviderState(provider);
		}
	}

	private final class ResolverView implements Resolver {
		@Override
		public void bindAny(@NotNull Key<?> key, @NotNull Factory<?> factory) {
			Container.this.bindAny(key, factory);
		}

		@Override
		public void bindAny(@NotNull Key<?> key, @NotNull Object instance) {
			Container.this.bindAny(key, instance);
		}

		@Override
		public void singletonFactoryAny(@NotNull Key<?> key, @NotNull Factory<?> factory) {
			Container.this.singletonFactoryAny(key, factory);
		}

		@Override
		public @Nullable Object resolveAnyOrNull(@NotNull Key<?> key) {
			return Container.this.resolveAnyOrNull(key);
		}

		@Override
		public @NotNull Object resolveTransientAny(@NotNull Key<?> key) {
			return Container.this.resolveTransientAny(key);
		}

		@Override
		public boolean hasBinding(@NotNull Key<?> key) {
			return Container.this.hasBinding(key);
		}

		@Override
		public boolean isResolvable(@NotNull Key<?> key) {
			return Container.this.isResolvable(key);
		}

		@Override
		public String toString() {
			return "Resolver of " + Container.this;
		}
	}

	public Container() {
	}

	/**
	 * Creates a thread-safe container if the {@code Container.threadSafe}
	 * system property is set to {@code true}, a plain one otherwise.
	 */
	public static Container create() {
		return ApplicationSettings.getBoolean(Container.class, "threadSafe", false) ?
				createThreadSafe() :
				new Container();
	}

	/**
	 * Creates a container whose operations are all synchronized on it,
	 * so that every singleton factory runs at most once even when first
	 * resolved from several threads at the same time.
	 */
	public static Container createThreadSafe() {
		return new SynchronizedContainer();
	}

	public boolean isThreadSafe() {
		return getClass() == SynchronizedContainer.class;
	}

	// region registration
	@Override
	public void bindAny(@NotNull Key<?> key, @NotNull Factory<?> factory) {
		checkNotNull(key, "key");
		checkNotNull(factory, "factory");
		if (bindings.put(key, factory) != null) {
			logger.trace("Overriding binding for {}", key);
		}
	}

	@Override
	public void bindAny(@NotNull Key<?> key, @NotNull Object instance) {
		checkNotNull(key, "key");
		checkNotNull(instance, () -> "Singleton instance for " + key.getDisplayString() + " is null");
		singletonFactories.remove(key);
		if (instances.put(key, instance) != null) {
			logger.trace("Overriding singleton {}", key);
		}
	}

	@Override
	public void singletonFactoryAny(@NotNull Key<?> key, @NotNull Factory<?> factory) {
		checkNotNull(key, "key");
		checkNotNull(factory, "factory");
		if (instances.remove(key) != null) {
			logger.trace("Dropping singleton {} in favour of a singleton factory", key);
		}
		singletonFactories.put(key, factory);
	}
	// endregion

	// region resolution
	@Override
	public @Nullable Object resolveAnyOrNull(@NotNull Key<?> key) {
		checkNotNull(key, "key");
		Object instance = instances.get(key);
		if (instance != null) {
			return instance;
		}
		Factory<?> singletonFactory = singletonFactories.get(key);
		if (singletonFactory != null) {
			instance = invoke(key, singletonFactory);
			if (instances.containsKey(key) || singletonFactories.get(key) != singletonFactory) {
				// the key was registered again while the factory ran, the newer registration wins
				logger.trace("Discarding result of replaced singleton factory for {}", key);
				return resolveAnyOrNull(key);
			}
			singletonFactories.remove(key);
			instances.put(key, instance);
			logger.trace("Materialized singleton {}", key);
			return instance;
		}
		Factory<?> factory = bindings.get(key);
		if (factory != null) {
			return invoke(key, factory);
		}
		return null;
	}

	@Override
	public @NotNull Object resolveTransientAny(@NotNull Key<?> key) {
		checkNotNull(key, "key");
		Factory<?> factory = bindings.get(key);
		if (factory == null) {
			throw new UnresolvedTypeException(key, Resolution.TRANSIENT);
		}
		return invoke(key, factory);
	}

	private Object invoke(Key<?> key, Factory<?> factory) {
		return checkNotNull(factory.create(view), () -> "Factory for " + key.getDisplayString() + " returned null");
	}
	// endregion

	// region introspection
	@Override
	public boolean hasBinding(@NotNull Key<?> key) {
		return bindings.containsKey(key);
	}

	@Override
	public boolean isResolvable(@NotNull Key<?> key) {
		return instances.containsKey(key) || singletonFactories.containsKey(key) || bindings.containsKey(key);
	}

	public boolean hasSingletonFactory(@NotNull Key<?> key) {
		return singletonFactories.containsKey(key);
	}

	public boolean hasInstance(@NotNull Key<?> key) {
		return instances.containsKey(key);
	}

	/**
	 * Returns the singleton instance for the key if there is one already,
	 * without invoking any factory.
	 */
	@Nullable
	public <T> T peekInstance(@NotNull Key<T> key) {
		return key.cast(instances.get(key));
	}

	public Map<Key<?>, Object> peekInstances() {
		return new HashMap<>(instances);
	}
	// endregion

	// region providers
	public Container registerProvider(@NotNull ServiceProvider provider) {
		providers.add(checkNotNull(provider, "provider"));
		return this;
	}

	/**
	 * Calls {@link ServiceProvider#register} on every provider, in the order they were added.
	 * May be called again, in which case every provider registers again.
	 */
	public void register() {
		providers.register(view);
	}

	/**
	 * Calls {@link ServiceProvider#boot} on every provider, in the order they were added.
	 * Does not check that {@link #register()} was called before.
	 */
	public void boot() {
		providers.boot(view);
	}

	public void registerAndBoot() {
		register();
		boot();
	}

	public List<ServiceProvider> getProviders() {
		return providers.getProviders();
	}

	/**
	 * @throws IllegalArgumentException if the provider was never added to this container
	 */
	public ProviderState getProviderState(@NotNull ServiceProvider provider) {
		return providers.getState(provider);
	}
	// endregion

	@Override
	public String toString() {
		return "Container{" +
				"bindings=" + bindings.size() +
				", singletons=" + instances.size() +
				", singletonFactories=" + singletonFactories.size() +
				", providers=" + providers.size() +
				'}';
	}
}
