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
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;

import static io.luminos.container.ProviderState.*;
import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.toList;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Ordered list of service providers with their lifecycle state.
 * <p>
 * Each pass walks a snapshot of the list taken when the pass starts, so a
 * provider added while a pass is running is first visited by the next pass.
 */
final class ServiceProviders {
	private static final Logger logger = getLogger(ServiceProviders.class);

	private static final class Entry {
		final ServiceProvider provider;
		ProviderState state = UNREGISTERED;

		Entry(ServiceProvider provider) {
			this.provider = provider;
		}
	}

	private final List<Entry> entries = new ArrayList<>();

	void add(@NotNull ServiceProvider provider) {
		entries.add(new Entry(provider));
	}

	void register(Resolver resolver) {
		List<Entry> snapshot = new ArrayList<>(entries);
		logger.info("=== REGISTERING PROVIDERS ({})", snapshot.size());
		for (Entry entry : snapshot) {
			logger.debug("Registering {}", entry.provider);
			entry.provider.register(resolver);
			entry.state = REGISTERED;
		}
	}

	void boot(Resolver resolver) {
		List<Entry> snapshot = new ArrayList<>(entries);
		logger.info("=== BOOTING PROVIDERS ({})", snapshot.size());
		for (Entry entry : snapshot) {
			if (entry.state == UNREGISTERED) {
				logger.warn("Booting {} which has not been registered", entry.provider);
			}
			logger.debug("Booting {}", entry.provider);
			entry.provider.boot(resolver);
			entry.state = BOOTED;
		}
	}

	List<ServiceProvider> getProviders() {
		return unmodifiableList(entries.stream().map(entry -> entry.provider).collect(toList()));
	}

	/**
	 * For a provider added more than once, the state of its first entry.
	 */
	ProviderState getState(@NotNull ServiceProvider provider) {
		for (Entry entry : entries) {
			if (entry.provider == provider) {
				return entry.state;
			}
		}
		throw new IllegalArgumentException("Unknown provider: " + provider);
	}

	int size() {
		return entries.size();
	}
}
