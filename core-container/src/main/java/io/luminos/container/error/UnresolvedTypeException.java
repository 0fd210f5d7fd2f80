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

package io.luminos.container.error;

import io.luminos.container.Key;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a key has nothing registered for the requested kind of resolution.
 */
public final class UnresolvedTypeException extends ContainerException {
	public enum Resolution {
		/**
		 * Singleton instance, pending singleton factory or transient binding
		 */
		SHARED,
		/**
		 * Transient binding only
		 */
		TRANSIENT
	}

	@NotNull
	private final Key<?> key;
	@NotNull
	private final Resolution resolution;

	public UnresolvedTypeException(@NotNull Key<?> key, @NotNull Resolution resolution) {
		super(resolution == Resolution.TRANSIENT ?
				"No transient binding for " + key.getDisplayString() :
				"No singleton, singleton factory or binding for " + key.getDisplayString());
		this.key = key;
		this.resolution = resolution;
	}

	@NotNull
	public Key<?> getKey() {
		return key;
	}

	@NotNull
	public Resolution getResolution() {
		return resolution;
	}
}
