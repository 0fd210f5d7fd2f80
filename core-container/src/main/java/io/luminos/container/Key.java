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
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

import static io.luminos.common.Preconditions.checkNotNull;

/**
 * Identifies a concrete type for the purposes of a {@link Container}.
 * <p>
 * Two keys are equal iff their {@link #getType() types} are equal, so
 * {@code Key<List<String>>} and {@code Key<List<Integer>>} name different
 * registrations while {@code Key.of(String.class)} and
 * {@code new Key<String>() {}} name the same one.
 * <p>
 * Parameterized keys are created by subclassing:
 * <pre>
 * Key&lt;List&lt;String&gt;&gt; key = new Key&lt;List&lt;String&gt;&gt;() {};
 * </pre>
 *
 * @param <T> the type this key stands for
 */
public abstract class Key<T> {
	@NotNull
	private final Type type;

	public Key() {
		this.type = getSuperclassTypeParameter(getClass());
	}

	private Key(@NotNull Type type) {
		this.type = type;
	}

	// so that we have one reusable non-abstract impl
	private static <T> Key<T> create(Type type) {
		return new Key<T>(type) {};
	}

	@NotNull
	public static <T> Key<T> of(@NotNull Class<T> type) {
		return create(checkNotNull(type, "type"));
	}

	@NotNull
	public static <T> Key<T> ofType(@NotNull Type type) {
		return create(checkNotNull(type, "type"));
	}

	/**
	 * Derives a key from the runtime class of a sample value.
	 * The sample itself is not retained.
	 */
	@NotNull
	public static <T> Key<T> ofInstance(@NotNull T sample) {
		return create(checkNotNull(sample, "sample").getClass());
	}

	@NotNull
	private static Type getSuperclassTypeParameter(@NotNull Class<?> subclass) {
		Type superclass = subclass.getGenericSuperclass();
		if (superclass instanceof ParameterizedType) {
			return ((ParameterizedType) superclass).getActualTypeArguments()[0];
		}
		throw new IllegalArgumentException("Unsupported type: " + superclass);
	}

	@NotNull
	public Type getType() {
		return type;
	}

	@SuppressWarnings("unchecked")
	@NotNull
	public Class<T> getRawType() {
		return (Class<T>) rawTypeOf(type);
	}

	public Type[] getTypeParams() {
		if (type instanceof ParameterizedType) {
			return ((ParameterizedType) type).getActualTypeArguments();
		}
		return new Type[0];
	}

	/**
	 * Narrows a type-erased value to this key's type.
	 * <p>
	 * Only the raw type can be checked; type arguments are erased at runtime.
	 *
	 * @throws ClassCastException if the value is not an instance of the raw type
	 */
	@SuppressWarnings("unchecked")
	@Nullable
	public T cast(@Nullable Object value) {
		if (value == null) {
			return null;
		}
		Class<?> rawType = boxed(getRawType());
		if (!rawType.isInstance(value)) {
			throw new ClassCastException("Cannot cast " + value.getClass().getName() + " to " + getDisplayString());
		}
		return (T) value;
	}

	public String getDisplayString() {
		return type.getTypeName().replaceAll("(?:\\w+\\.)*(\\w+)", "$1");
	}

	private static Class<?> rawTypeOf(Type type) {
		if (type instanceof Class) {
			return (Class<?>) type;
		} else if (type instanceof ParameterizedType) {
			return (Class<?>) ((ParameterizedType) type).getRawType();
		} else if (type instanceof GenericArrayType) {
			Class<?> component = rawTypeOf(((GenericArrayType) type).getGenericComponentType());
			return Array.newInstance(component, 0).getClass();
		} else {
			throw new IllegalArgumentException("Unsupported type: " + type.getTypeName());
		}
	}

	private static Class<?> boxed(Class<?> type) {
		if (!type.isPrimitive()) return type;
		if (type == int.class) return Integer.class;
		if (type == long.class) return Long.class;
		if (type == boolean.class) return Boolean.class;
		if (type == double.class) return Double.class;
		if (type == float.class) return Float.class;
		if (type == char.class) return Character.class;
		if (type == byte.class) return Byte.class;
		if (type == short.class) return Short.class;
		return Void.class;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Key)) {
			return false;
		}

		Key<?> key = (Key<?>) o;

		return type.equals(key.type);
	}

	@Override
	public int hashCode() {
		return type.hashCode();
	}

	@Override
	public String toString() {
		return type.getTypeName();
	}
}
