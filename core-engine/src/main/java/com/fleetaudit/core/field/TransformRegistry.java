package com.fleetaudit.core.field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup table of {@link FieldTransform}s by name.
 *
 * <p>
 * Built once at startup and handed to the {@link FieldResolver}. Use
 * {@link #withDefaults()} for the built-in transforms, or
 * {@link #builder()} to add custom ones.
 * </p>
 *
 * <h3>Built-in transforms</h3>
 * <ul>
 * <li>{@code first}: first element of a list; absent if empty or not a list</li>
 * <li>{@code last}: last element of a list; absent if empty or not a list</li>
 * <li>{@code len_if_list}: size of a list, {@code 0} if not a list</li>
 * <li>{@code keys}: keys of a map as a list, empty if not a map</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class TransformRegistry {

    private static final TransformRegistry DEFAULTS = builder()
            .register("first", TransformRegistry::first)
            .register("last", TransformRegistry::last)
            .register("len_if_list", value -> value instanceof List<?> list ? list.size() : 0)
            .register("keys", value -> value instanceof Map<?, ?> map
                    ? new ArrayList<Object>(map.keySet())
                    : new ArrayList<>())
            .build();

    private final Map<String, FieldTransform> transforms;

    private TransformRegistry(Map<String, FieldTransform> transforms) {
        this.transforms = Collections.unmodifiableMap(new LinkedHashMap<>(transforms));
    }

    /**
     * @return registry containing only the built-in transforms
     */
    public static TransformRegistry withDefaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder seeded with this registry's transforms
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        transforms.forEach(builder::register);
        return builder;
    }

    /**
     * @param name transform name
     * @return the transform, or empty if none is registered under that name
     */
    public Optional<FieldTransform> find(String name) {
        return Optional.ofNullable(transforms.get(name));
    }

    public Set<String> names() {
        return transforms.keySet();
    }

    /**
     * Fluent builder for {@link TransformRegistry}. Registering a name twice
     * replaces the earlier transform.
     */
    public static class Builder {
        private final Map<String, FieldTransform> transforms = new LinkedHashMap<>();

        public Builder register(String name, FieldTransform transform) {
            Objects.requireNonNull(name, "Transform name must not be null");
            transforms.put(name, Objects.requireNonNull(transform, "Transform must not be null"));
            return this;
        }

        public TransformRegistry build() {
            return new TransformRegistry(transforms);
        }
    }

    private static Object first(Object value) {
        if (value instanceof List<?> list && !list.isEmpty()) {
            return list.get(0);
        }
        return null;
    }

    private static Object last(Object value) {
        if (value instanceof List<?> list && !list.isEmpty()) {
            return list.get(list.size() - 1);
        }
        return null;
    }
}
