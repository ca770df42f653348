package com.fleetaudit.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Declares how one schema field is produced.
 *
 * <p>
 * Every field has exactly one {@link FieldSource}, a declared
 * {@link FieldType}, a {@code fallback} used when resolution yields nothing,
 * and an optional explicit {@code sentinel} used when the source is known to
 * be broken.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}, or the {@link #path}, {@link #compute} and
 * {@link #script} shortcuts. The source is required.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private final FieldSource source;
    private final FieldType type;
    private final Object fallback;
    private final Object sentinel;

    private FieldSpec(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.type = builder.type != null ? builder.type : FieldType.STR;
        this.fallback = builder.fallback;
        this.sentinel = builder.sentinel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FieldSpec path(String path, FieldType type, Object fallback) {
        return builder().source(new FieldSource.Path(path)).type(type).fallback(fallback).build();
    }

    public static FieldSpec compute(String expression, FieldType type, Object fallback) {
        return builder().source(new FieldSource.Compute(expression)).type(type).fallback(fallback).build();
    }

    public static FieldSpec script(FieldSource.Script script, FieldType type, Object fallback) {
        return builder().source(script).type(type).fallback(fallback).build();
    }

    /**
     * Fluent builder for {@link FieldSpec}.
     */
    public static class Builder {
        private FieldSource source;
        private FieldType type = FieldType.STR;
        private Object fallback;
        private Object sentinel;

        public Builder source(FieldSource source) {
            this.source = source;
            return this;
        }

        public Builder type(FieldType type) {
            this.type = type;
            return this;
        }

        public Builder fallback(Object fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder sentinel(Object sentinel) {
            this.sentinel = sentinel;
            return this;
        }

        /**
         * @return a new {@link FieldSpec}
         * @throws NullPointerException if no source was set
         */
        public FieldSpec build() {
            return new FieldSpec(this);
        }
    }

    public FieldSource getSource() {
        return source;
    }

    public FieldType getType() {
        return type;
    }

    public Object getFallback() {
        return fallback;
    }

    /**
     * @return the explicitly declared sentinel, or {@code null} if none
     */
    public Object getDeclaredSentinel() {
        return sentinel;
    }

    /**
     * Value substituted when this field's source is broken: the declared
     * sentinel if any, otherwise the type's default sentinel.
     *
     * @return sentinel value
     */
    public Object sentinel() {
        return sentinel != null ? sentinel : type.defaultSentinel(fallback);
    }

    public boolean isPath() {
        return source instanceof FieldSource.Path;
    }

    public boolean isCompute() {
        return source instanceof FieldSource.Compute;
    }

    public boolean isScript() {
        return source instanceof FieldSource.Script;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FieldSpec that))
            return false;
        return Objects.equals(source, that.source)
                && type == that.type
                && Objects.equals(fallback, that.fallback)
                && Objects.equals(sentinel, that.sentinel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, type, fallback, sentinel);
    }

    @Override
    public String toString() {
        return "FieldSpec{" +
                "source=" + source +
                ", type=" + type +
                ", fallback=" + fallback +
                ", sentinel=" + sentinel +
                '}';
    }
}
