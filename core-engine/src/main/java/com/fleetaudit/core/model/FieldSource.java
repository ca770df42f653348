package com.fleetaudit.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The single production rule of a {@link FieldSpec}.
 *
 * <p>
 * A field is either resolved from the raw bundle by dotted path, computed
 * from other fields by an arithmetic expression, or produced by an external
 * helper script.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface FieldSource extends Serializable
        permits FieldSource.Path, FieldSource.Compute, FieldSource.Script {

    /** Default seconds before a script invocation is treated as broken. */
    int DEFAULT_SCRIPT_TIMEOUT_SECONDS = 30;

    /**
     * Dotted path into the raw bundle, optionally followed by
     * {@code " | transform"}.
     */
    record Path(String path) implements FieldSource {
        public Path {
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    /**
     * Arithmetic expression over other fields, e.g. {@code "{used} / {total} * 100"}.
     */
    record Compute(String expression) implements FieldSource {
        public Compute {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    /**
     * External helper script with static arguments and a timeout.
     */
    record Script(String script, Map<String, Object> args, int timeoutSeconds) implements FieldSource {
        public Script {
            Objects.requireNonNull(script, "script must not be null");
            args = args != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(args))
                    : Map.of();
            if (timeoutSeconds <= 0) {
                throw new IllegalArgumentException(
                        "script_timeout must be > 0 for script '" + script + "', got: " + timeoutSeconds);
            }
        }

        public Script(String script) {
            this(script, Map.of(), DEFAULT_SCRIPT_TIMEOUT_SECONDS);
        }
    }
}
