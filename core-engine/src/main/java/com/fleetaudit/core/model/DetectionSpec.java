package com.fleetaudit.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Top-level keys that identify raw bundles a schema applies to.
 *
 * @param keysAny at least one of these keys must be present (ignored if empty)
 * @param keysAll all of these keys must be present (ignored if empty)
 * @since 1.0.0
 */
public record DetectionSpec(List<String> keysAny, List<String> keysAll) implements Serializable {

    public static final DetectionSpec NONE = new DetectionSpec(List.of(), List.of());

    public DetectionSpec {
        keysAny = keysAny != null ? List.copyOf(keysAny) : List.of();
        keysAll = keysAll != null ? List.copyOf(keysAll) : List.of();
    }

    /**
     * @param bundle raw bundle
     * @return {@code true} if the bundle's top-level keys satisfy both lists
     */
    public boolean matches(Map<String, ?> bundle) {
        if (!keysAny.isEmpty() && keysAny.stream().noneMatch(bundle::containsKey)) {
            return false;
        }
        return keysAll.isEmpty() || keysAll.stream().allMatch(bundle::containsKey);
    }
}
