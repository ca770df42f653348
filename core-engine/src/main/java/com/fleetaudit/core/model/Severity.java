package com.fleetaudit.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * Canonical three-level alert severity used for rollups.
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL,
    WARNING,
    INFO;

    private static final Set<String> CRITICAL_ALIASES = Set.of("CRITICAL", "CAT_I", "HIGH", "SEVERE");
    private static final Set<String> WARNING_ALIASES = Set.of("WARNING", "WARN", "CAT_II", "MEDIUM", "MODERATE");

    /**
     * Map a free-form severity label onto the canonical scale.
     *
     * <p>
     * Matching is case-insensitive. Anything that is not recognised as critical
     * or warning, including {@code null}, is {@link #INFO}.
     * </p>
     *
     * @param raw severity label, e.g. {@code "high"} or a {@link Severity}
     * @return canonical severity
     */
    public static Severity canonical(Object raw) {
        if (raw instanceof Severity severity) {
            return severity;
        }
        if (raw == null) {
            return INFO;
        }
        String label = raw.toString().trim().toUpperCase(Locale.ROOT);
        if (CRITICAL_ALIASES.contains(label)) {
            return CRITICAL;
        }
        if (WARNING_ALIASES.contains(label)) {
            return WARNING;
        }
        return INFO;
    }

    /**
     * @param label severity label from a schema
     * @return {@code true} if the label is a canonical name or a known alias
     */
    public static boolean isRecognised(String label) {
        if (label == null) {
            return false;
        }
        String upper = label.trim().toUpperCase(Locale.ROOT);
        return upper.equals(INFO.name()) || CRITICAL_ALIASES.contains(upper) || WARNING_ALIASES.contains(upper);
    }
}
