package com.fleetaudit.core.alert;

import com.fleetaudit.core.model.Health;

import java.io.Serializable;
import java.util.Objects;

/**
 * Health status and summary derived from a host's alerts.
 */
public record Rollup(Health health, AlertSummary summary) implements Serializable {

    public Rollup {
        Objects.requireNonNull(health, "health must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
    }
}
