package com.fleetaudit.core.model;

/**
 * Worst-case status of a host, derived from its alerts.
 *
 * @since 1.0.0
 */
public enum Health {
    HEALTHY,
    WARNING,
    CRITICAL
}
