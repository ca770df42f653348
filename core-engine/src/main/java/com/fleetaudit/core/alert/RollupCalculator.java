package com.fleetaudit.core.alert;

import com.fleetaudit.core.model.Alert;
import com.fleetaudit.core.model.Health;
import com.fleetaudit.core.model.Severity;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pure functions from a list of alerts to summary counts and overall health.
 * The result does not depend on alert order.
 *
 * @since 1.0.0
 */
public final class RollupCalculator {

    /** Category used for alerts that declare none. */
    public static final String UNCATEGORIZED = "uncategorized";

    private RollupCalculator() {
    }

    public static Rollup rollup(List<Alert> alerts) {
        return new Rollup(health(alerts), summarize(alerts));
    }

    /**
     * @return CRITICAL if any alert is critical, else WARNING if any is a
     *         warning, else HEALTHY
     */
    public static Health health(List<Alert> alerts) {
        boolean warning = false;
        for (Alert alert : alerts) {
            if (alert.getSeverity() == Severity.CRITICAL) {
                return Health.CRITICAL;
            }
            warning |= alert.getSeverity() == Severity.WARNING;
        }
        return warning ? Health.WARNING : Health.HEALTHY;
    }

    public static AlertSummary summarize(List<Alert> alerts) {
        int critical = 0;
        int warning = 0;
        int info = 0;
        Map<String, Integer> byCategory = new HashMap<>();
        for (Alert alert : alerts) {
            switch (alert.getSeverity()) {
                case CRITICAL -> critical++;
                case WARNING -> warning++;
                default -> info++;
            }
            String category = alert.getCategory() != null
                    ? alert.getCategory().toLowerCase(Locale.ROOT)
                    : UNCATEGORIZED;
            byCategory.merge(category, 1, Integer::sum);
        }
        return new AlertSummary(alerts.size(), critical, warning, info, byCategory);
    }
}
