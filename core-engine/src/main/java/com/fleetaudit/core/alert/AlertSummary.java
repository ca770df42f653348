package com.fleetaudit.core.alert;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Alert counts per canonical severity and per lower-cased category.
 *
 * @param total         number of alerts
 * @param criticalCount alerts with severity CRITICAL
 * @param warningCount  alerts with severity WARNING
 * @param infoCount     alerts with severity INFO
 * @param byCategory    category to count, sorted by category
 */
public record AlertSummary(int total, int criticalCount, int warningCount, int infoCount,
                           Map<String, Integer> byCategory) implements Serializable {

    public AlertSummary {
        byCategory = byCategory != null
                ? Collections.unmodifiableMap(new TreeMap<>(byCategory))
                : Map.of();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total", total);
        m.put("critical_count", criticalCount);
        m.put("warning_count", warningCount);
        m.put("info_count", infoCount);
        m.put("by_category", new LinkedHashMap<>(byCategory));
        return m;
    }
}
