package com.fleetaudit.core.field;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How many path fields of a schema resolved against a raw bundle.
 *
 * @param resolved path fields that produced a value
 * @param total    path fields declared by the schema
 * @param broken   path fields replaced by their sentinel because the path is
 *                 known to be broken
 */
public record Coverage(int resolved, int total, int broken) implements Serializable {

    public static final Coverage EMPTY = new Coverage(0, 0, 0);

    public Coverage {
        if (resolved < 0 || total < 0 || broken < 0) {
            throw new IllegalArgumentException("coverage counts must be >= 0");
        }
    }

    /**
     * @return {@code {"resolved": n, "total": n, "broken": n}}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("resolved", resolved);
        m.put("total", total);
        m.put("broken", broken);
        return m;
    }
}
