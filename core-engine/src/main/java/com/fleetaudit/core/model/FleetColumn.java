package com.fleetaudit.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Column shown for this schema in fleet-wide overviews.
 *
 * @since 1.0.0
 */
public record FleetColumn(String label, String field, String width) implements Serializable {

    public FleetColumn {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(field, "field must not be null");
    }
}
