package com.fleetaudit.core.model;

import com.fleetaudit.core.condition.Condition;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * A schema-declared alert: when {@link #condition()} holds for a host's
 * fields, an {@link Alert} is raised with the interpolated {@link #message()}.
 *
 * @param id                 unique rule identifier
 * @param category           grouping used in summaries, e.g. {@code "capacity"}
 * @param severity           severity of raised alerts
 * @param condition          predicate over the extracted fields
 * @param message            message template with {@code {field}} placeholders
 * @param detailFields       fields copied into the alert's detail map
 * @param affectedItemsField optional list field copied into the alert
 * @since 1.0.0
 */
public record AlertRule(String id, String category, Severity severity, Condition condition, String message,
                        List<String> detailFields, String affectedItemsField) implements Serializable {

    public AlertRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(message, "message must not be null");
        severity = severity != null ? severity : Severity.WARNING;
        detailFields = detailFields != null ? List.copyOf(detailFields) : List.of();
    }

    public AlertRule(String id, String category, Severity severity, Condition condition, String message) {
        this(id, category, severity, condition, message, List.of(), null);
    }
}
