package com.fleetaudit.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Alert raised when a schema alert rule matches a host's fields.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code id} and {@code severity} are present; omitting either will throw a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Identifier of the alert rule that raised the alert. */
    private final String id;

    /** Canonical severity. */
    private final Severity severity;

    private final String category;

    /** Message with field placeholders already interpolated. */
    private final String message;

    /** Values of the rule's detail fields, keyed by field name. */
    private final Map<String, Object> detail;

    /** Items the alert is about, e.g. the datastores that are nearly full. */
    private final List<Object> affectedItems;

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.category = builder.category;
        this.message = builder.message != null ? builder.message : "";
        this.detail = Collections.unmodifiableMap(new LinkedHashMap<>(builder.detail));
        this.affectedItems = Collections.unmodifiableList(new ArrayList<>(builder.affectedItems));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private Severity severity;
        private String category;
        private String message;
        private Map<String, Object> detail = Map.of();
        private List<Object> affectedItems = List.of();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder detail(Map<String, Object> detail) {
            this.detail = detail != null ? detail : Map.of();
            return this;
        }

        public Builder affectedItems(List<Object> affectedItems) {
            this.affectedItems = affectedItems != null ? affectedItems : List.of();
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code id} or {@code severity} is
         *                              {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return unmodifiable detail map
     */
    public Map<String, Object> getDetail() {
        return detail;
    }

    /**
     * @return unmodifiable list of affected items
     */
    public List<Object> getAffectedItems() {
        return affectedItems;
    }

    /**
     * Render the alert in the report output format.
     *
     * @return map with {@code id, severity, category, message, detail,
     *         affected_items, condition}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", id);
        out.put("severity", severity.name());
        out.put("category", category);
        out.put("message", message);
        out.put("detail", new LinkedHashMap<>(detail));
        out.put("affected_items", new ArrayList<>(affectedItems));
        out.put("condition", true);
        return out;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id)
                && severity == alert.severity
                && Objects.equals(category, alert.category)
                && Objects.equals(message, alert.message)
                && Objects.equals(detail, alert.detail)
                && Objects.equals(affectedItems, alert.affectedItems);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, severity, category, message);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", severity=" + severity +
                ", category='" + category + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
