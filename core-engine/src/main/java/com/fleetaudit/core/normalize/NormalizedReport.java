package com.fleetaudit.core.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fleetaudit.core.alert.AlertSummary;
import com.fleetaudit.core.model.Alert;
import com.fleetaudit.core.model.Health;
import com.fleetaudit.core.model.Widget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of normalizing one host's raw bundle against a schema.
 *
 * <p>
 * {@link #toMap()} renders the report contract consumed by the report
 * builders:
 * </p>
 *
 * <pre>
 * metadata      {audit_type, schema_name, platform, display_name, generated_at, field_coverage}
 * health        HEALTHY | WARNING | CRITICAL
 * summary       {total, critical_count, warning_count, info_count, by_category}
 * alerts        [{id, severity, category, message, detail, affected_items, condition}]
 * fields        {name: value}, including _critical_count, _warning_count, _total_alerts
 * widgets_meta  {id: {id, title, type}}
 * schema        {name, display_name, widgets}
 * </pre>
 *
 * @since 1.0.0
 */
public final class NormalizedReport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final ReportMetadata metadata;
    private final Health health;
    private final AlertSummary summary;
    private final List<Alert> alerts;
    private final Map<String, Object> fields;
    private final List<Widget> widgets;

    NormalizedReport(ReportMetadata metadata, Health health, AlertSummary summary, List<Alert> alerts,
            Map<String, Object> fields, List<Widget> widgets) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.health = Objects.requireNonNull(health, "health must not be null");
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.alerts = List.copyOf(alerts);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.widgets = List.copyOf(widgets);
    }

    public ReportMetadata getMetadata() {
        return metadata;
    }

    public Health getHealth() {
        return health;
    }

    public AlertSummary getSummary() {
        return summary;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    /**
     * @return extracted fields plus the virtual alert-count fields
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    public List<Widget> getWidgets() {
        return widgets;
    }

    /**
     * @return the report as nested maps with snake_case keys
     */
    public Map<String, Object> toMap() {
        List<Map<String, Object>> alertMaps = new ArrayList<>(alerts.size());
        alerts.forEach(a -> alertMaps.add(a.toMap()));

        Map<String, Object> widgetsMeta = new LinkedHashMap<>();
        List<Map<String, Object>> widgetDefs = new ArrayList<>(widgets.size());
        for (Widget w : widgets) {
            widgetsMeta.put(w.id(), w.descriptor());
            widgetDefs.add(new LinkedHashMap<>(w.definition()));
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("name", metadata.schemaName());
        schema.put("display_name", metadata.displayName());
        schema.put("widgets", widgetDefs);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("metadata", metadata.toMap());
        out.put("health", health.name());
        out.put("summary", summary.toMap());
        out.put("alerts", alertMaps);
        out.put("fields", new LinkedHashMap<>(fields));
        out.put("widgets_meta", widgetsMeta);
        out.put("schema", schema);
        return out;
    }

    /**
     * @return {@link #toMap()} serialized as JSON
     * @throws IllegalStateException if a field value cannot be serialized
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report for schema '"
                    + metadata.schemaName() + "': " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "NormalizedReport{" +
                "schema='" + metadata.schemaName() + '\'' +
                ", health=" + health +
                ", alerts=" + alerts.size() +
                ", fields=" + fields.size() +
                '}';
    }
}
