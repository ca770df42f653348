package com.fleetaudit.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Display widget declared by a schema ({@code key_value}, {@code table} or
 * {@code alert_panel}). The core does not render widgets; it validates their
 * field references and passes the definitions through to report builders.
 *
 * @param id         widget identifier
 * @param title      display title
 * @param type       widget type
 * @param definition the full widget definition as declared in the schema
 * @since 1.0.0
 */
public record Widget(String id, String title, String type, Map<String, Object> definition) implements Serializable {

    public static final String KEY_VALUE = "key_value";
    public static final String TABLE = "table";
    public static final String ALERT_PANEL = "alert_panel";

    public Widget {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(type, "type must not be null");
        definition = definition != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(definition))
                : Map.of();
    }

    /**
     * Field names this widget reads: the {@code field} of every key/value
     * entry, or the {@code rows_field} of a table.
     *
     * @return referenced field names
     */
    public List<String> referencedFields() {
        if (TABLE.equals(type)) {
            Object rows = definition.get("rows_field");
            return rows != null ? List.of(rows.toString()) : List.of();
        }
        if (KEY_VALUE.equals(type) && definition.get("fields") instanceof List<?> entries) {
            return entries.stream()
                    .filter(Map.class::isInstance)
                    .map(entry -> ((Map<?, ?>) entry).get("field"))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
        }
        return List.of();
    }

    /**
     * @return compact descriptor {@code {id, title, type}} used in reports
     */
    public Map<String, Object> descriptor() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("id", id);
        meta.put("title", title);
        meta.put("type", type);
        return meta;
    }
}
