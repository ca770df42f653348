package com.fleetaudit.core.config;

import com.fleetaudit.core.condition.Comparison;
import com.fleetaudit.core.condition.ComputedFilterCondition;
import com.fleetaudit.core.condition.Condition;
import com.fleetaudit.core.condition.DateThresholdCondition;
import com.fleetaudit.core.condition.ExistsCondition;
import com.fleetaudit.core.condition.FilterCountCondition;
import com.fleetaudit.core.condition.MultiFilterCondition;
import com.fleetaudit.core.condition.RangeCondition;
import com.fleetaudit.core.condition.StringCondition;
import com.fleetaudit.core.condition.StringInCondition;
import com.fleetaudit.core.condition.ThresholdCondition;
import com.fleetaudit.core.model.AlertRule;
import com.fleetaudit.core.model.DetectionSpec;
import com.fleetaudit.core.model.FieldSource;
import com.fleetaudit.core.model.FieldSpec;
import com.fleetaudit.core.model.FieldType;
import com.fleetaudit.core.model.FleetColumn;
import com.fleetaudit.core.model.Schema;
import com.fleetaudit.core.model.Severity;
import com.fleetaudit.core.model.Widget;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a parsed YAML document into a validated {@link Schema}.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * name: vcenter
 * platform: vmware
 * display_name: VMware vCenter
 * detection:
 *   keys_any: [vcenter_info]
 * fields:
 *   cpu_used:  { path: "host.cpu.used", type: float, fallback: 0 }
 *   cpu_pct:   { compute: "{cpu_used} / {cpu_total} * 100", type: float }
 *   disks:     { script: disk_inventory.py, type: list, script_timeout: 10 }
 * alerts:
 *   - id: cpu_high
 *     category: capacity
 *     severity: CRITICAL
 *     condition: { op: gt, field: cpu_pct, threshold: 90 }
 *     message: "CPU at {cpu_pct:.1f}%"
 * widgets:
 *   - { id: overview, title: Overview, type: key_value, fields: [{ label: CPU, field: cpu_pct }] }
 * fleet_columns:
 *   - { label: CPU, field: cpu_pct }
 * </pre>
 *
 * <h3>Validation</h3>
 * <p>
 * Unknown keys are rejected at every level. Each field needs exactly one of
 * {@code path}, {@code compute} or {@code script}. Field names referenced by
 * conditions, detail fields, affected-items fields, widgets and fleet columns
 * must be declared, except names starting with {@code _}, which are filled in
 * after alerting. All problems are collected and reported together.
 * </p>
 *
 * @since 1.0.0
 */
public final class SchemaParser {

    private static final Set<String> SCHEMA_KEYS = Set.of("name", "platform", "display_name", "detection",
            "fields", "alerts", "widgets", "fleet_columns", "template_override");
    private static final Set<String> DETECTION_KEYS = Set.of("keys_any", "keys_all");
    private static final Set<String> FIELD_KEYS = Set.of("path", "compute", "script", "script_args",
            "script_timeout", "type", "fallback", "sentinel");
    private static final Set<String> ALERT_KEYS = Set.of("id", "category", "severity", "condition", "message",
            "detail_fields", "affected_items_field");
    private static final Set<String> FLEET_COLUMN_KEYS = Set.of("label", "field", "width");
    private static final Set<String> KEY_VALUE_ENTRY_KEYS = Set.of("label", "field", "format");
    private static final Set<String> TABLE_COLUMN_KEYS = Set.of("label", "field", "badge", "format", "link_field");

    /** Prefix of fields added by the normalizer after alerting. */
    private static final String VIRTUAL_PREFIX = "_";

    private final List<String> errors = new ArrayList<>();

    private SchemaParser() {
    }

    /**
     * Parse and validate a schema document.
     *
     * @param document the YAML root mapping
     * @return the validated schema
     * @throws IllegalStateException if the document is not a valid schema; the
     *                               message lists every problem found
     */
    public static Schema parse(Map<?, ?> document) {
        if (document == null) {
            throw new IllegalStateException("Schema document is empty");
        }
        SchemaParser parser = new SchemaParser();
        Schema schema = parser.schema(document);
        if (!parser.errors.isEmpty()) {
            Object name = document.get("name");
            throw new IllegalStateException(
                    "Schema '" + (name != null ? name : "?") + "' validation failed:\n  - "
                            + String.join("\n  - ", parser.errors));
        }
        return schema;
    }

    // ---------------------------------------------------------------
    // Schema
    // ---------------------------------------------------------------

    private Schema schema(Map<?, ?> doc) {
        checkKeys("schema", doc, SCHEMA_KEYS);
        String name = requiredString("schema", doc, "name");
        Schema.Builder b = Schema.builder(name != null ? name : "invalid")
                .platform(optionalString("schema", doc, "platform"))
                .displayName(optionalString("schema", doc, "display_name"))
                .detection(detection(doc.get("detection")))
                .templateOverride(optionalString("schema", doc, "template_override"));

        Map<?, ?> fields = optionalMap("schema", doc, "fields");
        Set<String> declared = new LinkedHashSet<>();
        for (Map.Entry<?, ?> e : fields.entrySet()) {
            String fieldName = String.valueOf(e.getKey());
            declared.add(fieldName);
            FieldSpec spec = field(fieldName, e.getValue());
            if (spec != null) {
                b.field(fieldName, spec);
            }
        }

        List<?> alerts = optionalList("schema", doc, "alerts");
        for (int i = 0; i < alerts.size(); i++) {
            AlertRule rule = alert(i, alerts.get(i), declared);
            if (rule != null) {
                b.alert(rule);
            }
        }

        List<?> widgets = optionalList("schema", doc, "widgets");
        for (int i = 0; i < widgets.size(); i++) {
            Widget widget = widget(i, widgets.get(i), declared);
            if (widget != null) {
                b.widget(widget);
            }
        }

        List<?> columns = optionalList("schema", doc, "fleet_columns");
        for (int i = 0; i < columns.size(); i++) {
            FleetColumn column = fleetColumn(i, columns.get(i), declared);
            if (column != null) {
                b.fleetColumn(column);
            }
        }
        return b.build();
    }

    private DetectionSpec detection(Object raw) {
        if (raw == null) {
            return DetectionSpec.NONE;
        }
        if (!(raw instanceof Map<?, ?> m)) {
            errors.add("detection: must be a mapping");
            return DetectionSpec.NONE;
        }
        checkKeys("detection", m, DETECTION_KEYS);
        return new DetectionSpec(stringList("detection", m, "keys_any"), stringList("detection", m, "keys_all"));
    }

    // ---------------------------------------------------------------
    // Fields
    // ---------------------------------------------------------------

    private FieldSpec field(String name, Object raw) {
        String ctx = "field '" + name + "'";
        if (!(raw instanceof Map<?, ?> m)) {
            errors.add(ctx + ": must be a mapping");
            return null;
        }
        checkKeys(ctx, m, FIELD_KEYS);

        int sources = (m.get("path") != null ? 1 : 0) + (m.get("compute") != null ? 1 : 0)
                + (m.get("script") != null ? 1 : 0);
        if (sources == 0) {
            errors.add(ctx + ": requires one of 'path', 'compute' or 'script'");
            return null;
        }
        if (sources > 1) {
            errors.add(ctx + ": 'path', 'compute' and 'script' are mutually exclusive");
            return null;
        }

        FieldType type;
        try {
            type = FieldType.fromSchemaName(optionalString(ctx, m, "type"));
        } catch (IllegalArgumentException e) {
            errors.add(ctx + ": " + e.getMessage());
            return null;
        }

        FieldSource source;
        if (m.get("path") != null) {
            String path = optionalString(ctx, m, "path");
            source = path != null ? new FieldSource.Path(path) : null;
        } else if (m.get("compute") != null) {
            String expression = optionalString(ctx, m, "compute");
            source = expression != null ? new FieldSource.Compute(expression) : null;
        } else {
            source = scriptSource(ctx, m);
        }
        if (source == null) {
            return null;
        }
        if (!(source instanceof FieldSource.Script) && (m.containsKey("script_args") || m.containsKey("script_timeout"))) {
            errors.add(ctx + ": 'script_args' and 'script_timeout' require 'script'");
        }

        return FieldSpec.builder()
                .source(source)
                .type(type)
                .fallback(widen(m.get("fallback")))
                .sentinel(widen(m.get("sentinel")))
                .build();
    }

    private FieldSource.Script scriptSource(String ctx, Map<?, ?> m) {
        String script = optionalString(ctx, m, "script");
        Map<String, Object> args = new LinkedHashMap<>();
        optionalMap(ctx, m, "script_args").forEach((k, v) -> args.put(String.valueOf(k), v));
        int timeout = FieldSource.DEFAULT_SCRIPT_TIMEOUT_SECONDS;
        Object rawTimeout = m.get("script_timeout");
        if (rawTimeout != null) {
            if (!(rawTimeout instanceof Integer || rawTimeout instanceof Long) || ((Number) rawTimeout).longValue() <= 0
                    || ((Number) rawTimeout).longValue() > Integer.MAX_VALUE) {
                errors.add(ctx + ": 'script_timeout' must be a positive integer, got: " + rawTimeout);
                return null;
            }
            timeout = ((Number) rawTimeout).intValue();
        }
        return script != null ? new FieldSource.Script(script, args, timeout) : null;
    }

    // ---------------------------------------------------------------
    // Alerts and conditions
    // ---------------------------------------------------------------

    private AlertRule alert(int index, Object raw, Set<String> declared) {
        String ctx = "alert[" + index + "]";
        if (!(raw instanceof Map<?, ?> m)) {
            errors.add(ctx + ": must be a mapping");
            return null;
        }
        String id = requiredString(ctx, m, "id");
        if (id != null) {
            ctx = "alert '" + id + "'";
        }
        checkKeys(ctx, m, ALERT_KEYS);
        String category = requiredString(ctx, m, "category");
        String message = requiredString(ctx, m, "message");

        Severity severity = Severity.WARNING;
        String label = optionalString(ctx, m, "severity");
        if (label != null) {
            if (Severity.isRecognised(label)) {
                severity = Severity.canonical(label);
            } else {
                errors.add(ctx + ": unknown severity '" + label + "'");
            }
        }

        Condition condition = null;
        Object rawCondition = m.get("condition");
        if (rawCondition == null) {
            errors.add(ctx + ": 'condition' is required");
        } else if (!(rawCondition instanceof Map<?, ?> cm)) {
            errors.add(ctx + ": 'condition' must be a mapping");
        } else {
            condition = condition(ctx + " condition", cm);
            if (condition != null) {
                checkReference(ctx + ": condition", condition.field(), declared);
            }
        }

        List<String> detailFields = stringList(ctx, m, "detail_fields");
        for (String f : detailFields) {
            checkReference(ctx + ": detail_fields", f, declared);
        }
        String affected = optionalString(ctx, m, "affected_items_field");
        if (affected != null) {
            checkReference(ctx + ": affected_items_field", affected, declared);
        }

        if (id == null || category == null || message == null || condition == null) {
            return null;
        }
        return new AlertRule(id, category, severity, condition, message, detailFields, affected);
    }

    private Condition condition(String ctx, Map<?, ?> m) {
        String op = requiredString(ctx, m, "op");
        if (op == null) {
            return null;
        }
        String field = requiredString(ctx, m, "field");
        switch (op) {
            case "gt", "lt", "gte", "lte", "eq", "ne" -> {
                checkKeys(ctx, m, Set.of("op", "field", "threshold"));
                Double threshold = requiredNumber(ctx, m, "threshold");
                return field != null && threshold != null
                        ? new ThresholdCondition(field, Comparison.fromOp(op), threshold)
                        : null;
            }
            case "range" -> {
                checkKeys(ctx, m, Set.of("op", "field", "min", "max"));
                Double min = requiredNumber(ctx, m, "min");
                Double max = requiredNumber(ctx, m, "max");
                return field != null && min != null && max != null ? new RangeCondition(field, min, max) : null;
            }
            case "exists", "not_exists" -> {
                checkKeys(ctx, m, Set.of("op", "field"));
                return field != null ? new ExistsCondition(field, op.equals("not_exists")) : null;
            }
            case "filter_count" -> {
                checkKeys(ctx, m, Set.of("op", "field", "filter_field", "filter_value", "threshold"));
                String filterField = requiredString(ctx, m, "filter_field");
                if (!m.containsKey("filter_value")) {
                    errors.add(ctx + ": 'filter_value' is required");
                }
                Double threshold = optionalNumber(ctx, m, "threshold", 0.0);
                return field != null && filterField != null && m.containsKey("filter_value") && threshold != null
                        ? new FilterCountCondition(field, filterField, widen(m.get("filter_value")), threshold)
                        : null;
            }
            case "filter_multi" -> {
                checkKeys(ctx, m, Set.of("op", "field", "filters", "threshold"));
                List<MultiFilterCondition.Filter> filters = filters(ctx, m);
                Double threshold = optionalNumber(ctx, m, "threshold", 0.0);
                return field != null && filters != null && threshold != null
                        ? new MultiFilterCondition(field, filters, threshold)
                        : null;
            }
            case "eq_str", "ne_str" -> {
                checkKeys(ctx, m, Set.of("op", "field", "value"));
                String value = requiredString(ctx, m, "value");
                return field != null && value != null
                        ? new StringCondition(field, value, op.equals("ne_str"))
                        : null;
            }
            case "in_str", "not_in_str" -> {
                checkKeys(ctx, m, Set.of("op", "field", "values"));
                if (!(m.get("values") instanceof List<?>)) {
                    errors.add(ctx + ": 'values' must be a list");
                    return null;
                }
                List<String> values = stringList(ctx, m, "values");
                return field != null ? new StringInCondition(field, Set.copyOf(values), op.equals("not_in_str")) : null;
            }
            case "computed_filter" -> {
                checkKeys(ctx, m, Set.of("op", "field", "expression", "cmp", "threshold", "min", "max"));
                String expression = requiredString(ctx, m, "expression");
                String cmp = requiredString(ctx, m, "cmp");
                Double threshold = optionalNumber(ctx, m, "threshold", null);
                Double min = optionalNumber(ctx, m, "min", null);
                Double max = optionalNumber(ctx, m, "max", null);
                if (field == null || expression == null || cmp == null) {
                    return null;
                }
                if (cmp.equals("range")) {
                    return new ComputedFilterCondition(field, expression, null, threshold, min, max);
                }
                try {
                    return new ComputedFilterCondition(field, expression, Comparison.fromOp(cmp), threshold, min, max);
                } catch (IllegalArgumentException e) {
                    errors.add(ctx + ": unknown cmp '" + cmp + "'");
                    return null;
                }
            }
            case "age_gt", "age_lt", "age_gte", "age_lte" -> {
                checkKeys(ctx, m, Set.of("op", "field", "days", "reference_field"));
                Double days = requiredNumber(ctx, m, "days");
                String reference = optionalString(ctx, m, "reference_field");
                return field != null && days != null
                        ? new DateThresholdCondition(field, Comparison.fromOp(op.substring(4)), days, reference)
                        : null;
            }
            default -> {
                errors.add(ctx + ": unknown op '" + op + "'");
                return null;
            }
        }
    }

    private List<MultiFilterCondition.Filter> filters(String ctx, Map<?, ?> m) {
        if (!(m.get("filters") instanceof List<?> raw)) {
            errors.add(ctx + ": 'filters' must be a list");
            return null;
        }
        List<MultiFilterCondition.Filter> filters = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            String fctx = ctx + " filters[" + i + "]";
            if (!(raw.get(i) instanceof Map<?, ?> fm)) {
                errors.add(fctx + ": must be a mapping");
                return null;
            }
            checkKeys(fctx, fm, Set.of("filter_field", "filter_value"));
            String filterField = requiredString(fctx, fm, "filter_field");
            if (!fm.containsKey("filter_value")) {
                errors.add(fctx + ": 'filter_value' is required");
                return null;
            }
            if (filterField == null) {
                return null;
            }
            filters.add(new MultiFilterCondition.Filter(filterField, widen(fm.get("filter_value"))));
        }
        return filters;
    }

    // ---------------------------------------------------------------
    // Widgets and fleet columns
    // ---------------------------------------------------------------

    private Widget widget(int index, Object raw, Set<String> declared) {
        String ctx = "widget[" + index + "]";
        if (!(raw instanceof Map<?, ?> m)) {
            errors.add(ctx + ": must be a mapping");
            return null;
        }
        String id = requiredString(ctx, m, "id");
        if (id != null) {
            ctx = "widget '" + id + "'";
        }
        String title = requiredString(ctx, m, "title");
        String type = requiredString(ctx, m, "type");
        if (type == null) {
            return null;
        }
        switch (type) {
            case Widget.KEY_VALUE -> {
                checkKeys(ctx, m, Set.of("id", "title", "type", "fields"));
                entries(ctx + " fields", m.get("fields"), KEY_VALUE_ENTRY_KEYS, declared);
            }
            case Widget.TABLE -> {
                checkKeys(ctx, m, Set.of("id", "title", "type", "rows_field", "columns"));
                String rows = requiredString(ctx, m, "rows_field");
                if (rows != null) {
                    checkReference(ctx + ": rows_field", rows, declared);
                }
                // column fields are keys of each row, not schema fields
                entries(ctx + " columns", m.get("columns"), TABLE_COLUMN_KEYS, null);
            }
            case Widget.ALERT_PANEL -> checkKeys(ctx, m, Set.of("id", "title", "type"));
            default -> {
                errors.add(ctx + ": unknown widget type '" + type + "'");
                return null;
            }
        }
        if (id == null || title == null) {
            return null;
        }
        Map<String, Object> definition = new LinkedHashMap<>();
        m.forEach((k, v) -> definition.put(String.valueOf(k), v));
        return new Widget(id, title, type, definition);
    }

    private void entries(String ctx, Object raw, Set<String> allowed, Set<String> declared) {
        if (!(raw instanceof List<?> list)) {
            errors.add(ctx + ": must be a list");
            return;
        }
        for (int i = 0; i < list.size(); i++) {
            String ectx = ctx + "[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> em)) {
                errors.add(ectx + ": must be a mapping");
                continue;
            }
            checkKeys(ectx, em, allowed);
            requiredString(ectx, em, "label");
            String field = requiredString(ectx, em, "field");
            if (field != null && declared != null) {
                checkReference(ectx, field, declared);
            }
        }
    }

    private FleetColumn fleetColumn(int index, Object raw, Set<String> declared) {
        String ctx = "fleet_columns[" + index + "]";
        if (!(raw instanceof Map<?, ?> m)) {
            errors.add(ctx + ": must be a mapping");
            return null;
        }
        checkKeys(ctx, m, FLEET_COLUMN_KEYS);
        String label = requiredString(ctx, m, "label");
        String field = requiredString(ctx, m, "field");
        String width = optionalString(ctx, m, "width");
        if (label == null || field == null) {
            return null;
        }
        checkReference(ctx, field, declared);
        return new FleetColumn(label, field, width);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void checkKeys(String ctx, Map<?, ?> m, Set<String> allowed) {
        for (Object key : m.keySet()) {
            if (!allowed.contains(String.valueOf(key))) {
                errors.add(ctx + ": unknown key '" + key + "'");
            }
        }
    }

    private void checkReference(String ctx, String field, Set<String> declared) {
        if (!field.startsWith(VIRTUAL_PREFIX) && !declared.contains(field)) {
            errors.add(ctx + " references undeclared field '" + field + "'");
        }
    }

    private String requiredString(String ctx, Map<?, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) {
            errors.add(ctx + ": '" + key + "' is required");
            return null;
        }
        return string(ctx, key, v);
    }

    private String optionalString(String ctx, Map<?, ?> m, String key) {
        Object v = m.get(key);
        return v != null ? string(ctx, key, v) : null;
    }

    private String string(String ctx, String key, Object v) {
        if (!(v instanceof String s)) {
            errors.add(ctx + ": '" + key + "' must be a string, got: " + v);
            return null;
        }
        return s;
    }

    private Double requiredNumber(String ctx, Map<?, ?> m, String key) {
        if (m.get(key) == null) {
            errors.add(ctx + ": '" + key + "' is required");
            return null;
        }
        return optionalNumber(ctx, m, key, null);
    }

    private Double optionalNumber(String ctx, Map<?, ?> m, String key, Double defaultValue) {
        Object v = m.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (!(v instanceof Number n)) {
            errors.add(ctx + ": '" + key + "' must be a number, got: " + v);
            return null;
        }
        return n.doubleValue();
    }

    private Map<?, ?> optionalMap(String ctx, Map<?, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) {
            return Map.of();
        }
        if (!(v instanceof Map<?, ?> map)) {
            errors.add(ctx + ": '" + key + "' must be a mapping");
            return Map.of();
        }
        return map;
    }

    private List<?> optionalList(String ctx, Map<?, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) {
            return List.of();
        }
        if (!(v instanceof List<?> list)) {
            errors.add(ctx + ": '" + key + "' must be a list");
            return List.of();
        }
        return list;
    }

    private List<String> stringList(String ctx, Map<?, ?> m, String key) {
        List<String> out = new ArrayList<>();
        for (Object item : optionalList(ctx, m, key)) {
            if (item instanceof String s) {
                out.add(s);
            } else {
                errors.add(ctx + ": '" + key + "' entries must be strings, got: " + item);
            }
        }
        return out;
    }

    /**
     * YAML integers arrive as {@link Integer}; widen them so literals compare
     * equal to coerced {@code int} fields, which are {@link Long}.
     */
    private static Object widen(Object v) {
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        if (v instanceof Float f) {
            return f.doubleValue();
        }
        return v;
    }
}
