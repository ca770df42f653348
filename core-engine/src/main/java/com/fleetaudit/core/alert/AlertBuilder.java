package com.fleetaudit.core.alert;

import com.fleetaudit.core.condition.ConditionEvaluator;
import com.fleetaudit.core.model.Alert;
import com.fleetaudit.core.model.AlertRule;
import com.fleetaudit.core.model.Schema;
import com.fleetaudit.core.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns matching alert rules into {@link Alert}s.
 *
 * <p>
 * Rules are evaluated in schema order and at most one alert is raised per
 * rule. Detail fields missing from the field map are left out of the alert's
 * detail rather than reported as {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AlertBuilder.class);

    private final ConditionEvaluator conditions;

    public AlertBuilder(ConditionEvaluator conditions) {
        this.conditions = Objects.requireNonNull(conditions, "conditions must not be null");
    }

    /**
     * @param schema schema declaring the alert rules
     * @param fields extracted fields for one host
     * @return raised alerts in rule order
     */
    public List<Alert> build(Schema schema, Map<String, ?> fields) {
        Objects.requireNonNull(schema, "schema must not be null");
        Map<String, ?> values = fields != null ? fields : Map.of();
        List<Alert> alerts = new ArrayList<>();
        for (AlertRule rule : schema.getAlerts()) {
            if (!conditions.evaluate(rule.condition(), values)) {
                continue;
            }
            Alert alert = toAlert(rule, values);
            LOG.debug("Alert fired: schema={}, id={}, severity={}", schema.getName(), alert.getId(),
                    alert.getSeverity());
            alerts.add(alert);
        }
        return alerts;
    }

    private static Alert toAlert(AlertRule rule, Map<String, ?> fields) {
        Map<String, Object> detail = new LinkedHashMap<>();
        for (String name : rule.detailFields()) {
            if (fields.containsKey(name)) {
                detail.put(name, fields.get(name));
            }
        }
        List<Object> affected = rule.affectedItemsField() != null
                ? Values.asList(fields.get(rule.affectedItemsField()))
                : List.of();
        return Alert.builder()
                .id(rule.id())
                .severity(rule.severity())
                .category(rule.category())
                .message(MessageTemplate.render(rule.message(), fields))
                .detail(detail)
                .affectedItems(affected)
                .build();
    }
}
