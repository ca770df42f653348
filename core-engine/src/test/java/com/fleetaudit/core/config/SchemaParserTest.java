package com.fleetaudit.core.config;

import com.fleetaudit.core.condition.ComputedFilterCondition;
import com.fleetaudit.core.condition.DateThresholdCondition;
import com.fleetaudit.core.condition.FilterCountCondition;
import com.fleetaudit.core.condition.MultiFilterCondition;
import com.fleetaudit.core.condition.StringInCondition;
import com.fleetaudit.core.condition.ThresholdCondition;
import com.fleetaudit.core.condition.Comparison;
import com.fleetaudit.core.model.FieldSource;
import com.fleetaudit.core.model.FieldSpec;
import com.fleetaudit.core.model.FieldType;
import com.fleetaudit.core.model.Schema;
import com.fleetaudit.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SchemaParser}.
 */
class SchemaParserTest {

    @Nested
    @DisplayName("Valid schemas")
    class Valid {

        @Test
        @DisplayName("Should parse fields of every source kind")
        void shouldParseFields() {
            Schema schema = parse("""
                    name: linux
                    fields:
                      hostname: { path: facts.hostname, fallback: unknown }
                      cores: { path: facts.cores, type: int, fallback: 1, sentinel: -99 }
                      load_pct: { compute: "{load} / {cores} * 100", type: float }
                      disks: { script: disks.py, script_args: { min_gb: 5 }, script_timeout: 10, type: list }
                    """);

            Map<String, FieldSpec> fields = schema.getFields();
            assertThat(fields).containsOnlyKeys("hostname", "cores", "load_pct", "disks");
            assertThat(fields.get("hostname").getType()).isEqualTo(FieldType.STR);
            assertThat(fields.get("cores").getFallback()).isEqualTo(1L);
            assertThat(fields.get("cores").sentinel()).isEqualTo(-99L);
            assertThat(fields.get("load_pct").getSource())
                    .isEqualTo(new FieldSource.Compute("{load} / {cores} * 100"));
            assertThat(fields.get("disks").getSource())
                    .isEqualTo(new FieldSource.Script("disks.py", Map.of("min_gb", 5), 10));
        }

        @Test
        @DisplayName("Should default platform and display name to the schema name")
        void shouldDefaultNames() {
            Schema schema = parse("name: minimal\n");

            assertThat(schema.getPlatform()).isEqualTo("minimal");
            assertThat(schema.getDisplayName()).isEqualTo("minimal");
            assertThat(schema.getFields()).isEmpty();
            assertThat(schema.getAlerts()).isEmpty();
        }

        @Test
        @DisplayName("Should canonicalise severity aliases")
        void shouldCanonicaliseSeverity() {
            Schema schema = parse("""
                    name: s
                    fields:
                      cpu: { path: cpu, type: float }
                    alerts:
                      - { id: a, category: perf, severity: high, message: m, condition: { op: gt, field: cpu, threshold: 1 } }
                      - { id: b, category: perf, severity: CAT_II, message: m, condition: { op: gt, field: cpu, threshold: 1 } }
                      - { id: c, category: perf, severity: info, message: m, condition: { op: gt, field: cpu, threshold: 1 } }
                      - { id: d, category: perf, message: m, condition: { op: gt, field: cpu, threshold: 1 } }
                    """);

            assertThat(schema.getAlerts()).extracting(r -> r.severity())
                    .containsExactly(Severity.CRITICAL, Severity.WARNING, Severity.INFO, Severity.WARNING);
        }

        @Test
        @DisplayName("Should build every condition variant")
        void shouldParseConditions() {
            Schema schema = parse("""
                    name: s
                    fields:
                      cpu: { path: cpu, type: float }
                      users: { path: users, type: list }
                      os: { path: os }
                      seen: { path: seen }
                    alerts:
                      - { id: t, category: c, message: m, condition: { op: lte, field: cpu, threshold: 5 } }
                      - { id: f, category: c, message: m, condition: { op: filter_count, field: users, filter_field: uid, filter_value: 0 } }
                      - id: mf
                        category: c
                        message: m
                        condition:
                          op: filter_multi
                          field: users
                          threshold: 1
                          filters:
                            - { filter_field: uid, filter_value: 0 }
                            - { filter_field: locked, filter_value: false }
                      - { id: in, category: c, message: m, condition: { op: not_in_str, field: os, values: [rhel, ubuntu] } }
                      - { id: cf, category: c, message: m, condition: { op: computed_filter, field: users, expression: "{a}", cmp: range, min: 0, max: 1 } }
                      - { id: age, category: c, message: m, condition: { op: age_gte, field: seen, days: 30 } }
                    """);

            assertThat(schema.getAlerts().get(0).condition()).isEqualTo(new ThresholdCondition("cpu", Comparison.LTE, 5));
            assertThat(schema.getAlerts().get(1).condition())
                    .isEqualTo(new FilterCountCondition("users", "uid", 0L, 0));
            assertThat(schema.getAlerts().get(2).condition()).isEqualTo(new MultiFilterCondition("users", List.of(
                    new MultiFilterCondition.Filter("uid", 0L), new MultiFilterCondition.Filter("locked", false)), 1));
            assertThat(schema.getAlerts().get(3).condition()).isInstanceOfSatisfying(StringInCondition.class, c -> {
                assertThat(c.negated()).isTrue();
                assertThat(c.values()).containsExactlyInAnyOrder("rhel", "ubuntu");
            });
            assertThat(schema.getAlerts().get(4).condition()).isInstanceOfSatisfying(ComputedFilterCondition.class,
                    c -> assertThat(c.isRange()).isTrue());
            assertThat(schema.getAlerts().get(5).condition())
                    .isEqualTo(new DateThresholdCondition("seen", Comparison.GTE, 30, null));
        }

        @Test
        @DisplayName("Should allow references to virtual fields")
        void shouldAllowVirtualFields() {
            Schema schema = parse("""
                    name: s
                    fleet_columns:
                      - { label: Alerts, field: _total_alerts }
                    """);

            assertThat(schema.getFleetColumns()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Invalid schemas")
    class Invalid {

        @Test
        @DisplayName("Should reject a field with no source or more than one")
        void shouldRequireExactlyOneSource() {
            assertInvalid("""
                    name: s
                    fields:
                      a: { type: int }
                      b: { path: x, compute: "1 + 1" }
                    """,
                    "field 'a': requires one of 'path', 'compute' or 'script'",
                    "field 'b': 'path', 'compute' and 'script' are mutually exclusive");
        }

        @Test
        @DisplayName("Should reject unknown keys at every level")
        void shouldRejectUnknownKeys() {
            assertInvalid("""
                    name: s
                    colour: blue
                    fields:
                      a: { path: x, default: 1 }
                    alerts:
                      - { id: r, category: c, message: m, priority: 1, condition: { op: exists, field: a, value: 1 } }
                    """,
                    "schema: unknown key 'colour'",
                    "field 'a': unknown key 'default'",
                    "alert 'r': unknown key 'priority'",
                    "alert 'r' condition: unknown key 'value'");
        }

        @Test
        @DisplayName("Should reject references to undeclared fields")
        void shouldRejectUndeclaredReferences() {
            assertInvalid("""
                    name: s
                    fields:
                      a: { path: x }
                    alerts:
                      - { id: r, category: c, message: m, detail_fields: [ghost], condition: { op: exists, field: b } }
                    widgets:
                      - { id: w, title: W, type: key_value, fields: [{ label: L, field: c }] }
                      - { id: t, title: T, type: table, rows_field: rows, columns: [{ label: L, field: not_checked }] }
                    fleet_columns:
                      - { label: L, field: d }
                    """,
                    "references undeclared field 'b'",
                    "references undeclared field 'ghost'",
                    "references undeclared field 'c'",
                    "references undeclared field 'rows'",
                    "references undeclared field 'd'");
        }

        @Test
        @DisplayName("Should reject bad alert definitions")
        void shouldRejectBadAlerts() {
            assertInvalid("""
                    name: s
                    fields:
                      a: { path: x }
                    alerts:
                      - { id: r1, category: c, message: m, severity: urgent, condition: { op: gt, field: a, threshold: 1 } }
                      - { id: r2, category: c, message: m, condition: { op: between, field: a } }
                      - { id: r3, category: c, message: m, condition: { op: eq_str, field: a, value: 5 } }
                      - { id: r4, message: m, condition: { op: gt, field: a, threshold: high } }
                      - { id: r5, category: c, message: m }
                    """,
                    "alert 'r1': unknown severity 'urgent'",
                    "alert 'r2' condition: unknown op 'between'",
                    "alert 'r3' condition: 'value' must be a string",
                    "alert 'r4': 'category' is required",
                    "alert 'r4' condition: 'threshold' must be a number",
                    "alert 'r5': 'condition' is required");
        }

        @Test
        @DisplayName("Should reject bad script settings and unknown types")
        void shouldRejectBadFieldSettings() {
            assertInvalid("""
                    name: s
                    fields:
                      a: { script: a.py, script_timeout: 0 }
                      b: { path: x, script_args: { k: v } }
                      c: { path: x, type: decimal }
                    """,
                    "field 'a': 'script_timeout' must be a positive integer",
                    "field 'b': 'script_args' and 'script_timeout' require 'script'",
                    "field 'c':");
        }

        @Test
        @DisplayName("Should reject unknown widget types and a missing name")
        void shouldRejectBadWidgets() {
            assertThatThrownBy(() -> parse("""
                    widgets:
                      - { id: w, title: W, type: chart }
                    """))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageStartingWith("Schema '?' validation failed:")
                    .hasMessageContaining("schema: 'name' is required")
                    .hasMessageContaining("widget 'w': unknown widget type 'chart'");
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Schema parse(String yaml) {
        return SchemaParser.parse(SchemaLoader.readMapping(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test"));
    }

    private static void assertInvalid(String yaml, String... expectedErrors) {
        assertThatThrownBy(() -> parse(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed:")
                .hasMessageContainingAll(expectedErrors);
    }
}
