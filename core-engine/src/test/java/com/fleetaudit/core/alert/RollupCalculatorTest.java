package com.fleetaudit.core.alert;

import com.fleetaudit.core.model.Alert;
import com.fleetaudit.core.model.Health;
import com.fleetaudit.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RollupCalculator}.
 */
class RollupCalculatorTest {

    @Test
    @DisplayName("Should be healthy with no alerts")
    void shouldBeHealthyWhenEmpty() {
        Rollup rollup = RollupCalculator.rollup(List.of());

        assertThat(rollup.health()).isEqualTo(Health.HEALTHY);
        assertThat(rollup.summary().total()).isZero();
        assertThat(rollup.summary().byCategory()).isEmpty();
    }

    @Test
    @DisplayName("Should take the worst severity as health")
    void shouldUseWorstSeverity() {
        assertThat(RollupCalculator.health(List.of(alert("a", Severity.INFO, "x")))).isEqualTo(Health.HEALTHY);
        assertThat(RollupCalculator.health(List.of(
                alert("a", Severity.INFO, "x"), alert("b", Severity.WARNING, "x")))).isEqualTo(Health.WARNING);
        assertThat(RollupCalculator.health(List.of(
                alert("a", Severity.WARNING, "x"), alert("b", Severity.CRITICAL, "x")))).isEqualTo(Health.CRITICAL);
    }

    @Test
    @DisplayName("Should count per severity and per lower-cased category")
    void shouldSummarize() {
        List<Alert> alerts = List.of(
                alert("a", Severity.CRITICAL, "Capacity"),
                alert("b", Severity.WARNING, "capacity"),
                alert("c", Severity.WARNING, "security"),
                alert("d", Severity.INFO, null));

        AlertSummary summary = RollupCalculator.summarize(alerts);

        assertThat(summary.total()).isEqualTo(4);
        assertThat(summary.criticalCount()).isEqualTo(1);
        assertThat(summary.warningCount()).isEqualTo(2);
        assertThat(summary.infoCount()).isEqualTo(1);
        assertThat(summary.byCategory()).containsExactly(
                Map.entry("capacity", 2), Map.entry("security", 1), Map.entry("uncategorized", 1));
        assertThat(summary.toMap()).containsKeys("total", "critical_count", "warning_count", "info_count",
                "by_category");
    }

    @Test
    @DisplayName("Should not depend on alert order")
    void shouldBeOrderIndependent() {
        List<Alert> alerts = new ArrayList<>(List.of(
                alert("a", Severity.CRITICAL, "capacity"),
                alert("b", Severity.WARNING, "security"),
                alert("c", Severity.INFO, "inventory")));
        Rollup before = RollupCalculator.rollup(alerts);

        Collections.reverse(alerts);

        assertThat(RollupCalculator.rollup(alerts)).isEqualTo(before);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Alert alert(String id, Severity severity, String category) {
        return Alert.builder().id(id).severity(severity).category(category).message(id).build();
    }
}
