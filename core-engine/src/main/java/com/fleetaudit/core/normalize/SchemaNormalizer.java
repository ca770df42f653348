package com.fleetaudit.core.normalize;

import com.fleetaudit.core.alert.AlertBuilder;
import com.fleetaudit.core.alert.Rollup;
import com.fleetaudit.core.alert.RollupCalculator;
import com.fleetaudit.core.condition.ConditionEvaluator;
import com.fleetaudit.core.config.NormalizerConfig;
import com.fleetaudit.core.expression.ExpressionEvaluator;
import com.fleetaudit.core.field.ExtractionResult;
import com.fleetaudit.core.field.FieldExtractor;
import com.fleetaudit.core.field.FieldResolver;
import com.fleetaudit.core.model.Alert;
import com.fleetaudit.core.model.Schema;
import com.fleetaudit.core.script.ProcessScriptExecutor;
import com.fleetaudit.core.script.ScriptLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a {@link Schema} against one host's raw bundle: extracts fields,
 * raises alerts, rolls up health and assembles the {@link NormalizedReport}.
 *
 * <p>
 * The normalizer keeps no per-call state and can be shared by worker threads
 * normalizing different hosts.
 * </p>
 *
 * <h3>Virtual fields</h3>
 * <p>
 * After alerts are raised, {@code _critical_count}, {@code _warning_count}
 * and {@code _total_alerts} (critical plus warning) are added to the fields so
 * fleet columns and widgets can show them.
 * </p>
 *
 * @since 1.0.0
 */
public class SchemaNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaNormalizer.class);

    public static final String CRITICAL_COUNT_FIELD = "_critical_count";
    public static final String WARNING_COUNT_FIELD = "_warning_count";
    public static final String TOTAL_ALERTS_FIELD = "_total_alerts";

    private final FieldExtractor extractor;
    private final AlertBuilder alertBuilder;
    private final Clock clock;

    public SchemaNormalizer(FieldExtractor extractor, AlertBuilder alertBuilder, Clock clock) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.alertBuilder = Objects.requireNonNull(alertBuilder, "alertBuilder must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Wire the default collaborators from a configuration.
     *
     * @param config scripts directory and interpreter settings
     * @param clock  source of "now" for date conditions and report timestamps
     */
    public SchemaNormalizer(NormalizerConfig config, Clock clock) {
        this(new FieldExtractor(new FieldResolver(), new ExpressionEvaluator(),
                        new ProcessScriptExecutor(config), new ScriptLocator(config)),
                new AlertBuilder(new ConditionEvaluator(new ExpressionEvaluator(), clock)),
                clock);
    }

    public SchemaNormalizer(NormalizerConfig config) {
        this(config, Clock.systemUTC());
    }

    public SchemaNormalizer() {
        this(NormalizerConfig.fromEnvironment());
    }

    /**
     * @param schema    schema to apply
     * @param rawBundle raw audit data for one host
     * @return the normalized report
     */
    public NormalizedReport normalize(Schema schema, Map<String, ?> rawBundle) {
        Objects.requireNonNull(schema, "schema must not be null");

        ExtractionResult extraction = extractor.extract(schema, rawBundle);
        List<Alert> alerts = alertBuilder.build(schema, extraction.fields());
        Rollup rollup = RollupCalculator.rollup(alerts);

        Map<String, Object> fields = new LinkedHashMap<>(extraction.fields());
        long critical = rollup.summary().criticalCount();
        long warning = rollup.summary().warningCount();
        fields.put(CRITICAL_COUNT_FIELD, critical);
        fields.put(WARNING_COUNT_FIELD, warning);
        fields.put(TOTAL_ALERTS_FIELD, critical + warning);

        ReportMetadata metadata = new ReportMetadata(schema.getName(), schema.getPlatform(),
                schema.getDisplayName(), clock.instant(), extraction.coverage());

        LOG.debug("Normalized schema={}: health={}, alerts={}, coverage={}/{}",
                schema.getName(), rollup.health(), alerts.size(),
                extraction.coverage().resolved(), extraction.coverage().total());

        return new NormalizedReport(metadata, rollup.health(), rollup.summary(), alerts, fields,
                schema.getWidgets());
    }
}
