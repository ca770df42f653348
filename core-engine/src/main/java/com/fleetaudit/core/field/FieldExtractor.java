package com.fleetaudit.core.field;

import com.fleetaudit.core.expression.ExpressionEvaluator;
import com.fleetaudit.core.expression.ExpressionException;
import com.fleetaudit.core.model.FieldSource;
import com.fleetaudit.core.model.FieldSpec;
import com.fleetaudit.core.model.Schema;
import com.fleetaudit.core.script.ScriptExecutor;
import com.fleetaudit.core.script.ScriptLocator;
import com.fleetaudit.core.script.ScriptResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the typed field map of one host from its raw bundle.
 *
 * <h3>Passes</h3>
 * <ol>
 * <li><b>Path</b>: resolve and coerce every path field. A field that is absent
 * and listed in {@link Schema#getBrokenPaths()} gets its sentinel.</li>
 * <li><b>Compute</b>: evaluate every compute field, in declaration order,
 * over the path fields and the computes before it. Expression errors yield
 * the sentinel.</li>
 * <li><b>Script</b>: run every script field with all fields so far,
 * including the output of earlier scripts.</li>
 * <li><b>Compute again</b>: re-evaluate compute fields so they can use script
 * results. A failure keeps the value from pass 2.</li>
 * </ol>
 *
 * <p>
 * Each pass produces a new unmodifiable map. Nothing a single field does can
 * abort extraction.
 * </p>
 *
 * @since 1.0.0
 */
public class FieldExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(FieldExtractor.class);

    private final FieldResolver resolver;
    private final ExpressionEvaluator evaluator;
    private final ScriptExecutor scripts;
    private final ScriptLocator locator;

    public FieldExtractor(FieldResolver resolver, ExpressionEvaluator evaluator,
            ScriptExecutor scripts, ScriptLocator locator) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.scripts = Objects.requireNonNull(scripts, "scripts must not be null");
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
    }

    /**
     * @param schema schema declaring the fields
     * @param raw    raw bundle for one host
     * @return extracted fields and path coverage
     */
    public ExtractionResult extract(Schema schema, Map<String, ?> raw) {
        Objects.requireNonNull(schema, "schema must not be null");
        Map<String, ?> bundle = raw != null ? raw : Map.of();

        PathPass paths = pathPass(schema, bundle);
        Map<String, Object> fields = computePass(schema, paths.fields, false);
        fields = scriptPass(schema, fields);
        fields = computePass(schema, fields, true);
        return new ExtractionResult(fields, paths.coverage);
    }

    // ---------------------------------------------------------------
    // Passes
    // ---------------------------------------------------------------

    private PathPass pathPass(Schema schema, Map<String, ?> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        int total = 0;
        int resolved = 0;
        int broken = 0;
        for (Map.Entry<String, FieldSpec> e : schema.getFields().entrySet()) {
            FieldSpec spec = e.getValue();
            if (!(spec.getSource() instanceof FieldSource.Path source)) {
                continue;
            }
            total++;
            Optional<Object> value = resolver.resolve(source.path(), raw);
            if (value.isEmpty() && schema.getBrokenPaths().contains(e.getKey())) {
                out.put(e.getKey(), spec.sentinel());
                broken++;
            } else {
                if (value.isPresent()) {
                    resolved++;
                } else {
                    LOG.trace("Field '{}' absent at '{}'", e.getKey(), source.path());
                }
                out.put(e.getKey(), ValueCoercer.coerce(value.orElse(null), spec.getType(), spec.getFallback()));
            }
        }
        return new PathPass(freeze(out), new Coverage(resolved, total, broken));
    }

    private Map<String, Object> computePass(Schema schema, Map<String, Object> previous, boolean second) {
        Map<String, Object> out = new LinkedHashMap<>(previous);
        for (Map.Entry<String, FieldSpec> e : schema.getFields().entrySet()) {
            FieldSpec spec = e.getValue();
            if (!(spec.getSource() instanceof FieldSource.Compute source)) {
                continue;
            }
            try {
                double result = evaluator.evaluate(source.expression(), freeze(out));
                out.put(e.getKey(), ValueCoercer.coerce(result, spec.getType(), spec.getFallback()));
            } catch (ExpressionException ex) {
                LOG.warn("Compute field '{}'{} failed: {}", e.getKey(), second ? " (second pass)" : "", ex.getMessage());
                if (!out.containsKey(e.getKey())) {
                    out.put(e.getKey(), spec.sentinel());
                }
            }
        }
        return freeze(out);
    }

    private Map<String, Object> scriptPass(Schema schema, Map<String, Object> previous) {
        Map<String, Object> out = new LinkedHashMap<>(previous);
        Path schemaSource = schema.getSourcePath().orElse(null);
        for (Map.Entry<String, FieldSpec> e : schema.getFields().entrySet()) {
            FieldSpec spec = e.getValue();
            if (!(spec.getSource() instanceof FieldSource.Script source)) {
                continue;
            }
            Optional<Path> script = locator.locate(source.script(), schemaSource);
            if (script.isEmpty()) {
                LOG.warn("Script not found for field '{}': {}", e.getKey(), source.script());
                out.put(e.getKey(), spec.sentinel());
                continue;
            }
            ScriptResult result = runScript(script.get(), freeze(out), source);
            Object value = switch (result.getStatus()) {
                case SUCCESS -> ValueCoercer.coerce(result.getValue(), spec.getType(), spec.getFallback());
                case ABSENT -> spec.getFallback();
                case BROKEN -> spec.sentinel();
            };
            out.put(e.getKey(), value);
        }
        return freeze(out);
    }

    private ScriptResult runScript(Path script, Map<String, Object> fields, FieldSource.Script source) {
        try {
            ScriptResult result = scripts.run(script, fields, source.args(),
                    Duration.ofSeconds(source.timeoutSeconds()));
            return result != null ? result : ScriptResult.broken("executor returned no result");
        } catch (RuntimeException ex) {
            LOG.warn("Script {} failed: {}", script, ex.toString());
            return ScriptResult.broken(ex.toString());
        }
    }

    private static Map<String, Object> freeze(Map<String, Object> m) {
        return Collections.unmodifiableMap(m);
    }

    private record PathPass(Map<String, Object> fields, Coverage coverage) {
    }
}
