package com.fleetaudit.core.field;

import com.fleetaudit.core.expression.ExpressionEvaluator;
import com.fleetaudit.core.model.FieldSource;
import com.fleetaudit.core.model.FieldSpec;
import com.fleetaudit.core.model.FieldType;
import com.fleetaudit.core.model.Schema;
import com.fleetaudit.core.script.ScriptExecutor;
import com.fleetaudit.core.script.ScriptLocator;
import com.fleetaudit.core.script.ScriptResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FieldExtractor}.
 */
class FieldExtractorTest {

    @TempDir
    Path scriptsDir;

    private final Map<String, ScriptResult> scriptResults = new HashMap<>();
    private final List<Map<String, Object>> scriptInputs = new ArrayList<>();
    private FieldExtractor extractor;

    @BeforeEach
    void setUp() {
        ScriptExecutor executor = (script, fields, args, timeout) -> {
            Map<String, Object> input = new HashMap<>(fields);
            input.put("__args", args);
            input.put("__timeout", timeout);
            scriptInputs.add(input);
            return scriptResults.getOrDefault(script.getFileName().toString(), ScriptResult.absent());
        };
        extractor = new FieldExtractor(new FieldResolver(), new ExpressionEvaluator(), executor,
                new ScriptLocator(scriptsDir));
    }

    @Test
    @DisplayName("Should compute a CPU percentage from path fields")
    void shouldComputeCpuPercent() {
        Schema schema = Schema.builder("host")
                .field("cpu_used", FieldSpec.path("cpu.used", FieldType.FLOAT, 0.0))
                .field("cpu_total", FieldSpec.path("cpu.total", FieldType.FLOAT, 0.0))
                .field("cpu_pct", FieldSpec.compute("{cpu_used} / {cpu_total} * 100", FieldType.FLOAT, 0.0))
                .build();

        ExtractionResult result = extractor.extract(schema, Map.of("cpu", Map.of("used", 50, "total", 200)));

        assertThat(result.fields())
                .containsEntry("cpu_used", 50.0)
                .containsEntry("cpu_total", 200.0)
                .containsEntry("cpu_pct", 25.0);
        assertThat(result.coverage()).isEqualTo(new Coverage(2, 2, 0));
    }

    @Test
    @DisplayName("Should count resolved, absent and broken path fields")
    void shouldCountCoverage() {
        Schema schema = Schema.builder("host")
                .field("hostname", FieldSpec.path("facts.hostname", FieldType.STR, "unknown"))
                .field("kernel", FieldSpec.path("facts.kernel", FieldType.STR, "unknown"))
                .field("uptime", FieldSpec.path("facts.uptime_s", FieldType.INT, 0L))
                .field("cores", FieldSpec.path("facts.cores", FieldType.INT, 0L))
                .brokenPaths(Set.of("uptime", "cores"))
                .build();

        ExtractionResult result = extractor.extract(schema,
                Map.of("facts", Map.of("hostname", "web01", "cores", 8)));

        assertThat(result.fields())
                .containsEntry("hostname", "web01")
                .containsEntry("kernel", "unknown")
                .containsEntry("uptime", -1L)
                .containsEntry("cores", 8L);
        assertThat(result.coverage()).isEqualTo(new Coverage(2, 4, 1));
    }

    @Test
    @DisplayName("Should prefer an explicit sentinel for broken paths")
    void shouldUseExplicitSentinel() {
        FieldSpec spec = FieldSpec.builder()
                .source(new FieldSource.Path("facts.state"))
                .type(FieldType.STR)
                .fallback("ok")
                .sentinel("BROKEN")
                .build();
        Schema schema = Schema.builder("host").field("state", spec).build().withBrokenPaths(Set.of("state"));

        assertThat(extractor.extract(schema, Map.of()).fields()).containsEntry("state", "BROKEN");
    }

    @Test
    @DisplayName("Should use the sentinel when a compute expression is invalid")
    void shouldUseSentinelForBadExpression() {
        Schema schema = Schema.builder("host")
                .field("bad", FieldSpec.compute("{a} ** 2", FieldType.FLOAT, 0.0))
                .build();

        assertThat(extractor.extract(schema, Map.of()).fields()).containsEntry("bad", -1.0);
    }

    @Test
    @DisplayName("Should coerce compute results to the declared type")
    void shouldCoerceComputeResult() {
        Schema schema = Schema.builder("host")
                .field("mem_mb", FieldSpec.path("mem.bytes", FieldType.INT, 0L))
                .field("mem_gb", FieldSpec.compute("{mem_mb} / 1024", FieldType.INT, 0L))
                .build();

        assertThat(extractor.extract(schema, Map.of("mem", Map.of("bytes", 3000))).fields())
                .containsEntry("mem_gb", 2L);
    }

    @Test
    @DisplayName("Should let a compute field use computes declared before it")
    void shouldChainComputeFields() {
        Schema schema = Schema.builder("host")
                .field("x", FieldSpec.path("x", FieldType.FLOAT, 0.0))
                .field("a", FieldSpec.compute("{x} * 2", FieldType.FLOAT, 0.0))
                .field("b", FieldSpec.compute("{a} + 1", FieldType.FLOAT, 0.0))
                .field("c", FieldSpec.compute("{b} + 1", FieldType.FLOAT, 0.0))
                .build();

        assertThat(extractor.extract(schema, Map.of("x", 10)).fields())
                .containsEntry("x", 10.0)
                .containsEntry("a", 20.0)
                .containsEntry("b", 21.0)
                .containsEntry("c", 22.0);
    }

    @Test
    @DisplayName("Should pass the output of an earlier script to a later one")
    void shouldChainScriptFields() throws IOException {
        touch("one.sh");
        touch("two.sh");
        FieldExtractor chaining = new FieldExtractor(new FieldResolver(), new ExpressionEvaluator(),
                (script, fields, args, timeout) -> "one.sh".equals(script.getFileName().toString())
                        ? ScriptResult.success(5)
                        : ScriptResult.success(fields.get("one")),
                new ScriptLocator(scriptsDir));
        Schema schema = Schema.builder("host")
                .field("one", FieldSpec.script(new FieldSource.Script("one.sh"), FieldType.INT, 0L))
                .field("two", FieldSpec.script(new FieldSource.Script("two.sh"), FieldType.INT, 0L))
                .build();

        assertThat(chaining.extract(schema, Map.of()).fields())
                .containsEntry("one", 5L)
                .containsEntry("two", 5L);
    }

    @Test
    @DisplayName("Should map script outcomes to value, fallback and sentinel")
    void shouldMapScriptOutcomes() throws IOException {
        touch("ok.sh");
        touch("absent.sh");
        touch("broken.sh");
        scriptResults.put("ok.sh", ScriptResult.success("7"));
        scriptResults.put("absent.sh", ScriptResult.absent());
        scriptResults.put("broken.sh", ScriptResult.broken("exit code 2"));

        Schema schema = Schema.builder("host")
                .field("ok", FieldSpec.script(new FieldSource.Script("ok.sh"), FieldType.INT, 0L))
                .field("absent", FieldSpec.script(new FieldSource.Script("absent.sh"), FieldType.INT, 0L))
                .field("broken", FieldSpec.script(new FieldSource.Script("broken.sh"), FieldType.INT, 0L))
                .field("missing", FieldSpec.script(new FieldSource.Script("nope.sh"), FieldType.STR, ""))
                .build();

        Map<String, Object> fields = extractor.extract(schema, Map.of()).fields();

        assertThat(fields)
                .containsEntry("ok", 7L)
                .containsEntry("absent", 0L)
                .containsEntry("broken", -1L)
                .containsEntry("missing", "ERROR");
    }

    @Test
    @DisplayName("Should pass prior fields, args and timeout to scripts")
    void shouldPassContextToScripts() throws IOException {
        touch("disks.sh");
        scriptResults.put("disks.sh", ScriptResult.success(List.of()));
        Schema schema = Schema.builder("host")
                .field("hostname", FieldSpec.path("hostname", FieldType.STR, ""))
                .field("double_cores", FieldSpec.compute("{cores} * 2", FieldType.INT, 0L))
                .field("disks", FieldSpec.script(new FieldSource.Script("disks.sh", Map.of("min_gb", 5), 12),
                        FieldType.LIST, List.of()))
                .build();

        extractor.extract(schema, Map.of("hostname", "web01"));

        assertThat(scriptInputs).hasSize(1);
        assertThat(scriptInputs.get(0))
                .containsEntry("hostname", "web01")
                .containsEntry("double_cores", 0L)
                .containsEntry("__args", Map.of("min_gb", 5))
                .containsEntry("__timeout", Duration.ofSeconds(12))
                .doesNotContainKey("disks");
    }

    @Test
    @DisplayName("Should re-evaluate compute fields after scripts")
    void shouldRecomputeAfterScripts() throws IOException {
        touch("count.sh");
        scriptResults.put("count.sh", ScriptResult.success(3));
        Schema schema = Schema.builder("host")
                .field("doubled", FieldSpec.compute("{disk_count} * 2", FieldType.FLOAT, 0.0))
                .field("disk_count", FieldSpec.script(new FieldSource.Script("count.sh"), FieldType.INT, 0L))
                .build();

        Map<String, Object> fields = extractor.extract(schema, Map.of()).fields();

        assertThat(fields).containsEntry("disk_count", 3L).containsEntry("doubled", 6.0);
    }

    @Test
    @DisplayName("Should treat an executor exception as a broken script")
    void shouldContainExecutorExceptions() throws IOException {
        touch("boom.sh");
        FieldExtractor failing = new FieldExtractor(new FieldResolver(), new ExpressionEvaluator(),
                (script, fields, args, timeout) -> {
                    throw new IllegalStateException("boom");
                }, new ScriptLocator(scriptsDir));
        Schema schema = Schema.builder("host")
                .field("value", FieldSpec.script(new FieldSource.Script("boom.sh"), FieldType.FLOAT, 0.0))
                .build();

        assertThat(failing.extract(schema, Map.of()).fields()).containsEntry("value", -1.0);
    }

    @Test
    @DisplayName("Should return an unmodifiable field map")
    void shouldReturnUnmodifiableFields() {
        Schema schema = Schema.builder("host")
                .field("hostname", FieldSpec.path("hostname", FieldType.STR, null))
                .build();

        Map<String, Object> fields = extractor.extract(schema, Map.of()).fields();

        assertThat(fields).containsEntry("hostname", null);
        assertThatThrownBy(() -> fields.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void touch(String name) throws IOException {
        Files.writeString(scriptsDir.resolve(name), "#!/bin/sh\n");
    }
}
