package com.fleetaudit.core.config;

import com.fleetaudit.core.model.Schema;
import com.fleetaudit.core.model.Widget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SchemaLoader}.
 */
class SchemaLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should load the default schema from the classpath")
    void shouldLoadFromClasspath() {
        Schema schema = SchemaLoader.fromClasspath(SchemaLoader.DEFAULT_RESOURCE);

        assertThat(schema.getName()).isEqualTo("linux");
        assertThat(schema.getDisplayName()).isEqualTo("Linux Server");
        assertThat(schema.getFields()).containsKeys("hostname", "mem_used_pct", "mounts");
        assertThat(schema.getAlerts()).hasSize(5);
        assertThat(schema.getWidgets()).extracting(Widget::type)
                .containsExactly(Widget.KEY_VALUE, Widget.TABLE, Widget.ALERT_PANEL);
        assertThat(schema.getSourcePath()).isEmpty();
        assertThat(schema.getBrokenPaths()).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to the classpath when no schema path is configured")
    void shouldFallBackToClasspath() {
        NormalizerConfig config = NormalizerConfig.builder().schemaPath(dir.resolve("absent.yml").toString()).build();

        assertThat(SchemaLoader.load(config).getName()).isEqualTo("linux");
    }

    @Test
    @DisplayName("Should prefer the configured schema path when the file exists")
    void shouldLoadConfiguredPath() throws IOException {
        Path file = write("custom.yml", "name: custom\n");
        NormalizerConfig config = NormalizerConfig.builder().schemaPath(file.toString()).build();

        Schema schema = SchemaLoader.load(config);

        assertThat(schema.getName()).isEqualTo("custom");
        assertThat(schema.getSourcePath()).contains(file);
    }

    @Test
    @DisplayName("Should mark paths missing from the example bundle as broken")
    void shouldDetectBrokenPaths() throws URISyntaxException {
        Path vcenter = Path.of(getClass().getClassLoader().getResource("schemas/vcenter.yaml").toURI());

        Schema schema = SchemaLoader.fromFile(vcenter);

        assertThat(schema.getBrokenPaths()).containsExactly("build");
        assertThat(SchemaLoader.loadExampleBundle(schema)).get()
                .satisfies(bundle -> assertThat(bundle).containsKeys("vcenter_info", "datastores"));
    }

    @Test
    @DisplayName("Should report every unresolved path field")
    void shouldValidatePaths() {
        Schema schema = SchemaLoader.fromClasspath(SchemaLoader.DEFAULT_RESOURCE);
        Map<String, Object> example = Map.of("ansible_facts", Map.of("hostname", "web01", "memtotal_mb", 2048));

        Map<String, String> broken = SchemaLoader.validatePaths(schema, example);

        assertThat(broken).containsOnlyKeys("distribution", "mem_free_mb", "mounts", "failed_units");
        assertThat(broken.get("mounts")).contains("ansible_facts.mounts");
    }

    @Test
    @DisplayName("Should resolve the template override next to the schema file")
    void shouldResolveTemplate() throws IOException {
        Path file = write("site.yml", "name: site\ntemplate_override: site.html.j2\n");
        Schema schema = SchemaLoader.fromFile(file);

        assertThat(SchemaLoader.resolveTemplate(schema)).isEmpty();

        Path template = write("site.html.j2", "<html></html>");

        assertThat(SchemaLoader.resolveTemplate(schema)).contains(template.toAbsolutePath());
    }

    @Test
    @DisplayName("Should throw IllegalArgumentException for a missing file or resource")
    void shouldRejectMissingSources() {
        assertThatThrownBy(() -> SchemaLoader.fromFile(dir.resolve("nope.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Schema file not found");
        assertThatThrownBy(() -> SchemaLoader.fromClasspath("no-such-schema.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Classpath resource not found");
    }

    @Test
    @DisplayName("Should reject duplicate keys, bad YAML and non-mapping documents")
    void shouldRejectMalformedYaml() throws IOException {
        Path duplicate = write("dup.yml", "name: a\nname: b\n");
        Path list = write("list.yml", "- name: a\n");

        assertThatThrownBy(() -> SchemaLoader.fromFile(duplicate))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid YAML");
        assertThatThrownBy(() -> SchemaLoader.fromFile(list))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Not a YAML mapping");
        assertThatThrownBy(() -> SchemaLoader.readMapping(
                new ByteArrayInputStream("a: [1, 2".getBytes(StandardCharsets.UTF_8)), "inline"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid YAML in inline");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }
}
