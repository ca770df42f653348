package com.fleetaudit.core.config;

import com.fleetaudit.core.field.FieldResolver;
import com.fleetaudit.core.model.FieldSource;
import com.fleetaudit.core.model.FieldSpec;
import com.fleetaudit.core.model.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads and validates {@link Schema}s from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value NormalizerConfig#ENV_SCHEMA_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(Path)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Broken paths</h3>
 * <p>
 * When a schema is loaded from a file and a {@code <name>.example.yaml} bundle
 * sits next to it, every path field is resolved against that example. Fields
 * that do not resolve are logged and recorded in
 * {@link Schema#getBrokenPaths()}, so extraction shows their sentinel instead
 * of a harmless-looking fallback.
 * </p>
 *
 * @since 1.0.0
 */
public final class SchemaLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaLoader.class);

    /** Classpath resource used when no schema path is configured. */
    public static final String DEFAULT_RESOURCE = "schema.yml";

    private static final String EXAMPLE_SUFFIX = ".example.yaml";

    private SchemaLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the schema using automatic resolution.
     *
     * <ol>
     * <li>If {@code FLEETAUDIT_SCHEMA_PATH} is set and the file exists, load
     * from there.</li>
     * <li>Otherwise, fall back to {@code schema.yml} on the classpath.</li>
     * </ol>
     *
     * @return parsed and validated schema
     * @throws IllegalStateException if schema validation fails
     */
    public static Schema load() {
        return load(NormalizerConfig.fromEnvironment());
    }

    static Schema load(NormalizerConfig config) {
        Path path = config.getSchemaPath();
        if (path != null && Files.exists(path)) {
            LOG.info("Loading schema from configured path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading schema from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load a schema from a file system path.
     *
     * @param path YAML file; must not be {@code null}
     * @return parsed and validated schema remembering its source path
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static Schema fromFile(Path path) {
        Objects.requireNonNull(path, "Schema file path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Schema file not found: " + path);
        }
        Map<?, ?> document;
        try (InputStream is = Files.newInputStream(path)) {
            document = readMapping(is, path.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema file: " + path, e);
        }
        Schema schema = SchemaParser.parse(document).withSourcePath(path);
        schema = attachBrokenPaths(schema);
        LOG.info("Loaded schema '{}' from {} ({} field(s), {} alert rule(s))",
                schema.getName(), path, schema.getFields().size(), schema.getAlerts().size());
        return schema;
    }

    /**
     * Load a schema from a classpath resource. Classpath schemas have no
     * source path, so no example bundle or relative script lookup applies.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated schema
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static Schema fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SchemaLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            Schema schema = SchemaParser.parse(readMapping(is, resource));
            LOG.info("Loaded schema '{}' from classpath:{}", schema.getName(), resource);
            return schema;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Resolve every path field of a schema against an example bundle.
     *
     * @param schema  schema to check
     * @param example example raw bundle
     * @return field name to problem description, for each path that resolves
     *         to nothing; compute and script fields are not checked
     */
    public static Map<String, String> validatePaths(Schema schema, Map<String, ?> example) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(example, "example must not be null");
        FieldResolver resolver = new FieldResolver();
        Map<String, String> broken = new LinkedHashMap<>();
        for (Map.Entry<String, FieldSpec> e : schema.getFields().entrySet()) {
            if (e.getValue().getSource() instanceof FieldSource.Path source
                    && resolver.resolve(source.path(), example).isEmpty()) {
                broken.put(e.getKey(), "field '" + e.getKey() + "': path '" + source.path()
                        + "' resolves to nothing (check path segments against the example file)");
            }
        }
        return broken;
    }

    /**
     * @param schema a schema loaded from a file
     * @return contents of {@code <name>.example.yaml} next to the schema file,
     *         or empty if there is none or it cannot be read
     */
    public static Optional<Map<String, Object>> loadExampleBundle(Schema schema) {
        Optional<Path> example = schema.getSourcePath()
                .map(p -> p.toAbsolutePath().resolveSibling(schema.getName() + EXAMPLE_SUFFIX))
                .filter(Files::isRegularFile);
        if (example.isEmpty()) {
            return Optional.empty();
        }
        try (InputStream is = Files.newInputStream(example.get())) {
            Map<String, Object> bundle = new LinkedHashMap<>();
            readMapping(is, example.get().toString()).forEach((k, v) -> bundle.put(String.valueOf(k), v));
            return Optional.of(bundle);
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to load example bundle {}: {}", example.get(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Resolve the schema's {@code template_override} relative to its file.
     *
     * @param schema schema to inspect
     * @return the template file, or empty if no override is declared, the
     *         schema has no source path, or the file does not exist
     */
    public static Optional<Path> resolveTemplate(Schema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        if (schema.getTemplateOverride().isEmpty() || schema.getSourcePath().isEmpty()) {
            return Optional.empty();
        }
        Path candidate = schema.getSourcePath().get().toAbsolutePath()
                .resolveSibling(schema.getTemplateOverride().get());
        return Files.exists(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Schema attachBrokenPaths(Schema schema) {
        Optional<Map<String, Object>> example = loadExampleBundle(schema);
        if (example.isEmpty()) {
            return schema;
        }
        Map<String, String> broken = validatePaths(schema, example.get());
        broken.values().forEach(msg -> LOG.warn("Schema '{}': {}", schema.getName(), msg));
        return schema.withBrokenPaths(broken.keySet());
    }

    static Map<?, ?> readMapping(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object document;
        try {
            document = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Invalid YAML in " + origin + ": " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalStateException("Not a YAML mapping: " + origin);
        }
        return map;
    }
}
