package com.fleetaudit.core.config;

import com.fleetaudit.core.model.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Schemas discovered in a list of directories, keyed by schema name.
 *
 * <p>
 * Directories are scanned in order, non-recursively, for {@code *.yaml} and
 * {@code *.yml} files; example bundles ({@code *.example.yaml}) are skipped.
 * When two files declare the same schema name, the first one found wins.
 * Files that fail to load are logged and skipped so one broken schema does
 * not hide the others.
 * </p>
 *
 * @since 1.0.0
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    /** Working-directory schema folder scanned after the configured directories. */
    public static final Path LOCAL_SCHEMAS_DIR = Path.of("schemas");

    private final Map<String, Schema> schemas;

    private SchemaRegistry(Map<String, Schema> schemas) {
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
    }

    /**
     * Scan the configured schema directories followed by {@code ./schemas}.
     *
     * @param config configuration naming extra schema directories
     * @return the registry
     */
    public static SchemaRegistry discover(NormalizerConfig config) {
        List<Path> dirs = new ArrayList<>(config.getSchemaDirs());
        dirs.add(LOCAL_SCHEMAS_DIR);
        return discover(dirs);
    }

    /**
     * @param directories directories to scan, in priority order
     * @return the registry
     */
    public static SchemaRegistry discover(List<Path> directories) {
        Objects.requireNonNull(directories, "directories must not be null");
        Map<String, Schema> found = new LinkedHashMap<>();
        for (Path dir : directories) {
            scan(dir, found);
        }
        LOG.info("Discovered {} schema(s): {}", found.size(), found.keySet());
        return new SchemaRegistry(found);
    }

    public Optional<Schema> get(String name) {
        return Optional.ofNullable(schemas.get(name));
    }

    public Collection<Schema> all() {
        return schemas.values();
    }

    public int size() {
        return schemas.size();
    }

    /**
     * @param bundle raw bundle for one host
     * @return schemas whose detection keys match the bundle's top-level keys,
     *         in discovery order
     */
    public List<Schema> detect(Map<String, ?> bundle) {
        Objects.requireNonNull(bundle, "bundle must not be null");
        List<Schema> matched = new ArrayList<>();
        for (Schema schema : schemas.values()) {
            if (schema.getDetection().matches(bundle)) {
                matched.add(schema);
            }
        }
        return matched;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void scan(Path dir, Map<String, Schema> found) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(Files::isRegularFile)
                    .filter(SchemaRegistry::isSchemaFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            LOG.warn("Cannot list schema directory {}: {}", dir, e.getMessage());
            return;
        }
        for (Path file : files) {
            Schema schema;
            try {
                schema = SchemaLoader.fromFile(file);
            } catch (IllegalArgumentException | IllegalStateException e) {
                LOG.warn("Failed to load schema {}: {}", file, e.getMessage());
                continue;
            }
            if (found.containsKey(schema.getName())) {
                LOG.debug("Schema '{}' already registered; skipping {}", schema.getName(), file);
            } else {
                found.put(schema.getName(), schema);
                LOG.debug("Registered schema '{}' from {}", schema.getName(), file);
            }
        }
    }

    static boolean isSchemaFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        String stem;
        if (name.endsWith(".yaml")) {
            stem = name.substring(0, name.length() - 5);
        } else if (name.endsWith(".yml")) {
            stem = name.substring(0, name.length() - 4);
        } else {
            return false;
        }
        return !stem.endsWith(".example");
    }
}
