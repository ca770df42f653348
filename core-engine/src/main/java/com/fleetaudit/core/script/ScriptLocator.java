package com.fleetaudit.core.script;

import com.fleetaudit.core.config.NormalizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the {@code script} reference of a field to a file.
 *
 * <p>
 * Lookup order: an absolute path as-is, then relative to the directory of
 * the schema file, then relative to the working directory, then inside the
 * built-in scripts directory. The first regular file found wins.
 * </p>
 *
 * @since 1.0.0
 */
public class ScriptLocator {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptLocator.class);

    private final Path builtinDir;

    public ScriptLocator(Path builtinDir) {
        this.builtinDir = Objects.requireNonNull(builtinDir, "builtinDir must not be null");
    }

    public ScriptLocator(NormalizerConfig config) {
        this(config.getScriptsDir());
    }

    /**
     * @param script       script reference as written in the schema
     * @param schemaSource file the schema was loaded from, or {@code null}
     * @return the script file, or empty if none of the candidates exist
     */
    public Optional<Path> locate(String script, Path schemaSource) {
        if (script == null || script.isBlank()) {
            return Optional.empty();
        }
        Path ref;
        try {
            ref = Path.of(script);
        } catch (InvalidPathException e) {
            LOG.warn("Invalid script reference '{}': {}", script, e.getMessage());
            return Optional.empty();
        }
        return candidates(ref, schemaSource).stream()
                .filter(Files::isRegularFile)
                .findFirst();
    }

    private List<Path> candidates(Path ref, Path schemaSource) {
        List<Path> out = new ArrayList<>(3);
        if (ref.isAbsolute()) {
            out.add(ref);
            return out;
        }
        if (schemaSource != null) {
            Path dir = schemaSource.toAbsolutePath().getParent();
            if (dir != null) {
                out.add(dir.resolve(ref));
            }
        }
        out.add(ref.toAbsolutePath());
        out.add(builtinDir.resolve(ref));
        return out;
    }

    public Path getBuiltinDir() {
        return builtinDir;
    }
}
