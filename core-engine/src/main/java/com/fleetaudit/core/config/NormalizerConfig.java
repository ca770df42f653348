package com.fleetaudit.core.config;

import java.io.File;
import java.io.Serializable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration for the normalizer and its collaborators.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so a
 * collector wrapper can point the core at its scripts and schemas without
 * code changes.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@code FLEETAUDIT_SCRIPTS_DIR}: helper scripts directory installed by the
 * deployer (default {@code scripts})</li>
 * <li>{@code FLEETAUDIT_PYTHON}: interpreter used for {@code .py} scripts
 * (default {@code python3})</li>
 * <li>{@code FLEETAUDIT_SCHEMA_PATH}: schema file for {@link SchemaLoader#load()}</li>
 * <li>{@code FLEETAUDIT_SCHEMA_DIRS}: extra schema directories separated by
 * {@link File#pathSeparator}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class NormalizerConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_SCRIPTS_DIR = "FLEETAUDIT_SCRIPTS_DIR";
    public static final String ENV_PYTHON = "FLEETAUDIT_PYTHON";
    public static final String ENV_SCHEMA_PATH = "FLEETAUDIT_SCHEMA_PATH";
    public static final String ENV_SCHEMA_DIRS = "FLEETAUDIT_SCHEMA_DIRS";

    private final String scriptsDir;
    private final String pythonExecutable;
    private final String schemaPath;
    private final List<String> schemaDirs;

    private NormalizerConfig(Builder b) {
        this.scriptsDir = b.scriptsDir;
        this.pythonExecutable = b.pythonExecutable;
        this.schemaPath = b.schemaPath;
        this.schemaDirs = List.copyOf(b.schemaDirs);
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * Build a {@link NormalizerConfig} from environment variables.
     *
     * @return fully populated configuration
     */
    public static NormalizerConfig fromEnvironment() {
        Builder b = new Builder()
                .scriptsDir(env(ENV_SCRIPTS_DIR, "scripts"))
                .pythonExecutable(env(ENV_PYTHON, "python3"))
                .schemaPath(env(ENV_SCHEMA_PATH, ""));
        for (String dir : env(ENV_SCHEMA_DIRS, "").split(File.pathSeparator)) {
            if (!dir.isBlank()) {
                b.schemaDir(dir.trim());
            }
        }
        return b.build();
    }

    /**
     * @return configuration with all defaults, ignoring the environment
     */
    public static NormalizerConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getScriptsDir() {
        return Path.of(scriptsDir);
    }

    public String getPythonExecutable() {
        return pythonExecutable;
    }

    /**
     * @return configured schema file, or {@code null} when unset
     */
    public Path getSchemaPath() {
        return schemaPath.isEmpty() ? null : Path.of(schemaPath);
    }

    public List<Path> getSchemaDirs() {
        List<Path> dirs = new ArrayList<>(schemaDirs.size());
        schemaDirs.forEach(d -> dirs.add(Path.of(d)));
        return dirs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link NormalizerConfig}. {@link #build()} rejects
     * blank script directories and interpreters.
     */
    public static class Builder {
        private String scriptsDir = "scripts";
        private String pythonExecutable = "python3";
        private String schemaPath = "";
        private final List<String> schemaDirs = new ArrayList<>();

        public Builder scriptsDir(String v) {
            this.scriptsDir = v;
            return this;
        }

        public Builder pythonExecutable(String v) {
            this.pythonExecutable = v;
            return this;
        }

        public Builder schemaPath(String v) {
            this.schemaPath = v != null ? v : "";
            return this;
        }

        public Builder schemaDir(String v) {
            this.schemaDirs.add(Objects.requireNonNull(v, "schemaDir must not be null"));
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link NormalizerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public NormalizerConfig build() {
            requireNonBlank(scriptsDir, "scriptsDir");
            requireNonBlank(pythonExecutable, "pythonExecutable");
            return new NormalizerConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "NormalizerConfig{" +
                "scriptsDir='" + scriptsDir + '\'' +
                ", pythonExecutable='" + pythonExecutable + '\'' +
                ", schemaPath='" + schemaPath + '\'' +
                ", schemaDirs=" + schemaDirs +
                '}';
    }
}
