package com.fleetaudit.core.script;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Runs a helper script that computes one field value.
 *
 * <p>
 * Implementations must never throw for a misbehaving script: every failure is
 * reported as {@link ScriptResult#broken(String)}. Tests substitute a lambda
 * for the process-based {@link ProcessScriptExecutor}.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ScriptExecutor {

    /**
     * @param script  resolved script file
     * @param fields  fields extracted so far, passed to the script as {@code "fields"}
     * @param args    static arguments from the schema, passed as {@code "args"}
     * @param timeout maximum run time before the script is killed
     * @return the outcome, never {@code null}
     */
    ScriptResult run(Path script, Map<String, ?> fields, Map<String, ?> args, Duration timeout);
}
