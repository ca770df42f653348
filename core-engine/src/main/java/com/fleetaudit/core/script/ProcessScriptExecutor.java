package com.fleetaudit.core.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fleetaudit.core.config.NormalizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ScriptExecutor} that launches the script as a child process.
 *
 * <h3>Protocol</h3>
 * <p>
 * The process receives {@code {"fields": {...}, "args": {...}}} as JSON on
 * stdin and must print a single JSON value on stdout. Exit code 0 is success,
 * 1 means "absent", anything else is broken.
 * </p>
 *
 * <h3>Launching</h3>
 * <p>
 * {@code .py} files run through the configured Python interpreter,
 * {@code .sh} files through {@code sh}; anything else is executed directly.
 * stdin is written and stdout/stderr are drained on helper threads, so a
 * script that never reads its input still honours the timeout. On timeout
 * the process and its descendants are destroyed forcibly.
 * </p>
 *
 * @since 1.0.0
 */
public class ProcessScriptExecutor implements ScriptExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessScriptExecutor.class);

    /** How long to wait for the output pipes to close once the process has exited. */
    private static final long DRAIN_GRACE_MS = 2_000;

    private static final int STDERR_EXCERPT = 200;

    private static final ExecutorService IO_POOL = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "fleetaudit-script-io");
        t.setDaemon(true);
        return t;
    });

    private final String pythonExecutable;
    private final ObjectMapper mapper;

    public ProcessScriptExecutor(NormalizerConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.pythonExecutable = config.getPythonExecutable();
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    public ProcessScriptExecutor() {
        this(NormalizerConfig.defaults());
    }

    @Override
    public ScriptResult run(Path script, Map<String, ?> fields, Map<String, ?> args, Duration timeout) {
        Objects.requireNonNull(script, "script must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        byte[] payload;
        try {
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("fields", fields != null ? fields : Map.of());
            input.put("args", args != null ? args : Map.of());
            payload = mapper.writeValueAsBytes(input);
        } catch (JsonProcessingException e) {
            return broken(script, "cannot encode input: " + e.getOriginalMessage());
        }

        Process process;
        try {
            process = new ProcessBuilder(command(script)).start();
        } catch (IOException e) {
            return broken(script, "launch failed: " + e.getMessage());
        }

        CompletableFuture.runAsync(() -> writeInput(process, payload), IO_POOL);
        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(
                () -> drain(process.getInputStream()), IO_POOL);
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(
                () -> drain(process.getErrorStream()), IO_POOL);

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                kill(process);
                return broken(script, "timed out after " + timeout.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            return broken(script, "interrupted");
        }

        int exit = process.exitValue();
        if (exit == 1) {
            LOG.debug("Script {} reported no value", script);
            return ScriptResult.absent();
        }
        if (exit != 0) {
            return broken(script, "exit code " + exit + excerpt(stderr));
        }

        String out;
        try {
            out = new String(stdout.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS), StandardCharsets.UTF_8).trim();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return broken(script, "interrupted");
        } catch (ExecutionException | TimeoutException e) {
            return broken(script, "cannot read output: " + e);
        }
        if (out.isEmpty()) {
            return broken(script, "no output");
        }
        try {
            Object value = mapper.readValue(out, Object.class);
            LOG.debug("Script {} returned {}", script, value);
            return ScriptResult.success(value);
        } catch (JsonProcessingException e) {
            return broken(script, "invalid JSON output: " + e.getOriginalMessage());
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    List<String> command(Path script) {
        String name = script.getFileName().toString().toLowerCase(Locale.ROOT);
        List<String> cmd = new ArrayList<>(2);
        if (name.endsWith(".py")) {
            cmd.add(pythonExecutable);
        } else if (name.endsWith(".sh")) {
            cmd.add("sh");
        }
        cmd.add(script.toString());
        return cmd;
    }

    private static void writeInput(Process process, byte[] payload) {
        try (OutputStream os = process.getOutputStream()) {
            os.write(payload);
        } catch (IOException e) {
            // scripts may exit without reading stdin
            LOG.trace("stdin closed early: {}", e.getMessage());
        }
    }

    private static byte[] drain(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String excerpt(CompletableFuture<byte[]> stderr) {
        try {
            String err = new String(stderr.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS), StandardCharsets.UTF_8).trim();
            if (err.isEmpty()) {
                return "";
            }
            return ": " + (err.length() > STDERR_EXCERPT ? err.substring(0, STDERR_EXCERPT) + "..." : err);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            return "";
        }
    }

    private static ScriptResult broken(Path script, String reason) {
        LOG.warn("Script {} broken: {}", script, reason);
        return ScriptResult.broken(reason);
    }
}
