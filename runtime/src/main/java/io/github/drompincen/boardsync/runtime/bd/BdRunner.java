package io.github.drompincen.boardsync.runtime.bd;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@code bd} command line tool. Arguments are passed as a vector, never
 * through a shell. Every run points bd at the workspace database via {@code BEADS_DB}.
 */
@Component
public class BdRunner {

    private static final Logger log = LoggerFactory.getLogger(BdRunner.class);

    private final ObjectMapper objectMapper;
    private final String bin;
    private final long timeoutMs;

    public BdRunner(ObjectMapper objectMapper,
                    @Value("${boardsync.bd.bin:${BD_BIN:bd}}") String bin,
                    @Value("${boardsync.bd.timeout-ms:30000}") long timeoutMs) {
        this.objectMapper = objectMapper;
        this.bin = bin == null || bin.isBlank() ? "bd" : bin;
        this.timeoutMs = timeoutMs;
    }

    public String bin() {
        return bin;
    }

    public BdResult run(List<String> args, WorkspaceConfig workspace) {
        List<String> command = new ArrayList<>();
        command.add(bin);
        command.addAll(args);
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(Path.of(workspace.rootDir()).toFile())
                .redirectErrorStream(false);
        pb.environment().put("BEADS_DB", workspace.dbPath());
        return execute(pb, timeoutMs);
    }

    /**
     * Runs bd and parses stdout as JSON when it exits cleanly.
     */
    public BdResult runJson(List<String> args, WorkspaceConfig workspace) {
        BdResult result = run(args, workspace);
        if (!result.ok()) {
            log.debug("bd exited with code {} (args={}) stderr={}", result.code(), args, result.stderr());
            return result;
        }
        String stdout = result.stdout() == null || result.stdout().isBlank() ? "null" : result.stdout();
        try {
            JsonNode parsed = objectMapper.readTree(stdout);
            return result.withJson(parsed);
        } catch (IOException e) {
            log.warn("bd returned invalid JSON (args={}): {}", args, e.getMessage());
            return BdResult.failure(1, "Invalid JSON from bd");
        }
    }

    /**
     * The git user name configured for {@code cwd}, or an empty string.
     */
    public String gitUserName(Path cwd) {
        ProcessBuilder pb = new ProcessBuilder("git", "config", "user.name")
                .directory(cwd.toFile())
                .redirectErrorStream(false);
        BdResult result = execute(pb, 5_000);
        return result.ok() ? result.stdout().trim() : "";
    }

    static BdResult execute(ProcessBuilder pb, long timeoutMs) {
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("Spawn error running {}: {}", pb.command().get(0), e.getMessage());
            return BdResult.failure(BdResult.SPAWN_FAILURE, e.getMessage());
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread stdoutThread = drain(process.getInputStream(), stdout, "bd-stdout");
        Thread stderrThread = drain(process.getErrorStream(), stderr, "bd-stderr");

        try {
            boolean finished = true;
            if (timeoutMs > 0) {
                finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            } else {
                process.waitFor();
            }
            if (!finished) {
                process.destroyForcibly();
                log.warn("{} timed out after {}ms", pb.command(), timeoutMs);
                return BdResult.failure(BdResult.TIMED_OUT, "bd timed out after " + timeoutMs + "ms");
            }
            stdoutThread.join(1000);
            stderrThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return BdResult.failure(BdResult.SPAWN_FAILURE, "Interrupted while running bd");
        }

        synchronized (stdout) {
            synchronized (stderr) {
                return BdResult.of(process.exitValue(), stdout.toString(), stderr.toString());
            }
        }
    }

    private static Thread drain(InputStream in, StringBuilder sink, String name) {
        Thread t = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                char[] buf = new char[4096];
                int n;
                while ((n = reader.read(buf)) != -1) {
                    synchronized (sink) {
                        sink.append(buf, 0, n);
                    }
                }
            } catch (IOException e) {
                log.debug("Stream {} closed early: {}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }
}
