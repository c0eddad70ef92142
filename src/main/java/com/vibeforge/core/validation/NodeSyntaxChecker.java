package com.vibeforge.core.validation;

import com.vibeforge.config.VibeForgeSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NodeSyntaxChecker: runs {@code node --check} on the module in a temp file.
 *
 * Parse only: nothing is executed, no network. Disabled unless
 * {@code vibeforge.smoke.node-enabled=true}. A missing or hung node binary is
 * logged and reported as "no finding"; this check is advisory.
 */
@Component
public class NodeSyntaxChecker {

    private static final Logger log = LoggerFactory.getLogger(NodeSyntaxChecker.class);

    private static final int TIMEOUT_SECONDS      = 10;
    private static final int OUTPUT_DRAIN_SECONDS = 5;

    private final boolean enabled;
    private final String  executable;

    public NodeSyntaxChecker(VibeForgeSettings settings) {
        this.enabled    = settings.isNodeCheckEnabled();
        this.executable = settings.getNodeExecutable();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<String> check(String code) {
        if (!enabled) return Optional.empty();

        Path tempModule = null;
        try {
            tempModule = Files.createTempFile("vibeforge_", ".mjs");
            Files.writeString(tempModule, code, StandardCharsets.UTF_8);
            return runCheck(tempModule);
        } catch (IOException e) {
            log.warn("[NodeCheck] Skipped - could not run {}: {}", executable, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[NodeCheck] Interrupted");
            return Optional.empty();
        } finally {
            if (tempModule != null) {
                try {
                    Files.deleteIfExists(tempModule);
                } catch (IOException e) {
                    log.debug("[NodeCheck] Could not delete {}: {}", tempModule, e.getMessage());
                }
            }
        }
    }

    private Optional<String> runCheck(Path module) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(List.of(executable, "--check", module.toString()));
        builder.redirectErrorStream(true);
        Process process = builder.start();

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));

        if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            output.cancel(true);
            log.warn("[NodeCheck] Timed out after {} seconds", TIMEOUT_SECONDS);
            return Optional.empty();
        }

        if (process.exitValue() == 0) return Optional.empty();

        String text;
        try {
            text = output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[NodeCheck] Could not read output: {}", e.getMessage());
            text = "";
        }
        log.info("[NodeCheck] Exit code {}: {} chars of output", process.exitValue(), text.length());
        return Optional.of(extractErrorLine(text));
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String extractErrorLine(String output) {
        for (String l : output.split("\n")) {
            if (l.contains("Error")) return l.trim();
        }
        String trimmed = output.trim();
        return trimmed.isEmpty() ? "SyntaxError: node --check failed" : trimmed;
    }
}
