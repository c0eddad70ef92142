package com.vibeforge.llm;

import com.vibeforge.config.VibeForgeSettings;
import com.vibeforge.core.audit.AuditLevel;
import com.vibeforge.core.data.DataContext;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * WidgetCollaborator: the four calls the core makes to the code-generating model.
 *
 *   generate(description, context)             → code
 *   revise(baseCode, components, request, ctx) → code
 *   fix(brokenCode, errorText, hint, ctx)      → code
 *   repair(code, issues, ctx)                  → code
 *   audit(code, description, ctx, level, changedLines) → report text
 *
 * Every call runs under the configured timeout. Any backend failure, timeout
 * or empty output surfaces as {@link CollaboratorException}; callers decide
 * whether that is recoverable.
 */
@Component
public class WidgetCollaborator {

    private static final Logger log = LoggerFactory.getLogger(WidgetCollaborator.class);

    private final CodeModelClient client;
    private final PromptBuilder   prompts;
    private final long            timeoutSeconds;
    private final ExecutorService executor;

    public WidgetCollaborator(CodeModelClient client, PromptBuilder prompts, VibeForgeSettings settings) {
        this.client         = client;
        this.prompts        = prompts;
        this.timeoutSeconds = settings.getCollaboratorTimeout().getSeconds();
        AtomicInteger seq   = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "collaborator-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("[Collaborator] Backend {} with {}s timeout", client.getModelId(), timeoutSeconds);
    }

    public String getModelId() {
        return client.getModelId();
    }

    // =========================================================================
    // Code calls
    // =========================================================================

    public String generate(String description, DataContext context, Consumer<String> onChunk) {
        String prompt = prompts.buildGeneratePrompt(description, context);
        return codeCall(CodeGenRole.GENERATE, prompt, onChunk);
    }

    public String revise(String baseCode, List<String> componentNames, String request,
                         DataContext context, Consumer<String> onChunk) {
        String prompt = prompts.buildRevisePrompt(baseCode, componentNames, request, context);
        return codeCall(CodeGenRole.REVISE, prompt, onChunk);
    }

    public String fix(String brokenCode, String errorText, String repairHint,
                      DataContext context, Consumer<String> onChunk) {
        String prompt = prompts.buildFixPrompt(brokenCode, errorText, repairHint, context);
        return codeCall(CodeGenRole.FIX, prompt, onChunk);
    }

    public String repair(String code, Collection<String> issues, DataContext context, Consumer<String> onChunk) {
        String prompt = prompts.buildRepairPrompt(code, issues, context);
        return codeCall(CodeGenRole.REPAIR, prompt, onChunk);
    }

    // =========================================================================
    // Audit call
    // =========================================================================

    /** Raw report text, fences stripped. Parsing is the audit engine's job. */
    public String audit(String code, String description, DataContext context,
                        AuditLevel level, Collection<Integer> changedLines) {
        String prompt = prompts.buildAuditPrompt(code, description, context, level, changedLines);
        return CodeFences.strip(invoke(CodeGenRole.AUDIT, prompt, null));
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private String codeCall(CodeGenRole role, String prompt, Consumer<String> onChunk) {
        String code = CodeFences.strip(invoke(role, prompt, onChunk));
        if (code.isEmpty()) {
            throw new CollaboratorException(role, "Collaborator returned no code for " + role, null);
        }
        return code;
    }

    private String invoke(CodeGenRole role, String prompt, Consumer<String> onChunk) {
        double temperature = client.getTemperatureForRole(role);
        log.debug("[Collaborator] {} call, promptLen={}", role, prompt.length());

        CompletableFuture<String> future = CompletableFuture.supplyAsync(
                () -> client.generateWithRole(role, prompt, temperature, onChunk), executor);
        try {
            String text = future.get(timeoutSeconds, TimeUnit.SECONDS);
            return text != null ? text : "";
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Collaborator] {} timed out after {}s", role, timeoutSeconds);
            throw CollaboratorException.timedOut(role, timeoutSeconds);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Collaborator] {} failed: {}", role, cause.getMessage());
            throw new CollaboratorException(role, "Collaborator " + role + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CollaboratorException(role, "Interrupted waiting for " + role, e);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
