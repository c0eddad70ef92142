package com.vibeforge.core.generation;

import com.vibeforge.communication.EventBus;
import com.vibeforge.config.VibeForgeSettings;
import com.vibeforge.core.data.DataContext;
import com.vibeforge.core.data.DataContextBuilder;
import com.vibeforge.core.event.Event;
import com.vibeforge.core.event.EventType;
import com.vibeforge.core.validation.CodeValidator;
import com.vibeforge.core.validation.RuntimeErrorClassifier;
import com.vibeforge.core.validation.RuntimeSmokeTester;
import com.vibeforge.core.validation.SmokeTestResult;
import com.vibeforge.core.validation.ValidationResult;
import com.vibeforge.llm.CollaboratorException;
import com.vibeforge.llm.WidgetCollaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * GenerationLoop: bounded generate → validate → repair state machine.
 *
 * Budget: at most {@code maxRepairAttempts + 1} collaborator calls per run,
 * counting the initial generate/revise, every repair and every failed call.
 * When the budget runs out the last code obtained is accepted with its
 * residual issues. The only hard failure is obtaining no code at all.
 *
 * Strictly sequential: repair k+1 always sees the validation of repair k.
 * Progress events are published synchronously from the calling thread.
 */
@Component
public class GenerationLoop {

    private static final Logger log = LoggerFactory.getLogger(GenerationLoop.class);

    private static final String SOURCE = "GenerationLoop";

    private final WidgetCollaborator collaborator;
    private final CodeValidator      validator;
    private final RuntimeSmokeTester smokeTester;
    private final DataContextBuilder contextBuilder;
    private final EventBus           eventBus;
    private final int                maxRepairAttempts;

    public GenerationLoop(WidgetCollaborator collaborator,
                          CodeValidator validator,
                          RuntimeSmokeTester smokeTester,
                          DataContextBuilder contextBuilder,
                          EventBus eventBus,
                          VibeForgeSettings settings) {
        this.collaborator      = collaborator;
        this.validator         = validator;
        this.smokeTester       = smokeTester;
        this.contextBuilder    = contextBuilder;
        this.eventBus          = eventBus;
        this.maxRepairAttempts = settings.getMaxRepairAttempts();
    }

    public GenerationResult run(GenerationRequest request) {
        GenerationState state = new GenerationState(request.getRequestId(), maxRepairAttempts);
        Consumer<String> onChunk = chunk -> publish(request, EventType.GENERATION_CHUNK, chunk);

        // ---------------- ANALYZING ----------------
        state.setPhase(GenerationPhase.ANALYZING);
        step(request, "Analyzing data");
        DataContext context = contextBuilder.build(request.getData(), request.getDataShape(),
                request.getExports(), request.getImports(), request.getTheme());
        log.info("[GenerationLoop] {} context: {}", request.getRequestId(), context);

        // ---------------- GENERATING ----------------
        boolean forceTargetedFix = false;
        if (request.isFix()) {
            state.setCode(request.getCodeToFix());
            state.setFindings(List.of(request.getReportedError()), List.of());
            forceTargetedFix = true;
            step(request, "Fixing reported runtime error");
        } else {
            state.setPhase(GenerationPhase.GENERATING);
            obtainInitialCode(request, context, state, onChunk);
            validate(request, state);
        }

        // ---------------- REPAIRING ----------------
        while (!state.getIssues().isEmpty() && state.hasCallBudget()) {
            state.setPhase(GenerationPhase.REPAIRING);

            RepairStrategy strategy = forceTargetedFix
                    ? RepairStrategy.TARGETED_FIX
                    : RepairStrategy.choose(state.getIssues());
            forceTargetedFix = false;

            int attemptNumber = state.getRepairCount() + 1;
            List<String> before = state.getIssues();
            step(request, "Repair attempt " + attemptNumber + " (" + strategy + ", "
                    + before.size() + " issue(s))");

            try {
                state.recordCollaboratorCall();
                state.setCode(callRepair(strategy, state.getCode(), before, context, onChunk));
            } catch (CollaboratorException e) {
                log.warn("[GenerationLoop] {} repair #{} failed: {}",
                        request.getRequestId(), attemptNumber, e.getMessage());
                RepairAttempt failed = RepairAttempt.builder(attemptNumber, strategy,
                                RepairAttempt.Outcome.COLLABORATOR_FAILED)
                        .issuesBefore(before)
                        .issuesAfter(before)
                        .failureReason(e.getMessage())
                        .build();
                state.addRepairAttempt(failed);
                step(request, failed.toLogLine());
                continue;
            }

            validate(request, state);

            RepairAttempt attempt = RepairAttempt.builder(attemptNumber, strategy,
                            state.getIssues().isEmpty()
                                    ? RepairAttempt.Outcome.RESOLVED
                                    : RepairAttempt.Outcome.ISSUES_REMAIN)
                    .issuesBefore(before)
                    .issuesAfter(state.getIssues())
                    .build();
            state.addRepairAttempt(attempt);
            step(request, attempt.toLogLine());
        }

        // ---------------- DONE ----------------
        state.setPhase(GenerationPhase.DONE);
        GenerationOutcome outcome = state.getIssues().isEmpty()
                ? GenerationOutcome.ACCEPTED_CLEAN
                : GenerationOutcome.ACCEPTED_WITH_RESIDUAL_ISSUES;

        GenerationResult result = new GenerationResult(
                state.getCode(), outcome, state.getIssues(), state.getWarnings(),
                state.getRepairHistory(), state.getCollaboratorCalls(), collaborator.getModelId());

        if (outcome == GenerationOutcome.ACCEPTED_CLEAN) {
            log.info("[GenerationLoop] {} done clean: {}", request.getRequestId(), result);
        } else {
            log.warn("[GenerationLoop] {} accepted with {} residual issue(s): {}",
                    request.getRequestId(), result.getResidualIssues().size(), result.getResidualIssues());
        }
        publish(request, EventType.GENERATION_COMPLETE, outcome);
        return result;
    }

    // =========================================================================
    // Phases
    // =========================================================================

    /**
     * Generate (or revise) until code comes back or the call budget is spent.
     * A failed call consumes budget like a repair would.
     */
    private void obtainInitialCode(GenerationRequest request, DataContext context,
                                   GenerationState state, Consumer<String> onChunk) {
        CollaboratorException lastFailure = null;

        while (!state.hasCode() && state.hasCallBudget()) {
            step(request, request.isRevision() ? "Revising base widget" : "Generating widget");
            try {
                state.recordCollaboratorCall();
                String code = request.isRevision()
                        ? collaborator.revise(request.getBaseCode(), request.getBaseComponentNames(),
                                request.getDescription(), context, onChunk)
                        : collaborator.generate(request.getDescription(), context, onChunk);
                state.setCode(code);
            } catch (CollaboratorException e) {
                lastFailure = e;
                log.warn("[GenerationLoop] {} generation call {} failed: {}",
                        request.getRequestId(), state.getCollaboratorCalls(), e.getMessage());
                step(request, "Generation call failed: " + e.getMessage());
            }
        }

        if (!state.hasCode()) {
            String message = "No code obtained after " + state.getCollaboratorCalls() + " collaborator call(s)"
                    + (lastFailure != null ? ": " + lastFailure.getMessage() : "");
            log.error("[GenerationLoop] {} {}", request.getRequestId(), message);
            publish(request, EventType.GENERATION_ERROR, message);
            throw new GenerationFailedException(message, state.getCollaboratorCalls(), lastFailure);
        }
    }

    private void validate(GenerationRequest request, GenerationState state) {
        state.setPhase(GenerationPhase.VALIDATING);
        step(request, "Validating code");

        ValidationResult validation = validator.validate(
                state.getCode(), request.getExports().keySet(), request.getImports().keySet());
        SmokeTestResult smoke = smokeTester.test(state.getCode());

        List<String> issues = new ArrayList<>(validation.getIssues());
        for (String issue : smoke.getIssues()) {
            if (!issues.contains(issue)) issues.add(issue);
        }
        state.setFindings(issues, validation.getWarnings());

        step(request, validation.getSummary() + (smoke.isSuccess() ? "; smoke test passed" : "; smoke test failed"));
    }

    private String callRepair(RepairStrategy strategy, String code, List<String> issues,
                              DataContext context, Consumer<String> onChunk) {
        if (strategy == RepairStrategy.TARGETED_FIX) {
            String error = issues.get(0);
            String hint  = RuntimeErrorClassifier.classify(error).getRepairHint();
            return collaborator.fix(code, error, hint, context, onChunk);
        }
        return collaborator.repair(code, issues, context, onChunk);
    }

    // =========================================================================
    // Events
    // =========================================================================

    private void step(GenerationRequest request, String message) {
        publish(request, EventType.GENERATION_STEP, message);
    }

    private void publish(GenerationRequest request, EventType type, Object payload) {
        eventBus.publish(new Event(type, SOURCE, request.getRequestId(), payload));
    }
}
