package com.vibeforge.core.generation;

import com.vibeforge.communication.InMemoryEventBus;
import com.vibeforge.config.VibeForgeSettings;
import com.vibeforge.core.data.DataContextBuilder;
import com.vibeforge.core.data.DataShape;
import com.vibeforge.core.event.EventType;
import com.vibeforge.core.validation.CodeValidator;
import com.vibeforge.core.validation.NodeSyntaxChecker;
import com.vibeforge.core.validation.RuntimeSmokeTester;
import com.vibeforge.llm.CodeGenRole;
import com.vibeforge.llm.PromptBuilder;
import com.vibeforge.llm.ScriptedCodeModelClient;
import com.vibeforge.llm.WidgetCollaborator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GenerationLoopTest {

    private static final String CLEAN = ScriptedCodeModelClient.CLEAN_WIDGET;

    private static final String UNCLOSED = String.join("\n",
            "export default function SalesChart({ model, html, React }) {",
            "  return html`<div class=\"chart\"></div>`;",
            "");

    private static final String NOT_A_WIDGET = "const x = 1;";

    private static final String WITH_SELECTION = CLEAN.replace(
            "const ref = React.useRef(null);",
            "const ref = React.useRef(null);\n  model.set(\"selection\", []);\n  model.save_changes();");

    @TempDir
    Path tempDir;

    private ScriptedCodeModelClient client;
    private InMemoryEventBus        eventBus;
    private List<EventType>         events;
    private GenerationLoop          loop;

    @BeforeEach
    void setUp() {
        VibeForgeSettings settings = new VibeForgeSettings(tempDir.toString(), 1024 * 1024, 3, 5, false, "node");
        client   = new ScriptedCodeModelClient();
        eventBus = new InMemoryEventBus();
        events   = new ArrayList<>();
        eventBus.subscribe(event -> events.add(event.getType()));

        loop = new GenerationLoop(
                new WidgetCollaborator(client, new PromptBuilder(), settings),
                new CodeValidator(),
                new RuntimeSmokeTester(new NodeSyntaxChecker(settings)),
                new DataContextBuilder(),
                eventBus,
                settings);
    }

    private static GenerationRequest.Builder request() {
        return GenerationRequest.builder("bar chart of sales by region").dataShape(new DataShape(120, 3));
    }

    @Test
    void testCleanFirstAttempt() {
        client.reply(CLEAN);

        GenerationResult result = loop.run(request().build());

        assertEquals(GenerationOutcome.ACCEPTED_CLEAN, result.getOutcome());
        assertTrue(result.isClean());
        assertEquals(1, result.getCollaboratorCalls());
        assertTrue(result.getRepairHistory().isEmpty());
        assertEquals("scripted", result.getModelId());
        assertEquals(EventType.GENERATION_COMPLETE, events.get(events.size() - 1));
    }

    @Test
    void testMissingExportGetsBroadRepair() {
        client.reply(CLEAN).reply(WITH_SELECTION);

        GenerationResult result = loop.run(request().exports(Map.of("selection", "selected rows")).build());

        assertEquals(List.of(CodeGenRole.GENERATE, CodeGenRole.REPAIR), client.getRoles());
        assertEquals(RepairStrategy.BROAD_REPAIR, result.getRepairHistory().get(0).getStrategy());
        assertEquals(RepairAttempt.Outcome.RESOLVED, result.getRepairHistory().get(0).getOutcome());
        assertTrue(result.getRepairHistory().get(0).getIssuesBefore().get(0).startsWith("Export 'selection' never set"));
        assertEquals(GenerationOutcome.ACCEPTED_CLEAN, result.getOutcome());
        assertTrue(client.lastPrompt().contains("Export 'selection' never set"));
    }

    @Test
    void testSingleSyntaxErrorGetsTargetedFix() {
        client.reply(UNCLOSED).reply(CLEAN);

        GenerationResult result = loop.run(request().build());

        assertEquals(List.of(CodeGenRole.GENERATE, CodeGenRole.FIX), client.getRoles());
        assertEquals(RepairStrategy.TARGETED_FIX, result.getRepairHistory().get(0).getStrategy());
        assertTrue(result.isClean());
    }

    @Test
    void testBudgetExhaustedAcceptsWithResidualIssues() {
        client.fallback(NOT_A_WIDGET);

        GenerationResult result = loop.run(request().build());

        assertEquals(4, client.getCallCount());
        assertEquals(4, result.getCollaboratorCalls());
        assertEquals(3, result.getRepairHistory().size());
        assertEquals(GenerationOutcome.ACCEPTED_WITH_RESIDUAL_ISSUES, result.getOutcome());
        assertFalse(result.getResidualIssues().isEmpty());
        assertEquals(NOT_A_WIDGET, result.getCode());
    }

    @Test
    void testFailedGenerateConsumesBudget() {
        client.fail(new IllegalStateException("connection reset")).reply(CLEAN);

        GenerationResult result = loop.run(request().build());

        assertEquals(2, result.getCollaboratorCalls());
        assertTrue(result.isClean());
    }

    @Test
    void testNoCodeAtAllFails() {
        for (int i = 0; i < 4; i++) client.fail(new IllegalStateException("backend down"));

        GenerationFailedException e = assertThrows(GenerationFailedException.class,
                () -> loop.run(request().build()));

        assertEquals(4, e.getCollaboratorCalls());
        assertEquals(4, client.getCallCount());
        assertTrue(events.contains(EventType.GENERATION_ERROR));
    }

    @Test
    void testFailedRepairIsRecordedAndLoopContinues() {
        client.reply(NOT_A_WIDGET)
              .fail(new IllegalStateException("rate limited"))
              .reply(CLEAN);

        GenerationResult result = loop.run(request().build());

        assertEquals(3, result.getCollaboratorCalls());
        assertEquals(RepairAttempt.Outcome.COLLABORATOR_FAILED, result.getRepairHistory().get(0).getOutcome());
        assertNotNull(result.getRepairHistory().get(0).getFailureReason());
        assertEquals(RepairAttempt.Outcome.RESOLVED, result.getRepairHistory().get(1).getOutcome());
        assertTrue(result.isClean());
    }

    @Test
    void testZeroRepairBudgetMakesOneCall() {
        VibeForgeSettings noRepairs = new VibeForgeSettings(tempDir.toString(), 1024 * 1024, 0, 5, false, "node");
        GenerationLoop strict = new GenerationLoop(
                new WidgetCollaborator(client, new PromptBuilder(), noRepairs),
                new CodeValidator(),
                new RuntimeSmokeTester(new NodeSyntaxChecker(noRepairs)),
                new DataContextBuilder(),
                eventBus,
                noRepairs);
        client.fallback(NOT_A_WIDGET);

        GenerationResult result = strict.run(request().build());

        assertEquals(1, client.getCallCount());
        assertEquals(GenerationOutcome.ACCEPTED_WITH_RESIDUAL_ISSUES, result.getOutcome());
    }

    @Test
    void testReportedRuntimeErrorStartsWithTargetedFix() {
        client.reply(CLEAN);

        GenerationResult result = loop.run(request()
                .fix(UNCLOSED, "Uncaught ReferenceError: chart is not defined")
                .build());

        assertEquals(List.of(CodeGenRole.FIX), client.getRoles());
        assertTrue(client.lastPrompt().contains("chart is not defined"));
        assertEquals(RepairStrategy.TARGETED_FIX, result.getRepairHistory().get(0).getStrategy());
        assertTrue(result.isClean());
    }

    @Test
    void testReportedErrorFixThatDropsExportIsRepaired() {
        client.reply(CLEAN).reply(WITH_SELECTION);

        GenerationResult result = loop.run(request()
                .exports(Map.of("selection", "selected rows"))
                .fix(WITH_SELECTION, "TypeError: data.map is not a function")
                .build());

        assertEquals(List.of(CodeGenRole.FIX, CodeGenRole.REPAIR), client.getRoles());
        assertTrue(result.getRepairHistory().get(0).getIssuesAfter().get(0).startsWith("Export 'selection' never set"));
        assertTrue(result.getCode().contains("model.set(\"selection\""));
        assertEquals(GenerationOutcome.ACCEPTED_CLEAN, result.getOutcome());
    }

    @Test
    void testRevisionUsesReviseRole() {
        client.reply(CLEAN);

        loop.run(request().base(CLEAN, List.of("SalesChart")).build());

        assertEquals(List.of(CodeGenRole.REVISE), client.getRoles());
        assertTrue(client.lastPrompt().contains("SalesChart"));
    }
}
