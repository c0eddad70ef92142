package com.vibeforge.core.audit;

import com.vibeforge.communication.InMemoryEventBus;
import com.vibeforge.config.VibeForgeSettings;
import com.vibeforge.core.artifact.Artifact;
import com.vibeforge.core.artifact.ArtifactStore;
import com.vibeforge.core.artifact.CacheKey;
import com.vibeforge.core.artifact.StaleReferenceException;
import com.vibeforge.core.data.DataContextBuilder;
import com.vibeforge.core.data.DataShape;
import com.vibeforge.core.event.EventType;
import com.vibeforge.core.storage.PayloadStorage;
import com.vibeforge.llm.CollaboratorException;
import com.vibeforge.llm.PromptBuilder;
import com.vibeforge.llm.ScriptedCodeModelClient;
import com.vibeforge.llm.WidgetCollaborator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    /** Fourteen lines; the tooltip block sits on lines 10-12. */
    private static final String V1 = String.join("\n",
            "import * as d3 from \"https://esm.sh/d3@7\";",
            "",
            "export default function SalesChart({ model, html, React }) {",
            "  const data = model.get(\"data\") || [];",
            "  const ref = React.useRef(null);",
            "  React.useEffect(() => {",
            "    const svg = d3.select(ref.current).append(\"svg\");",
            "    svg.attr(\"height\", 420);",
            "    const tip = svg.append(\"g\");",
            "    tip.on(\"mouseover\", (e, d) => {",
            "      tip.text(d.value.toFixed(2));",
            "    });",
            "    return () => svg.remove();",
            "  }, [data]);");

    private static final String V2 = V1.replace("tip.text(d.value.toFixed(2));", "tip.text(String(d.value));");

    private static final String FIRST_REPORT = """
            {"fast_audit": {
              "concerns": [
                {"id": "data.load.fallback", "location": [4], "summary": "Empty list fallback"},
                {"id": "interaction.tooltip.format", "location": [10, 11, 12], "summary": "Two decimals"},
                {"id": "presentation.height", "location": "global", "summary": "Fixed height"}
              ],
              "open_questions": ["Should the tooltip show units?"]
            }}
            """;

    private static final String SCOPED_REPORT = """
            {"fast_audit": {
              "concerns": [
                {"id": "interaction.tooltip.raw_value", "location": [11], "summary": "Raw value shown"},
                {"id": "data.load.elsewhere", "location": [5], "summary": "Outside the change"}
              ],
              "open_questions": ["Should the tooltip show units?", "Round large values?"]
            }}
            """;

    @TempDir
    Path tempDir;

    private ScriptedCodeModelClient client;
    private ArtifactStore           artifacts;
    private AuditStore              audits;
    private AuditService            service;
    private List<EventType>         events;

    @BeforeEach
    void setUp() {
        VibeForgeSettings settings = VibeForgeSettings.forStore(tempDir);
        PayloadStorage storage = new PayloadStorage(settings);
        InMemoryEventBus bus = new InMemoryEventBus();
        events = new ArrayList<>();
        bus.subscribe(event -> events.add(event.getType()));

        client    = new ScriptedCodeModelClient();
        artifacts = new ArtifactStore(storage);
        audits    = new AuditStore(storage);
        service   = new AuditService(artifacts, audits,
                new WidgetCollaborator(client, new PromptBuilder(), settings),
                new AuditReportParser(), new DataContextBuilder(), bus);
    }

    private Artifact save(String code, String description) {
        return artifacts.save(code, CacheKey.builder(description, new DataShape(120, 3)).build(), "test");
    }

    private Artifact revision(Artifact base, String code, String description) {
        Artifact child = save(code, description);
        return artifacts.linkBase(child.getId(), base.getId());
    }

    private static List<String> ids(AuditReport report) {
        return report.getConcerns().stream().map(Concern::getId).collect(Collectors.toList());
    }

    @Test
    void testFirstAuditIsFreshAndPersisted() {
        Artifact artifact = save(V1, "bar chart of sales by region");
        client.reply(FIRST_REPORT);

        AuditReport report = service.runAudit(artifact.getId(), AuditLevel.FAST, true);

        assertEquals(AuditReport.Source.FRESH, report.getSource());
        assertEquals(1, report.getCollaboratorCalls());
        assertEquals(3, report.getConcerns().size());
        assertEquals(3, report.getConcerns().get(1).getLineHashes().size());
        assertEquals(1, audits.size());
        assertTrue(report.getRecord().getAuditId().startsWith("fast-"));
        assertTrue(events.contains(EventType.AUDIT_COMPLETED));
    }

    @Test
    void testSecondAuditOfSameCodeMakesNoCall() {
        Artifact artifact = save(V1, "bar chart of sales by region");
        client.reply(FIRST_REPORT);
        AuditReport first = service.runAudit(artifact.getId(), AuditLevel.FAST, true);

        AuditReport second = service.runAudit(artifact.getId(), AuditLevel.FAST, true);

        assertEquals(AuditReport.Source.REUSED, second.getSource());
        assertEquals(0, second.getCollaboratorCalls());
        assertEquals(1, client.getCallCount());
        assertEquals(first.getRecord().getAuditId(), second.getRecord().getAuditId());
        assertEquals(ids(first), ids(second));
        assertEquals(1, audits.size());
    }

    @Test
    void testChangedLineInvalidatesOnlyItsConcern() {
        Artifact base = save(V1, "bar chart of sales by region");
        client.reply(FIRST_REPORT);
        service.runAudit(base.getId(), AuditLevel.FAST, true);
        Artifact child = revision(base, V2, "bar chart of sales by region raw tooltip");
        client.reply(SCOPED_REPORT);

        AuditReport report = service.runAudit(child.getId(), AuditLevel.FAST, true);

        assertEquals(AuditReport.Source.RECONCILED, report.getSource());
        assertEquals(Set.of(11), report.getChangedLines());
        assertEquals(List.of("data.load.fallback"), report.getReusedConcernIds());
        assertEquals(List.of("interaction.tooltip.format", "presentation.height"), report.getStaleConcernIds());
        assertEquals(List.of("data.load.fallback", "interaction.tooltip.raw_value"), ids(report));
        assertTrue(client.lastPrompt().contains("CHANGED LINES"));
        assertEquals(List.of("Should the tooltip show units?", "Round large values?"), report.getOpenQuestions());
        assertEquals(child.getId(), report.getRecord().getArtifactId());
        assertEquals(base.getId(), report.getRecord().getBaseArtifactId());
    }

    @Test
    void testUnchangedRevisionInheritsBaseAudit() {
        Artifact base = save(V1, "bar chart of sales by region");
        client.reply(FIRST_REPORT);
        AuditReport baseReport = service.runAudit(base.getId(), AuditLevel.FAST, true);
        Artifact child = revision(base, V1, "bar chart of sales by region again");

        AuditReport report = service.runAudit(child.getId(), AuditLevel.FAST, true);

        assertEquals(AuditReport.Source.INHERITED, report.getSource());
        assertEquals(0, report.getCollaboratorCalls());
        assertEquals(1, client.getCallCount());
        assertEquals(ids(baseReport), ids(report));
        assertEquals(child.getId(), report.getRecord().getArtifactId());
        assertTrue(audits.latest(child.getId(), AuditLevel.FAST).isPresent());
    }

    @Test
    void testLevelsAreAuditedIndependently() {
        Artifact artifact = save(V1, "bar chart of sales by region");
        client.reply(FIRST_REPORT).reply(FIRST_REPORT.replace("fast_audit", "full_audit"));
        service.runAudit(artifact.getId(), AuditLevel.FAST, true);

        AuditReport full = service.runAudit(artifact.getId(), AuditLevel.FULL, true);

        assertEquals(AuditReport.Source.FRESH, full.getSource());
        assertEquals(AuditLevel.FULL, full.getRecord().getLevel());
        assertEquals(2, client.getCallCount());
    }

    @Test
    void testReuseDisabledAlwaysCallsCollaborator() {
        Artifact artifact = save(V1, "bar chart of sales by region");
        client.reply(FIRST_REPORT).reply(FIRST_REPORT);
        service.runAudit(artifact.getId(), AuditLevel.FAST, true);

        AuditReport again = service.runAudit(artifact.getId(), AuditLevel.FAST, false);

        assertEquals(AuditReport.Source.FRESH, again.getSource());
        assertEquals(2, client.getCallCount());
        assertEquals(2, audits.size());
    }

    @Test
    void testUnparseableReportPersistsNothing() {
        Artifact artifact = save(V1, "bar chart of sales by region");
        client.reply("Sorry, I cannot help with that.");

        assertThrows(CollaboratorException.class,
                () -> service.runAudit(artifact.getId(), AuditLevel.FAST, true));
        assertEquals(0, audits.size());
    }

    @Test
    void testCollaboratorFailureDuringReconcileKeepsPriorRecord() {
        Artifact base = save(V1, "bar chart of sales by region");
        client.reply(FIRST_REPORT);
        service.runAudit(base.getId(), AuditLevel.FAST, true);
        Artifact child = revision(base, V2, "bar chart of sales by region raw tooltip");
        client.fail(new IllegalStateException("backend down"));

        assertThrows(CollaboratorException.class,
                () -> service.runAudit(child.getId(), AuditLevel.FAST, true));
        assertEquals(1, audits.size());
        assertTrue(audits.latest(child.getId(), AuditLevel.FAST).isEmpty());
    }

    @Test
    void testUnknownArtifactIsStaleReference() {
        assertThrows(StaleReferenceException.class,
                () -> service.runAudit("missing-v1", AuditLevel.FAST, true));
        assertEquals(0, client.getCallCount());
    }
}
