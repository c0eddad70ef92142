package com.vibeforge.orchestrator;

import com.vibeforge.core.artifact.InvalidRequestException;
import com.vibeforge.core.artifact.StaleReferenceException;
import com.vibeforge.core.audit.AuditLevel;
import com.vibeforge.core.audit.AuditReport;
import com.vibeforge.core.audit.AuditService;
import com.vibeforge.core.data.DataShape;
import com.vibeforge.core.generation.GenerationOutcome;
import com.vibeforge.core.generation.GenerationProgress;
import com.vibeforge.core.generation.RequestStatus;
import com.vibeforge.core.maintenance.ClearScope;
import com.vibeforge.core.maintenance.StoreMaintenanceService;
import com.vibeforge.orchestrator.dto.ArtifactRequest;
import com.vibeforge.orchestrator.dto.ArtifactResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "vibeforge.store.path=target/test-store/orchestrator")
@ActiveProfiles({"test", "mock"})
class ArtifactOrchestratorTest {

    @Autowired
    private ArtifactOrchestrator orchestrator;

    @Autowired
    private AuditService auditService;

    @Autowired
    private StoreMaintenanceService maintenance;

    @BeforeEach
    void setUp() {
        maintenance.clear(ClearScope.ALL, null);
    }

    private static ArtifactRequest salesRequest() {
        return new ArtifactRequest("bar chart of sales by region", new DataShape(120, 3));
    }

    @Test
    void testSecondIdenticalRequestIsCacheHit() {
        ArtifactResponse first = orchestrator.request(salesRequest());

        assertFalse(first.isCacheHit());
        assertEquals("bar_chart_sales_region", first.getSlug());
        assertEquals(1, first.getVersion());
        assertEquals(GenerationOutcome.ACCEPTED_CLEAN, first.getOutcome());
        assertEquals(1, first.getCollaboratorCalls());
        assertFalse(first.getCode().contains("```"), "fences are stripped before saving");

        ArtifactResponse second = orchestrator.request(salesRequest());

        assertTrue(second.isCacheHit());
        assertEquals(first.getArtifactId(), second.getArtifactId());
        assertEquals(first.getCode(), second.getCode());
        assertEquals(0, second.getCollaboratorCalls());
    }

    @Test
    void testProgressIsReadyAfterRequest() {
        ArtifactResponse response = orchestrator.request(salesRequest());

        GenerationProgress progress = orchestrator.getProgress(response.getRequestId()).orElseThrow();

        assertEquals(RequestStatus.READY, progress.getStatus());
        assertEquals(response.getArtifactId(), progress.getArtifactId());
        assertFalse(progress.getLogs().isEmpty());
    }

    @Test
    void testExportedStateIsWiredIntoGeneratedCode() {
        ArtifactRequest request = salesRequest();
        request.setExports(Map.of("selection", "the region the user clicked"));

        ArtifactResponse response = orchestrator.request(request);

        assertEquals(GenerationOutcome.ACCEPTED_CLEAN, response.getOutcome());
        assertTrue(response.getCode().contains("model.set(\"selection\""));
    }

    @Test
    void testRevisionIsLinkedToBase() {
        ArtifactResponse base = orchestrator.request(salesRequest());
        ArtifactRequest revise = new ArtifactRequest("bar chart of sales by region sorted descending",
                new DataShape(120, 3));
        revise.setBaseArtifactId(base.getArtifactId());

        ArtifactResponse revision = orchestrator.request(revise);

        assertFalse(revision.isCacheHit());
        assertEquals(base.getArtifactId(), revision.getBaseArtifactId());
        assertEquals(base.getArtifactId(), orchestrator.getArtifact(revision.getArtifactId()).getBaseArtifactId());
    }

    @Test
    void testUnknownBaseIsStaleReference() {
        ArtifactRequest request = salesRequest();
        request.setBaseArtifactId("0000000000-v9");

        assertThrows(StaleReferenceException.class, () -> orchestrator.request(request));

        GenerationProgress progress = orchestrator.getRecentProgress().get(0);
        assertEquals(RequestStatus.ERROR, progress.getStatus());
        assertEquals("Artifact not found: 0000000000-v9", progress.getErrorMessage());
        assertNull(progress.getArtifactId());
    }

    @Test
    void testKeyGuardReleasedAfterRequests() {
        orchestrator.request(salesRequest());
        orchestrator.request(salesRequest());
        ArtifactRequest stale = salesRequest();
        stale.setBaseArtifactId("0000000000-v9");
        assertThrows(StaleReferenceException.class, () -> orchestrator.request(stale));

        assertEquals(0, orchestrator.activeKeyCount());
    }

    @Test
    void testBlankDescriptionRejected() {
        assertThrows(InvalidRequestException.class,
                () -> orchestrator.request(new ArtifactRequest("  ", new DataShape(1, 1))));
    }

    @Test
    void testRuntimeErrorFixBecomesNewestVersion() {
        ArtifactResponse broken = orchestrator.request(salesRequest());

        ArtifactResponse fixed = orchestrator.fixRuntimeError(broken.getArtifactId(),
                "TypeError: data.map is not a function");

        assertEquals(broken.getSlug(), fixed.getSlug());
        assertEquals(2, fixed.getVersion());
        assertEquals(broken.getArtifactId(), fixed.getBaseArtifactId());
        assertEquals(fixed.getArtifactId(), orchestrator.request(salesRequest()).getArtifactId());
    }

    @Test
    void testFixKeepsDeclaredExports() {
        ArtifactRequest request = salesRequest();
        request.setExports(Map.of("selection", "the region the user clicked"));
        ArtifactResponse broken = orchestrator.request(request);

        ArtifactResponse fixed = orchestrator.fixRuntimeError(broken.getArtifactId(),
                "TypeError: data.map is not a function");

        assertEquals(GenerationOutcome.ACCEPTED_CLEAN, fixed.getOutcome());
        assertTrue(fixed.getCode().contains("model.set(\"selection\""));
        assertEquals(Map.of("selection", "the region the user clicked"),
                orchestrator.getArtifact(fixed.getArtifactId()).getExports());

        ArtifactResponse served = orchestrator.request(request);
        assertEquals(fixed.getArtifactId(), served.getArtifactId());
        assertTrue(served.getCode().contains("model.set(\"selection\""));
    }

    @Test
    void testFixNeedsErrorText() {
        ArtifactResponse response = orchestrator.request(salesRequest());

        assertThrows(InvalidRequestException.class,
                () -> orchestrator.fixRuntimeError(response.getArtifactId(), ""));
        assertThrows(StaleReferenceException.class,
                () -> orchestrator.fixRuntimeError("0000000000-v9", "TypeError: x"));
    }

    @Test
    void testAuditTwiceReusesRecord() {
        ArtifactResponse response = orchestrator.request(salesRequest());

        AuditReport first  = auditService.runAudit(response.getArtifactId(), AuditLevel.FAST, true);
        AuditReport second = auditService.runAudit(response.getArtifactId(), AuditLevel.FAST, true);

        assertEquals(AuditReport.Source.FRESH, first.getSource());
        assertEquals(2, first.getConcerns().size());
        assertFalse(first.getConcerns().get(0).isGlobal());
        assertEquals(AuditReport.Source.REUSED, second.getSource());
        assertEquals(first.getRecord().getAuditId(), second.getRecord().getAuditId());
    }
}
