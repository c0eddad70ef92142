package com.vibeforge.core.audit;

import com.vibeforge.communication.EventBus;
import com.vibeforge.core.artifact.Artifact;
import com.vibeforge.core.artifact.ArtifactStore;
import com.vibeforge.core.artifact.StaleReferenceException;
import com.vibeforge.core.audit.AuditReconciler.Classification;
import com.vibeforge.core.audit.AuditReportParser.ParsedAudit;
import com.vibeforge.core.data.DataContext;
import com.vibeforge.core.data.DataContextBuilder;
import com.vibeforge.core.data.DataTable;
import com.vibeforge.core.event.Event;
import com.vibeforge.core.event.EventType;
import com.vibeforge.llm.WidgetCollaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * AuditService: RunAudit(artifact, level, reuse).
 *
 *   1. hash the current code, whole and per line
 *   2. with reuse: latest record for (artifact, level), else walk up the lineage
 *   3. classify prior concerns reusable / stale
 *   4. nothing stale and same code hash → return the prior record, no collaborator call
 *   5. otherwise audit, scoped to the changed lines when a prior record exists
 *   6. merge, persist a new record
 *
 * A collaborator or parse failure aborts the audit before anything is written.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final ArtifactStore      artifactStore;
    private final AuditStore         auditStore;
    private final WidgetCollaborator collaborator;
    private final AuditReportParser  parser;
    private final DataContextBuilder contextBuilder;
    private final EventBus           eventBus;
    private final Clock              clock;

    @Autowired
    public AuditService(ArtifactStore artifactStore, AuditStore auditStore,
                        WidgetCollaborator collaborator, AuditReportParser parser,
                        DataContextBuilder contextBuilder, EventBus eventBus) {
        this(artifactStore, auditStore, collaborator, parser, contextBuilder, eventBus, Clock.systemUTC());
    }

    AuditService(ArtifactStore artifactStore, AuditStore auditStore,
                 WidgetCollaborator collaborator, AuditReportParser parser,
                 DataContextBuilder contextBuilder, EventBus eventBus, Clock clock) {
        this.artifactStore  = artifactStore;
        this.auditStore     = auditStore;
        this.collaborator   = collaborator;
        this.parser         = parser;
        this.contextBuilder = contextBuilder;
        this.eventBus       = eventBus;
        this.clock          = clock;
    }

    public AuditReport runAudit(String artifactId, AuditLevel level, boolean reuse) {
        return runAudit(artifactId, level, reuse, null);
    }

    /**
     * @param data optional dataset to describe to the collaborator; the artifact's
     *             recorded shape is used either way
     */
    public AuditReport runAudit(String artifactId, AuditLevel level, boolean reuse, DataTable data) {
        Artifact artifact = artifactStore.findById(artifactId)
                .orElseThrow(() -> new StaleReferenceException(artifactId));
        String code = artifactStore.loadCode(artifact);

        String                    codeHash   = LineHasher.codeHash(code);
        SortedMap<Integer, String> lineHashes = LineHasher.lineHashes(code);

        Optional<AuditRecord> prior = reuse ? findPrior(artifact, level) : Optional.empty();

        // ---------------- fast paths ----------------
        if (prior.isPresent()) {
            AuditRecord previous = prior.get();
            Classification classification = AuditReconciler.classify(previous, codeHash, lineHashes);

            if (!classification.hasStale() && previous.getCodeHash().equals(codeHash)) {
                List<String> ids = idsOf(previous.getConcerns());
                if (previous.getArtifactId().equals(artifactId)) {
                    log.info("[Audit] {} {} unchanged, reusing {}", artifactId, level, previous.getAuditId());
                    return finish(new AuditReport(previous, AuditReport.Source.REUSED, ids, List.of(), Set.of(), 0));
                }
                AuditRecord inherited = auditStore.save(newRecord(artifact, level, codeHash, lineHashes,
                        previous.getConcerns(), previous.getOpenQuestions()));
                log.info("[Audit] {} {} identical to base {}, inherited {} concern(s)",
                        artifactId, level, previous.getArtifactId(), ids.size());
                return finish(new AuditReport(inherited, AuditReport.Source.INHERITED, ids, List.of(), Set.of(), 0));
            }

            return reconcile(artifact, code, level, codeHash, lineHashes, previous, classification, data);
        }

        // ---------------- first audit ----------------
        log.info("[Audit] {} {} fresh audit", artifactId, level);
        ParsedAudit parsed = callCollaborator(artifact, code, level, Set.of(), data);
        List<Concern> concerns = AuditReconciler.mergeConcerns(List.of(), parsed.getConcerns(), Set.of(), lineHashes);
        List<String>  questions = AuditReconciler.mergeQuestions(List.of(), parsed.getOpenQuestions());

        AuditRecord record = auditStore.save(newRecord(artifact, level, codeHash, lineHashes, concerns, questions));
        return finish(new AuditReport(record, AuditReport.Source.FRESH, List.of(), List.of(), Set.of(), 1));
    }

    // =========================================================================
    // Reconciliation
    // =========================================================================

    private AuditReport reconcile(Artifact artifact, String code, AuditLevel level,
                                  String codeHash, SortedMap<Integer, String> lineHashes,
                                  AuditRecord previous, Classification classification, DataTable data) {

        SortedSet<Integer> changed = AuditReconciler.changedLines(previous.getLineHashes(), lineHashes);

        log.info("[Audit] {} {}: {} reusable, {} stale, {} changed line(s)",
                artifact.getId(), level, classification.getReusable().size(),
                classification.getStale().size(), changed.size());

        ParsedAudit parsed = callCollaborator(artifact, code, level, changed, data);

        List<Concern> concerns = AuditReconciler.mergeConcerns(
                classification.getReusable(), parsed.getConcerns(), changed, lineHashes);
        List<String> questions = AuditReconciler.mergeQuestions(
                previous.getOpenQuestions(), parsed.getOpenQuestions());

        AuditRecord record = auditStore.save(newRecord(artifact, level, codeHash, lineHashes, concerns, questions));
        return finish(new AuditReport(record, AuditReport.Source.RECONCILED,
                idsOf(classification.getReusable()), idsOf(classification.getStale()), changed, 1));
    }

    private ParsedAudit callCollaborator(Artifact artifact, String code, AuditLevel level,
                                         Set<Integer> changedLines, DataTable data) {
        DataContext context = contextBuilder.build(data, artifact.getDataShape(), Map.of(), Map.of(), null);
        String text = collaborator.audit(code, artifact.getSourceDescription(), context, level, changedLines);
        return parser.parse(text, level);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /** Latest record for the artifact, else for the nearest ancestor that has one. */
    private Optional<AuditRecord> findPrior(Artifact artifact, AuditLevel level) {
        Set<String> visited = new HashSet<>();
        Artifact current = artifact;
        while (current != null && visited.add(current.getId())) {
            Optional<AuditRecord> record = auditStore.latest(current.getId(), level);
            if (record.isPresent()) {
                if (current != artifact) {
                    log.info("[Audit] {} has no {} audit, using base {}", artifact.getId(), level, current.getId());
                }
                return record;
            }
            String baseId = current.getBaseArtifactId();
            current = baseId != null ? artifactStore.findById(baseId).orElse(null) : null;
        }
        return Optional.empty();
    }

    private AuditRecord newRecord(Artifact artifact, AuditLevel level, String codeHash,
                                  Map<Integer, String> lineHashes, List<Concern> concerns, List<String> questions) {
        String auditId = level.wireName() + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return new AuditRecord(auditId, level, artifact.getId(), artifact.getBaseArtifactId(),
                codeHash, lineHashes, concerns, questions, clock.instant());
    }

    private AuditReport finish(AuditReport report) {
        eventBus.publish(new Event(EventType.AUDIT_COMPLETED, "AuditService",
                report.getRecord().getArtifactId(), report.getRecord().getAuditId()));
        log.info("[Audit] {}", report);
        return report;
    }

    private static List<String> idsOf(List<Concern> concerns) {
        return concerns.stream().map(Concern::getId).collect(Collectors.toList());
    }
}
