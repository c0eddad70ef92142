package com.vibeforge.orchestrator;

import com.vibeforge.communication.EventBus;
import com.vibeforge.core.artifact.Artifact;
import com.vibeforge.core.artifact.ArtifactStore;
import com.vibeforge.core.artifact.CacheKey;
import com.vibeforge.core.artifact.InvalidRequestException;
import com.vibeforge.core.artifact.StaleReferenceException;
import com.vibeforge.core.event.Event;
import com.vibeforge.core.event.EventType;
import com.vibeforge.core.generation.GenerationFailedException;
import com.vibeforge.core.generation.GenerationLoop;
import com.vibeforge.core.generation.GenerationProgress;
import com.vibeforge.core.generation.GenerationRequest;
import com.vibeforge.core.generation.GenerationResult;
import com.vibeforge.orchestrator.dto.ArtifactRequest;
import com.vibeforge.llm.CollaboratorException;
import com.vibeforge.orchestrator.dto.ArtifactResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ArtifactOrchestrator: top-level flow for one artifact request.
 *
 * Flow:  key → resolve base → (lookup) → GenerationLoop → save → link base
 *
 * Requests for the same cache key are serialized, and the store is checked
 * again once the key is held, so concurrent identical requests run a single
 * generation. Revisions skip the lookup: their key does not include the base,
 * so a hit could hand back a widget built from a different parent.
 *
 * A progress record is marked ERROR only for collaborator failures and stale
 * references; any other failure is logged to the record and rethrown.
 */
@Component
public class ArtifactOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ArtifactOrchestrator.class);

    private static final String SOURCE = "ArtifactOrchestrator";

    private final ArtifactStore  store;
    private final GenerationLoop loop;
    private final RequestTracker tracker;
    private final EventBus       eventBus;

    private final ConcurrentMap<String, KeyLock> keyLocks = new ConcurrentHashMap<>();

    public ArtifactOrchestrator(ArtifactStore store,
                                GenerationLoop loop,
                                RequestTracker tracker,
                                EventBus eventBus) {
        this.store    = store;
        this.loop     = loop;
        this.tracker  = tracker;
        this.eventBus = eventBus;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public ArtifactResponse request(ArtifactRequest request) {
        String requestId = UUID.randomUUID().toString();

        CacheKey key = CacheKey.builder(request.getDescription(), request.resolveDataShape())
                .dataVariableName(request.getDataVariableName())
                .exports(request.getExports())
                .imports(request.getImports())
                .theme(request.getTheme())
                .build();

        GenerationProgress progress = tracker.start(requestId);

        Artifact base = request.getBaseArtifactId() != null
                ? resolve(requestId, progress, request.getBaseArtifactId())
                : null;

        log.info("[ArtifactOrchestrator] Request {} for {}{}", requestId, key,
                base != null ? " (revising " + base.getId() + ")" : "");

        KeyLock lock = acquire(key.getContentHash());
        try {
            if (base == null) {
                Optional<Artifact> hit = store.lookup(key);
                if (hit.isPresent()) {
                    String code = store.loadCode(hit.get());
                    progress.log("Cache hit: " + hit.get().getId());
                    progress.markReady(hit.get().getId(), code);
                    return ArtifactResponse.cached(requestId, hit.get(), code);
                }
            }

            GenerationRequest.Builder generation = GenerationRequest.builder(key.getDescription())
                    .requestId(requestId)
                    .data(request.toDataTable())
                    .dataShape(key.getDataShape())
                    .exports(key.getExports())
                    .imports(key.getImports())
                    .theme(key.getTheme());
            if (base != null) {
                generation.base(store.loadCode(base), base.getComponentNames());
            }

            GenerationResult result = loop.run(generation.build());
            Artifact saved = store.save(result.getCode(), key, result.getModelId());
            if (base != null) {
                saved = store.linkBase(saved.getId(), base.getId());
            }
            return complete(requestId, progress, saved, result);

        } catch (RuntimeException e) {
            fail(requestId, progress, e);
            throw e;
        } finally {
            release(key.getContentHash(), lock);
        }
    }

    // =========================================================================
    // RUNTIME-ERROR CHANNEL
    // =========================================================================

    /**
     * Repair {@code artifactId} against an error the host saw while running it.
     * The result is a new artifact whose base is the reported one.
     */
    public ArtifactResponse fixRuntimeError(String artifactId, String errorText) {
        if (errorText == null || errorText.isBlank()) {
            throw new InvalidRequestException("errorText must not be blank");
        }
        String requestId = UUID.randomUUID().toString();
        GenerationProgress progress = tracker.start(requestId);

        Artifact broken = resolve(requestId, progress, artifactId);
        if (broken.isExternal()) {
            progress.log("Failed: external artifacts cannot be fixed");
            throw new InvalidRequestException("External artifacts cannot be fixed in place: " + artifactId);
        }
        log.info("[ArtifactOrchestrator] Fix request {} for {}: {}", requestId, artifactId, errorText);

        try {
            GenerationRequest fix = GenerationRequest.builder(broken.getSourceDescription())
                    .requestId(requestId)
                    .dataShape(broken.getDataShape())
                    .exports(broken.getExports())
                    .imports(broken.getImports())
                    .fix(store.loadCode(broken), errorText)
                    .build();

            GenerationResult result = loop.run(fix);
            Artifact saved = store.saveSuccessor(result.getCode(), broken, result.getModelId());
            saved = store.linkBase(saved.getId(), broken.getId());
            return complete(requestId, progress, saved, result);

        } catch (RuntimeException e) {
            fail(requestId, progress, e);
            throw e;
        }
    }

    // =========================================================================
    // HOST VIEWS
    // =========================================================================

    public Optional<GenerationProgress> getProgress(String requestId) {
        return tracker.find(requestId);
    }

    public List<GenerationProgress> getRecentProgress() {
        return tracker.recent();
    }

    public Artifact getArtifact(String artifactId) {
        return store.findById(artifactId)
                .orElseThrow(() -> new StaleReferenceException(artifactId));
    }

    public String getCode(String artifactId) {
        return store.loadCode(getArtifact(artifactId));
    }

    public Artifact registerExternal(String code, String label) {
        if (code == null || code.isBlank()) {
            throw new InvalidRequestException("code must not be blank");
        }
        return store.registerExternal(code, label);
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    /** Resolves a referenced artifact before any collaborator call; a miss ends the request. */
    private Artifact resolve(String requestId, GenerationProgress progress, String artifactId) {
        Optional<Artifact> found = store.findById(artifactId);
        if (found.isEmpty()) {
            StaleReferenceException stale = new StaleReferenceException(artifactId);
            fail(requestId, progress, stale);
            throw stale;
        }
        return found.get();
    }

    private void fail(String requestId, GenerationProgress progress, RuntimeException e) {
        log.error("[ArtifactOrchestrator] Request {} failed: {}", requestId, e.getMessage());
        if (e instanceof CollaboratorException
                || e instanceof GenerationFailedException
                || e instanceof StaleReferenceException) {
            progress.markError(e.getMessage());
        } else {
            progress.log("Failed: " + e.getMessage());
        }
    }

    private KeyLock acquire(String contentHash) {
        KeyLock keyLock = keyLocks.compute(contentHash, (h, existing) -> {
            KeyLock held = existing != null ? existing : new KeyLock();
            held.holders++;
            return held;
        });
        keyLock.lock.lock();
        return keyLock;
    }

    private void release(String contentHash, KeyLock keyLock) {
        keyLock.lock.unlock();
        keyLocks.compute(contentHash, (h, existing) -> {
            if (existing == null) return null;
            existing.holders--;
            return existing.holders == 0 ? null : existing;
        });
    }

    /** Keys with a request in flight or waiting. */
    int activeKeyCount() {
        return keyLocks.size();
    }

    /** Holder count is only read and written inside {@code keyLocks.compute}. */
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }

    private ArtifactResponse complete(String requestId, GenerationProgress progress,
                                      Artifact saved, GenerationResult result) {
        eventBus.publish(new Event(EventType.ARTIFACT_SAVED, SOURCE, requestId, saved.getId()));
        progress.log("Saved " + saved.getId() + " (" + result.getOutcome() + ")");
        progress.markReady(saved.getId(), result.getCode());
        log.info("[ArtifactOrchestrator] Request {} → {} ({}, {} call(s))",
                requestId, saved.getId(), result.getOutcome(), result.getCollaboratorCalls());
        return ArtifactResponse.generated(requestId, saved, result);
    }
}
