package com.vibeforge.core.artifact;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vibeforge.core.data.DataShape;
import com.vibeforge.core.storage.PayloadStorage;
import com.vibeforge.core.storage.PayloadStorage.StorageException;
import com.vibeforge.util.Fingerprint;
import com.vibeforge.util.StableJson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * ArtifactStore: content-addressable cache, versioning and lineage for generated code.
 *
 * Layout under the store root:
 *   index/artifacts.json          - every artifact row, in append order
 *   artifacts/<slug>__<short>__v<n>.js - one code payload per row
 *
 * Rows are appended, never overwritten by a save. The only in-place row
 * replacements are the {@code lastUsedAt} touch on a cache hit and the lineage
 * link after a revision save. Externally loaded artifacts live in memory only.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    static final String INDEX_FILE      = "index/artifacts.json";
    static final String PAYLOAD_DIR     = "artifacts";
    static final String EXTERNAL_PREFIX = "external-";

    private static final TypeReference<List<Artifact>> ROWS_TYPE = new TypeReference<>() {};

    private final PayloadStorage storage;
    private final Clock          clock;

    private final List<Artifact>        rows         = new ArrayList<>();
    private final Map<String, Artifact> externals    = new ConcurrentHashMap<>();
    private final Map<String, String>   externalCode = new ConcurrentHashMap<>();

    @Autowired
    public ArtifactStore(PayloadStorage storage) {
        this(storage, Clock.systemUTC());
    }

    ArtifactStore(PayloadStorage storage, Clock clock) {
        this.storage = storage;
        this.clock   = clock;
        this.rows.addAll(loadIndex());
        log.info("[ArtifactStore] Loaded {} artifact rows", rows.size());
    }

    // ================================================================
    // Lookup
    // ================================================================

    /**
     * Resolve a cache key to its newest stored artifact.
     *
     * Never throws for a damaged store: a row whose payload is gone is a miss.
     */
    public synchronized Optional<Artifact> lookup(CacheKey key) {
        Optional<Artifact> newest = rows.stream()
                .filter(a -> a.getContentHash().equals(key.getContentHash()))
                .max(Comparator.comparingInt(Artifact::getVersion));

        if (newest.isEmpty()) {
            log.info("[ArtifactStore] Cache miss for {}", key);
            return Optional.empty();
        }

        Artifact hit = newest.get();
        if (!storage.exists(payloadPath(hit))) {
            log.warn("[ArtifactStore] Index row {} has no payload ({}). Treating as miss.",
                    hit.getId(), hit.getFileName());
            return Optional.empty();
        }

        Artifact touched = hit.touchedAt(clock.instant());
        replaceRow(touched);
        try {
            persistIndex();
        } catch (StoreException e) {
            log.warn("[ArtifactStore] Could not persist lastUsedAt for {}: {}", hit.getId(), e.getMessage());
        }

        log.info("[ArtifactStore] Cache hit {} for {}", touched.getId(), key);
        return Optional.of(touched);
    }

    // ================================================================
    // Save
    // ================================================================

    /**
     * Persist a new artifact for {@code key}. Always appends; replaying the same
     * save yields the next version rather than reusing the existing row.
     */
    public synchronized Artifact save(String code, CacheKey key, String modelId) {
        Artifact template = Artifact.builder()
                .id("pending")
                .slug(SlugGenerator.slugFor(key.getDescription(), key.getDataVariableName()))
                .contentHash(key.getContentHash())
                .shortHash(key.getShortHash())
                .sourceDescription(key.getDescription())
                .dataVariableName(key.getDataVariableName())
                .dataShape(key.getDataShape())
                .exportsSignature(key.getExportsSignature())
                .importsSignature(key.getImportsSignature())
                .themeSignature(key.getThemeSignature())
                .exports(key.getExports())
                .imports(key.getImports())
                .build();
        return append(code, template, modelId);
    }

    /**
     * Persist {@code code} under the same cache-key material as {@code predecessor},
     * so the new row becomes the newest version in that cache slot. Used for
     * host-reported runtime fixes; the caller links the lineage afterwards.
     */
    public synchronized Artifact saveSuccessor(String code, Artifact predecessor, String modelId) {
        if (predecessor.isExternal()) {
            throw new IllegalArgumentException("External artifacts have no cache slot: " + predecessor.getId());
        }
        return append(code, predecessor, modelId);
    }

    /**
     * Second phase of a revision save: point {@code artifactId} at its parent.
     * Runs only after the child row exists, so a failure in between leaves an
     * unlinked child rather than a dangling reference.
     */
    public synchronized Artifact linkBase(String artifactId, String baseArtifactId) {
        Artifact child = findById(artifactId)
                .orElseThrow(() -> new StaleReferenceException(artifactId));
        if (findById(baseArtifactId).isEmpty()) {
            throw new StaleReferenceException(baseArtifactId);
        }
        if (child.isExternal()) {
            throw new IllegalArgumentException("External artifacts cannot be linked: " + artifactId);
        }

        Artifact linked = child.linkedTo(baseArtifactId);
        replaceRow(linked);
        persistIndex();

        log.info("[ArtifactStore] Linked {} → base {}", artifactId, baseArtifactId);
        return linked;
    }

    // ================================================================
    // Resolution
    // ================================================================

    public synchronized Optional<Artifact> findById(String artifactId) {
        if (artifactId == null) return Optional.empty();
        Artifact external = externals.get(artifactId);
        if (external != null) return Optional.of(external);
        return rows.stream().filter(a -> a.getId().equals(artifactId)).findFirst();
    }

    public synchronized List<Artifact> findBySlug(String slug) {
        return rows.stream()
                .filter(a -> a.getSlug().equals(slug))
                .sorted(Comparator.comparingInt(Artifact::getVersion))
                .collect(Collectors.toList());
    }

    public synchronized List<Artifact> findAll() {
        return List.copyOf(rows);
    }

    /** Direct children of {@code artifactId} in the lineage DAG. */
    public synchronized List<Artifact> findRevisionsOf(String artifactId) {
        return rows.stream()
                .filter(a -> artifactId.equals(a.getBaseArtifactId()))
                .collect(Collectors.toList());
    }

    public String loadCode(Artifact artifact) {
        if (artifact.isExternal()) {
            String code = externalCode.get(artifact.getId());
            if (code == null) throw new StaleReferenceException(artifact.getId());
            return code;
        }
        try {
            return storage.read(payloadPath(artifact));
        } catch (StorageException e) {
            throw new StoreException("Failed to load code for " + artifact.getId(), e);
        }
    }

    // ================================================================
    // External code
    // ================================================================

    /** Load code this store did not produce, e.g. a file the user supplies. */
    public Artifact loadExternal(Path source) {
        String code;
        try {
            code = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Failed to read external code: " + source, e);
        }
        return registerExternal(code, source.getFileName().toString());
    }

    public Artifact registerExternal(String code, String label) {
        String contentHash = Fingerprint.sha256(code);
        String shortHash   = Fingerprint.shortHash(contentHash);
        String id          = EXTERNAL_PREFIX + shortHash;
        Instant now        = clock.instant();

        Artifact artifact = Artifact.builder()
                .id(id)
                .slug(SlugGenerator.slugFor(label != null ? label : "", null))
                .contentHash(contentHash)
                .shortHash(shortHash)
                .version(1)
                .sourceDescription(label)
                .dataShape(DataShape.EMPTY)
                .createdAt(now)
                .lastUsedAt(now)
                .componentNames(ComponentExtractor.extract(code))
                .origin(ArtifactOrigin.EXTERNAL)
                .build();

        externals.put(id, artifact);
        externalCode.put(id, code);
        log.info("[ArtifactStore] Registered external artifact {} ({} components)",
                id, artifact.getComponentNames().size());
        return artifact;
    }

    // ================================================================
    // Removal
    // ================================================================

    /**
     * Remove every artifact matching {@code filter}: index rows with their payloads,
     * and in-memory external artifacts. Returns the number removed.
     */
    public synchronized int removeWhere(Predicate<Artifact> filter) {
        List<Artifact> doomed = rows.stream().filter(filter).collect(Collectors.toList());

        for (Artifact artifact : doomed) {
            try {
                storage.delete(payloadPath(artifact));
            } catch (StorageException e) {
                throw new StoreException("Failed to delete payload for " + artifact.getId(), e);
            }
        }
        if (!doomed.isEmpty()) {
            rows.removeAll(doomed);
            persistIndex();
        }

        List<String> externalIds = externals.values().stream()
                .filter(filter)
                .map(Artifact::getId)
                .collect(Collectors.toList());
        for (String id : externalIds) {
            externals.remove(id);
            externalCode.remove(id);
        }

        int removed = doomed.size() + externalIds.size();
        if (removed > 0) {
            log.info("[ArtifactStore] Removed {} artifact rows and {} external artifacts",
                    doomed.size(), externalIds.size());
        }
        return removed;
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Artifact append(String code, Artifact keyMaterial, String modelId) {
        String slug      = keyMaterial.getSlug();
        int    version   = nextVersion(slug);
        String shortHash = keyMaterial.getShortHash();
        String fileName  = slug + "__" + shortHash + "__v" + version + ".js";
        Instant now      = clock.instant();

        Artifact artifact = keyMaterial.toBuilder()
                .id(shortHash + "-v" + version)
                .version(version)
                .fileName(fileName)
                .modelId(modelId)
                .createdAt(now)
                .lastUsedAt(now)
                .baseArtifactId(null)
                .componentNames(ComponentExtractor.extract(code))
                .origin(ArtifactOrigin.LOCAL)
                .build();

        try {
            storage.write(payloadPath(artifact), code);
        } catch (StorageException e) {
            throw new StoreException("Failed to write payload for " + artifact.getId(), e);
        }

        rows.add(artifact);
        try {
            persistIndex();
        } catch (StoreException e) {
            rows.remove(rows.size() - 1);
            throw e;
        }

        log.info("[ArtifactStore] Saved {} (slug={}, version={}, components={})",
                artifact.getId(), slug, version, artifact.getComponentNames());
        return artifact;
    }

    private int nextVersion(String slug) {
        return rows.stream()
                .filter(a -> a.getSlug().equals(slug))
                .mapToInt(Artifact::getVersion)
                .max()
                .orElse(0) + 1;
    }

    private void replaceRow(Artifact updated) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).getId().equals(updated.getId())) {
                rows.set(i, updated);
                return;
            }
        }
    }

    private static String payloadPath(Artifact artifact) {
        return PAYLOAD_DIR + "/" + artifact.getFileName();
    }

    private List<Artifact> loadIndex() {
        if (!storage.exists(INDEX_FILE)) return List.of();
        try {
            return StableJson.mapper().readValue(storage.read(INDEX_FILE), ROWS_TYPE);
        } catch (StorageException | IOException e) {
            log.warn("[ArtifactStore] Index unreadable, starting empty: {}", e.getMessage());
            return List.of();
        }
    }

    private void persistIndex() {
        try {
            storage.write(INDEX_FILE, StableJson.mapper()
                    .writerWithDefaultPrettyPrinter()
                    .writeValueAsString(rows));
        } catch (StorageException | IOException e) {
            throw new StoreException("Failed to persist artifact index", e);
        }
    }
}
