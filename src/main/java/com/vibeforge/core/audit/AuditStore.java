package com.vibeforge.core.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vibeforge.core.artifact.StoreException;
import com.vibeforge.core.storage.PayloadStorage;
import com.vibeforge.core.storage.PayloadStorage.StorageException;
import com.vibeforge.util.StableJson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * AuditStore: append-only persistence of audit records.
 *
 * Layout under the store root:
 *   index/audits.json       - index rows in append order
 *   audits/<auditId>.json   - one record per file
 *
 * "Latest" means last appended. Records are never rewritten.
 */
@Component
public class AuditStore {

    private static final Logger log = LoggerFactory.getLogger(AuditStore.class);

    static final String INDEX_FILE  = "index/audits.json";
    static final String PAYLOAD_DIR = "audits";

    private static final TypeReference<List<AuditIndexEntry>> ROWS_TYPE = new TypeReference<>() {};

    private final PayloadStorage        storage;
    private final List<AuditIndexEntry> rows = new ArrayList<>();

    public AuditStore(PayloadStorage storage) {
        this.storage = storage;
        this.rows.addAll(loadIndex());
        log.info("[AuditStore] Loaded {} audit rows", rows.size());
    }

    // ================================================================
    // Save
    // ================================================================

    public synchronized AuditRecord save(AuditRecord record) {
        String fileName = record.getAuditId() + ".json";
        AuditIndexEntry entry = new AuditIndexEntry(record.getAuditId(), record.getArtifactId(),
                record.getLevel(), fileName, record.getCreatedAt());

        try {
            storage.write(PAYLOAD_DIR + "/" + fileName,
                    StableJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(record));
        } catch (StorageException | IOException e) {
            throw new StoreException("Failed to write audit " + record.getAuditId(), e);
        }

        rows.add(entry);
        try {
            persistIndex();
        } catch (StoreException e) {
            rows.remove(rows.size() - 1);
            throw e;
        }

        log.info("[AuditStore] Saved {} ({} concerns) for {}",
                record.getAuditId(), record.getConcerns().size(), record.getArtifactId());
        return record;
    }

    // ================================================================
    // Lookup
    // ================================================================

    /**
     * Most recent readable record for (artifactId, level). A row whose payload is
     * missing or unreadable is skipped with a warning, falling back to the one before it.
     */
    public synchronized Optional<AuditRecord> latest(String artifactId, AuditLevel level) {
        for (int i = rows.size() - 1; i >= 0; i--) {
            AuditIndexEntry entry = rows.get(i);
            if (!entry.getArtifactId().equals(artifactId) || entry.getLevel() != level) continue;
            Optional<AuditRecord> record = read(entry);
            if (record.isPresent()) return record;
        }
        return Optional.empty();
    }

    public synchronized Optional<AuditRecord> findById(String auditId) {
        return rows.stream()
                .filter(e -> e.getAuditId().equals(auditId))
                .findFirst()
                .flatMap(this::read);
    }

    public synchronized List<AuditIndexEntry> findByArtifact(String artifactId) {
        return rows.stream()
                .filter(e -> e.getArtifactId().equals(artifactId))
                .collect(Collectors.toList());
    }

    public synchronized int size() {
        return rows.size();
    }

    // ================================================================
    // Removal
    // ================================================================

    public synchronized int removeWhere(Predicate<AuditIndexEntry> filter) {
        List<AuditIndexEntry> doomed = rows.stream().filter(filter).collect(Collectors.toList());
        if (doomed.isEmpty()) return 0;

        for (AuditIndexEntry entry : doomed) {
            try {
                storage.delete(PAYLOAD_DIR + "/" + entry.getFileName());
            } catch (StorageException e) {
                throw new StoreException("Failed to delete audit " + entry.getAuditId(), e);
            }
        }
        rows.removeAll(doomed);
        persistIndex();

        log.info("[AuditStore] Removed {} audit rows", doomed.size());
        return doomed.size();
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Optional<AuditRecord> read(AuditIndexEntry entry) {
        String path = PAYLOAD_DIR + "/" + entry.getFileName();
        if (!storage.exists(path)) {
            log.warn("[AuditStore] Index row {} has no payload. Skipping.", entry.getAuditId());
            return Optional.empty();
        }
        try {
            return Optional.of(StableJson.mapper().readValue(storage.read(path), AuditRecord.class));
        } catch (StorageException | IOException e) {
            log.warn("[AuditStore] Audit {} unreadable, skipping: {}", entry.getAuditId(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<AuditIndexEntry> loadIndex() {
        if (!storage.exists(INDEX_FILE)) return List.of();
        try {
            return StableJson.mapper().readValue(storage.read(INDEX_FILE), ROWS_TYPE);
        } catch (StorageException | IOException e) {
            log.warn("[AuditStore] Index unreadable, starting empty: {}", e.getMessage());
            return List.of();
        }
    }

    private void persistIndex() {
        try {
            storage.write(INDEX_FILE, StableJson.mapper()
                    .writerWithDefaultPrettyPrinter()
                    .writeValueAsString(rows));
        } catch (StorageException | IOException e) {
            throw new StoreException("Failed to persist audit index", e);
        }
    }
}
