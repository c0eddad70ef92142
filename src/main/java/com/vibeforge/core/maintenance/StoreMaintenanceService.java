package com.vibeforge.core.maintenance;

import com.vibeforge.core.artifact.Artifact;
import com.vibeforge.core.artifact.ArtifactStore;
import com.vibeforge.core.artifact.InvalidRequestException;
import com.vibeforge.core.audit.AuditStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * The only way artifacts and audit records are ever destroyed.
 */
@Service
public class StoreMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(StoreMaintenanceService.class);

    private final ArtifactStore artifactStore;
    private final AuditStore    auditStore;

    public StoreMaintenanceService(ArtifactStore artifactStore, AuditStore auditStore) {
        this.artifactStore = artifactStore;
        this.auditStore    = auditStore;
    }

    /**
     * @param target artifact id or slug; required for BY_ARTIFACT, ignored otherwise
     * @return number of artifact and audit rows removed
     */
    public int clear(ClearScope scope, String target) {
        int removed;
        switch (scope) {
            case ALL:
                removed = artifactStore.removeWhere(a -> true) + auditStore.removeWhere(e -> true);
                break;
            case ARTIFACTS:
                removed = artifactStore.removeWhere(a -> true);
                break;
            case AUDITS:
                removed = auditStore.removeWhere(e -> true);
                break;
            case BY_ARTIFACT:
                removed = clearArtifact(target);
                break;
            default:
                throw new IllegalArgumentException("Unknown scope " + scope);
        }
        log.info("[Maintenance] clear({}{}) removed {} row(s)", scope,
                target != null && scope == ClearScope.BY_ARTIFACT ? ", " + target : "", removed);
        return removed;
    }

    private int clearArtifact(String target) {
        if (target == null || target.isBlank()) {
            throw new InvalidRequestException("BY_ARTIFACT clear needs an artifact id or slug");
        }
        Set<String> ids = artifactStore.findAll().stream()
                .filter(a -> matches(a, target))
                .map(Artifact::getId)
                .collect(Collectors.toSet());
        // audits can outlive their artifact after an ARTIFACTS clear
        ids.add(target);

        int artifacts = artifactStore.removeWhere(a -> matches(a, target));
        int audits    = auditStore.removeWhere(e -> ids.contains(e.getArtifactId()));
        return artifacts + audits;
    }

    private static boolean matches(Artifact artifact, String target) {
        return artifact.getId().equals(target) || artifact.getSlug().equals(target);
    }
}
