package com.vibeforge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * VibeForgeSettings: every tunable the core reads, bound once at startup.
 *
 * Components take this object in their constructors instead of reading
 * properties themselves, so tests can build a settings instance directly.
 */
@Component
public class VibeForgeSettings {

    public static final int DEFAULT_MAX_REPAIR_ATTEMPTS = 3;

    private final Path     storeRoot;
    private final long     maxPayloadBytes;
    private final int      maxRepairAttempts;
    private final Duration collaboratorTimeout;
    private final boolean  nodeCheckEnabled;
    private final String   nodeExecutable;

    public VibeForgeSettings(
            @Value("${vibeforge.store.path:.vibeforge}") String storePath,
            @Value("${vibeforge.store.max-payload-bytes:10485760}") long maxPayloadBytes,
            @Value("${vibeforge.generation.max-repair-attempts:3}") int maxRepairAttempts,
            @Value("${vibeforge.collaborator.timeout-seconds:120}") long timeoutSeconds,
            @Value("${vibeforge.smoke.node-enabled:false}") boolean nodeCheckEnabled,
            @Value("${vibeforge.smoke.node-executable:node}") String nodeExecutable
    ) {
        if (maxRepairAttempts < 0) {
            throw new IllegalArgumentException("max-repair-attempts must be >= 0, got " + maxRepairAttempts);
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeout-seconds must be > 0, got " + timeoutSeconds);
        }
        this.storeRoot           = Paths.get(storePath).toAbsolutePath().normalize();
        this.maxPayloadBytes     = maxPayloadBytes;
        this.maxRepairAttempts   = maxRepairAttempts;
        this.collaboratorTimeout = Duration.ofSeconds(timeoutSeconds);
        this.nodeCheckEnabled    = nodeCheckEnabled;
        this.nodeExecutable      = nodeExecutable;
    }

    /** Settings rooted at {@code storeRoot} with every other value at its default. */
    public static VibeForgeSettings forStore(Path storeRoot) {
        return new VibeForgeSettings(storeRoot.toString(), 10L * 1024 * 1024,
                DEFAULT_MAX_REPAIR_ATTEMPTS, 120, false, "node");
    }

    public Path     getStoreRoot()           { return storeRoot; }
    public long     getMaxPayloadBytes()     { return maxPayloadBytes; }
    public int      getMaxRepairAttempts()   { return maxRepairAttempts; }
    public Duration getCollaboratorTimeout() { return collaboratorTimeout; }
    public boolean  isNodeCheckEnabled()     { return nodeCheckEnabled; }
    public String   getNodeExecutable()      { return nodeExecutable; }
}
