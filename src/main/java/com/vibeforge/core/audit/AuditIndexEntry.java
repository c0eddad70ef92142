package com.vibeforge.core.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** One row of the audit index: enough to find a record without reading its payload. */
public final class AuditIndexEntry {

    private final String     auditId;
    private final String     artifactId;
    private final AuditLevel level;
    private final String     fileName;
    private final Instant    createdAt;

    @JsonCreator
    public AuditIndexEntry(@JsonProperty("audit_id")    String auditId,
                           @JsonProperty("artifact_id") String artifactId,
                           @JsonProperty("level")       AuditLevel level,
                           @JsonProperty("file_name")   String fileName,
                           @JsonProperty("created_at")  Instant createdAt) {
        this.auditId    = auditId;
        this.artifactId = artifactId;
        this.level      = level;
        this.fileName   = fileName;
        this.createdAt  = createdAt;
    }

    @JsonProperty("audit_id")    public String     getAuditId()    { return auditId; }
    @JsonProperty("artifact_id") public String     getArtifactId() { return artifactId; }
    @JsonProperty("level")       public AuditLevel getLevel()      { return level; }
    @JsonProperty("file_name")   public String     getFileName()   { return fileName; }
    @JsonProperty("created_at")  public Instant    getCreatedAt()  { return createdAt; }
}
