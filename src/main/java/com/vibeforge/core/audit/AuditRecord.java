package com.vibeforge.core.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One persisted audit report. Never mutated after creation; later audits
 * supersede it by writing a new record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"audit_id", "level", "artifact_id", "base_artifact_id", "code_hash", "created_at",
        "concerns", "open_questions", "line_hashes"})
public final class AuditRecord {

    private final String                auditId;
    private final AuditLevel            level;
    private final String                artifactId;
    private final String                baseArtifactId;
    private final String                codeHash;
    private final Map<Integer, String>  lineHashes;
    private final List<Concern>         concerns;
    private final List<String>          openQuestions;
    private final Instant               createdAt;

    @JsonCreator
    public AuditRecord(@JsonProperty("audit_id")         String auditId,
                       @JsonProperty("level")            AuditLevel level,
                       @JsonProperty("artifact_id")      String artifactId,
                       @JsonProperty("base_artifact_id") String baseArtifactId,
                       @JsonProperty("code_hash")        String codeHash,
                       @JsonProperty("line_hashes")      Map<Integer, String> lineHashes,
                       @JsonProperty("concerns")         List<Concern> concerns,
                       @JsonProperty("open_questions")   List<String> openQuestions,
                       @JsonProperty("created_at")       Instant createdAt) {
        this.auditId        = Objects.requireNonNull(auditId, "auditId");
        this.level          = Objects.requireNonNull(level, "level");
        this.artifactId     = Objects.requireNonNull(artifactId, "artifactId");
        this.baseArtifactId = baseArtifactId;
        this.codeHash       = Objects.requireNonNull(codeHash, "codeHash");
        this.lineHashes     = lineHashes != null
                ? Collections.unmodifiableSortedMap(new TreeMap<>(lineHashes))
                : Collections.emptySortedMap();
        this.concerns       = concerns != null ? List.copyOf(concerns) : List.of();
        this.openQuestions  = openQuestions != null ? List.copyOf(openQuestions) : List.of();
        this.createdAt      = createdAt;
    }

    @JsonProperty("audit_id")         public String               getAuditId()        { return auditId; }
    @JsonProperty("level")            public AuditLevel           getLevel()          { return level; }
    @JsonProperty("artifact_id")      public String               getArtifactId()     { return artifactId; }
    @JsonProperty("base_artifact_id") public String               getBaseArtifactId() { return baseArtifactId; }
    @JsonProperty("code_hash")        public String               getCodeHash()       { return codeHash; }
    @JsonProperty("line_hashes")      public Map<Integer, String> getLineHashes()     { return lineHashes; }
    @JsonProperty("concerns")         public List<Concern>        getConcerns()       { return concerns; }
    @JsonProperty("open_questions")   public List<String>         getOpenQuestions()  { return openQuestions; }
    @JsonProperty("created_at")       public Instant              getCreatedAt()      { return createdAt; }

    @Override
    public String toString() {
        return "AuditRecord{" + auditId + ", " + level + ", artifact=" + artifactId
                + ", concerns=" + concerns.size() + "}";
    }
}
