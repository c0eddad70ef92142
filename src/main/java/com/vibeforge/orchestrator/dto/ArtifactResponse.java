package com.vibeforge.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vibeforge.core.artifact.Artifact;
import com.vibeforge.core.generation.GenerationOutcome;
import com.vibeforge.core.generation.GenerationResult;
import com.vibeforge.core.generation.RequestStatus;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArtifactResponse {

    private final String            requestId;
    private final RequestStatus     status;
    private final boolean           cacheHit;
    private final String            artifactId;
    private final String            slug;
    private final int               version;
    private final String            baseArtifactId;
    private final List<String>      componentNames;
    private final String            code;
    private final GenerationOutcome outcome;
    private final List<String>      residualIssues;
    private final List<String>      warnings;
    private final int               collaboratorCalls;

    private ArtifactResponse(String requestId, Artifact artifact, String code, boolean cacheHit,
                             GenerationResult result) {
        this.requestId         = requestId;
        this.status            = RequestStatus.READY;
        this.cacheHit          = cacheHit;
        this.artifactId        = artifact.getId();
        this.slug              = artifact.getSlug();
        this.version           = artifact.getVersion();
        this.baseArtifactId    = artifact.getBaseArtifactId();
        this.componentNames    = artifact.getComponentNames();
        this.code              = code;
        this.outcome           = result != null ? result.getOutcome() : null;
        this.residualIssues    = result != null ? result.getResidualIssues() : List.of();
        this.warnings          = result != null ? result.getWarnings() : List.of();
        this.collaboratorCalls = result != null ? result.getCollaboratorCalls() : 0;
    }

    public static ArtifactResponse cached(String requestId, Artifact artifact, String code) {
        return new ArtifactResponse(requestId, artifact, code, true, null);
    }

    public static ArtifactResponse generated(String requestId, Artifact artifact, GenerationResult result) {
        return new ArtifactResponse(requestId, artifact, result.getCode(), false, result);
    }

    public String            getRequestId()         { return requestId; }
    public RequestStatus     getStatus()            { return status; }
    public boolean           isCacheHit()           { return cacheHit; }
    public String            getArtifactId()        { return artifactId; }
    public String            getSlug()              { return slug; }
    public int               getVersion()           { return version; }
    public String            getBaseArtifactId()    { return baseArtifactId; }
    public List<String>      getComponentNames()    { return componentNames; }
    public String            getCode()              { return code; }
    public GenerationOutcome getOutcome()           { return outcome; }
    public List<String>      getResidualIssues()    { return residualIssues; }
    public List<String>      getWarnings()          { return warnings; }
    public int               getCollaboratorCalls() { return collaboratorCalls; }
}
