package com.vibeforge.core.artifact;

/** A referenced artifact (revision base, fix target, audit target) cannot be resolved. */
public class StaleReferenceException extends RuntimeException {

    private final String artifactId;

    public StaleReferenceException(String artifactId) {
        super("Artifact not found: " + artifactId);
        this.artifactId = artifactId;
    }

    public String getArtifactId() { return artifactId; }
}
