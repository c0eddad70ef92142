package com.vibeforge.core.artifact;

public enum ArtifactOrigin {
    /** Produced by the generation loop and persisted in the store. */
    LOCAL,
    /** Code loaded from a caller-supplied location; never written to the store index. */
    EXTERNAL
}
