package com.vibeforge.core.maintenance;

public enum ClearScope {
    /** Every artifact and every audit record. */
    ALL,
    /** Artifacts only; their audit records stay. */
    ARTIFACTS,
    /** Audit records only. */
    AUDITS,
    /** Artifacts whose id or slug equals the target, plus their audit records. */
    BY_ARTIFACT
}
