package com.vibeforge.core.event;

public enum EventType {
    GENERATION_STEP,
    GENERATION_CHUNK,
    GENERATION_COMPLETE,
    GENERATION_ERROR,
    ARTIFACT_SAVED,
    AUDIT_COMPLETED
}
