package com.vibeforge.core.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Audit depth. FULL adds rationale, structured alternatives and lenses per concern.
 */
public enum AuditLevel {
    FAST,
    FULL;

    /** Root key of the collaborator's JSON report, e.g. {@code fast_audit}. */
    public String reportRootKey() {
        return wireName() + "_audit";
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditLevel fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("Audit level is required");
        return AuditLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
