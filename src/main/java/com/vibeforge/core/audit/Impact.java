package com.vibeforge.core.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Impact {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing values read as LOW; reports are told to default low. */
    @JsonCreator
    public static Impact fromWire(String value) {
        if (value == null) return LOW;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "high":   return HIGH;
            case "medium": return MEDIUM;
            default:       return LOW;
        }
    }
}
