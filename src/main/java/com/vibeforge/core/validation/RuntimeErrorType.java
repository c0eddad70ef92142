package com.vibeforge.core.validation;

/**
 * Classification of runtime/load-time error messages.
 *
 * Anything other than {@link #NONE} is "runtime-shaped": a lone issue of that
 * shape gets a targeted fix instead of a broad repair.
 */
public enum RuntimeErrorType {

    /** Parse failure: unbalanced brackets, unterminated literals. */
    SYNTAX_ERROR("The code does not parse. Fix only the broken construct at the reported line."),

    /** Identifier used before definition or never imported. */
    REFERENCE_ERROR("A name is not defined. Add the missing import or declaration."),

    /** Wrong type at runtime: calling a non-function, reading a property of undefined. */
    TYPE_ERROR("A value has the wrong type. Guard null/undefined payloads before use."),

    /** Invalid numeric range, array length, or recursion depth. */
    RANGE_ERROR("A value is out of range. Clamp or validate the offending number."),

    /** A CDN module failed to resolve or load. */
    MODULE_ERROR("A module import failed. Check the CDN URL and its version pin."),

    /** Error-shaped message that matches no specific class. */
    GENERIC_ERROR("The widget threw at runtime. Make the smallest change that removes the error."),

    /** Not a runtime error message (e.g. a structural validator finding). */
    NONE("");

    private final String repairHint;

    RuntimeErrorType(String repairHint) {
        this.repairHint = repairHint;
    }

    public String getRepairHint() {
        return repairHint;
    }
}
