package com.vibeforge.core.generation;

/** Both outcomes return code; only the first has no open issues. */
public enum GenerationOutcome {
    ACCEPTED_CLEAN,
    ACCEPTED_WITH_RESIDUAL_ISSUES
}
