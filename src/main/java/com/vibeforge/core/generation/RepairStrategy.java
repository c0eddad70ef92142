package com.vibeforge.core.generation;

import com.vibeforge.core.validation.RuntimeErrorClassifier;

import java.util.List;

public enum RepairStrategy {

    /** Exactly one issue and it reads like an engine error: smallest possible change. */
    TARGETED_FIX,

    /** Anything else: hand the collaborator the full issue list. */
    BROAD_REPAIR;

    public static RepairStrategy choose(List<String> issues) {
        if (issues.size() == 1 && RuntimeErrorClassifier.isRuntimeShaped(issues.get(0))) {
            return TARGETED_FIX;
        }
        return BROAD_REPAIR;
    }
}
