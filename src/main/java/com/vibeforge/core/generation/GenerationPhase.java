package com.vibeforge.core.generation;

/**
 * Phase graph for one generation request.
 *
 * ANALYZING → GENERATING → VALIDATING → (REPAIRING → VALIDATING)* → DONE
 *
 * ANALYZING  - Build the DataContext. Heuristic classification only.
 * GENERATING: One generate or revise call. Skipped when the request carries
 *              code to fix (runtime-error channel).
 * VALIDATING: CodeValidator then RuntimeSmokeTester; issues are the union.
 * REPAIRING  - One targeted fix or broad repair call, bounded by the budget.
 * DONE       - Clean, or budget exhausted with the last code accepted.
 */
public enum GenerationPhase {
    ANALYZING,
    GENERATING,
    VALIDATING,
    REPAIRING,
    DONE
}
