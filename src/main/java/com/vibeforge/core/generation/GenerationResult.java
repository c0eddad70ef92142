package com.vibeforge.core.generation;

import java.util.List;

/** What a finished GenerationLoop run hands back: the accepted code plus how it got there. */
public final class GenerationResult {

    private final String              code;
    private final GenerationOutcome   outcome;
    private final List<String>        residualIssues;
    private final List<String>        warnings;
    private final List<RepairAttempt> repairHistory;
    private final int                 collaboratorCalls;
    private final String              modelId;

    public GenerationResult(String code, GenerationOutcome outcome, List<String> residualIssues,
                            List<String> warnings, List<RepairAttempt> repairHistory,
                            int collaboratorCalls, String modelId) {
        this.code              = code;
        this.outcome           = outcome;
        this.residualIssues    = List.copyOf(residualIssues);
        this.warnings          = List.copyOf(warnings);
        this.repairHistory     = List.copyOf(repairHistory);
        this.collaboratorCalls = collaboratorCalls;
        this.modelId           = modelId;
    }

    public String              getCode()              { return code; }
    public GenerationOutcome   getOutcome()           { return outcome; }
    public List<String>        getResidualIssues()    { return residualIssues; }
    public List<String>        getWarnings()          { return warnings; }
    public List<RepairAttempt> getRepairHistory()     { return repairHistory; }
    public int                 getCollaboratorCalls() { return collaboratorCalls; }
    public String              getModelId()           { return modelId; }

    public boolean isClean() {
        return outcome == GenerationOutcome.ACCEPTED_CLEAN;
    }

    @Override
    public String toString() {
        return "GenerationResult{" + outcome + ", calls=" + collaboratorCalls
                + ", repairs=" + repairHistory.size() + ", residual=" + residualIssues.size() + "}";
    }
}
