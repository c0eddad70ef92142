package com.vibeforge.llm;

/**
 * What a collaborator call is for. Drives system prompt and temperature selection.
 */
public enum CodeGenRole {
    GENERATE,
    REVISE,
    FIX,
    REPAIR,
    AUDIT
}
