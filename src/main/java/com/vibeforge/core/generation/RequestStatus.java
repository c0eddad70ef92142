package com.vibeforge.core.generation;

/**
 * Host-facing lifecycle status. ERROR is reserved for collaborator failures and
 * stale references; residual validator issues still end in READY.
 */
public enum RequestStatus {
    GENERATING,
    READY,
    ERROR
}
