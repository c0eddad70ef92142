package com.vibeforge.llm;

/**
 * The code-generating collaborator failed, timed out, or returned unusable output.
 */
public class CollaboratorException extends RuntimeException {

    private final CodeGenRole role;
    private final boolean     timeout;

    public CollaboratorException(CodeGenRole role, String message, Throwable cause) {
        this(role, message, cause, false);
    }

    private CollaboratorException(CodeGenRole role, String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.role    = role;
        this.timeout = timeout;
    }

    public static CollaboratorException timedOut(CodeGenRole role, long seconds) {
        return new CollaboratorException(role,
                "Collaborator " + role + " call timed out after " + seconds + "s", null, true);
    }

    public CodeGenRole getRole() { return role; }
    public boolean     isTimeout() { return timeout; }
}
