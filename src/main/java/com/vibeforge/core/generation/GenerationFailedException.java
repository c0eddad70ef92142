package com.vibeforge.core.generation;

/** No code at all could be obtained from the collaborator within the attempt budget. */
public class GenerationFailedException extends RuntimeException {

    private final int collaboratorCalls;

    public GenerationFailedException(String message, int collaboratorCalls, Throwable cause) {
        super(message, cause);
        this.collaboratorCalls = collaboratorCalls;
    }

    public int getCollaboratorCalls() {
        return collaboratorCalls;
    }
}
