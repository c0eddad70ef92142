package com.vibeforge.core.artifact;

/** Malformed cache-key inputs. Raised before any lookup or collaborator call. */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) { super(message); }
}
