package com.vibeforge.core.artifact;

/** Unrecoverable persistence failure in the artifact or audit store. */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) { super(message, cause); }
}
