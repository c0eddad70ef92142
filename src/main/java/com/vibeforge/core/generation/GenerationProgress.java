package com.vibeforge.core.generation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Host-facing view of one request: status, human-readable log, final code.
 *
 * Written by the request thread, read by status pollers; all access is synchronized.
 */
public class GenerationProgress {

    private final String  requestId;
    private final Instant startedAt;

    private RequestStatus status = RequestStatus.GENERATING;
    private final List<String> logs = new ArrayList<>();
    private String artifactId;
    private String code;
    private String errorMessage;
    private int    streamedChars;

    public GenerationProgress(String requestId) {
        this.requestId = requestId;
        this.startedAt = Instant.now();
    }

    public synchronized void log(String line) {
        logs.add(line);
    }

    public synchronized void addStreamedChars(int count) {
        streamedChars += count;
    }

    public synchronized void markReady(String artifactId, String code) {
        this.status     = RequestStatus.READY;
        this.artifactId = artifactId;
        this.code       = code;
    }

    public synchronized void markError(String message) {
        this.status       = RequestStatus.ERROR;
        this.errorMessage = message;
        logs.add("Error: " + message);
    }

    public String  getRequestId() { return requestId; }
    public Instant getStartedAt() { return startedAt; }

    public synchronized RequestStatus getStatus()        { return status; }
    public synchronized List<String>  getLogs()          { return List.copyOf(logs); }
    public synchronized String        getArtifactId()    { return artifactId; }
    public synchronized String        getCode()          { return code; }
    public synchronized String        getErrorMessage()  { return errorMessage; }
    public synchronized int           getStreamedChars() { return streamedChars; }
}
