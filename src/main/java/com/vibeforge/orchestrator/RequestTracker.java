package com.vibeforge.orchestrator;

import com.vibeforge.communication.VibeEventListener;
import com.vibeforge.core.event.Event;
import com.vibeforge.core.generation.GenerationProgress;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds progress events into per-request {@link GenerationProgress} for the host.
 * Keeps the most recent {@value #MAX_TRACKED} requests.
 */
@Component
public class RequestTracker implements VibeEventListener {

    static final int MAX_TRACKED = 200;

    private final Map<String, GenerationProgress> requests =
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, GenerationProgress> eldest) {
                    return size() > MAX_TRACKED;
                }
            };

    public synchronized GenerationProgress start(String requestId) {
        GenerationProgress progress = new GenerationProgress(requestId);
        requests.put(requestId, progress);
        return progress;
    }

    public synchronized Optional<GenerationProgress> find(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    /** Tracked requests, newest first. */
    public synchronized List<GenerationProgress> recent() {
        List<GenerationProgress> newestFirst = new ArrayList<>(requests.values());
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public void onEvent(Event event) {
        if (event.getRequestId() == null) return;
        GenerationProgress progress;
        synchronized (this) {
            progress = requests.get(event.getRequestId());
        }
        if (progress == null) return;

        switch (event.getType()) {
            case GENERATION_CHUNK:
                progress.addStreamedChars(String.valueOf(event.getPayload()).length());
                break;
            case GENERATION_STEP:
                progress.log(String.valueOf(event.getPayload()));
                break;
            case GENERATION_COMPLETE:
                progress.log("Complete: " + event.getPayload());
                break;
            case GENERATION_ERROR:
                progress.log("Error: " + event.getPayload());
                break;
            default:
                break;
        }
    }
}
