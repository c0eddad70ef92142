package com.vibeforge.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;

@Component
@Profile("gemini")
public class GeminiCodeModelClient implements CodeModelClient {

    private static final Logger log =
            LoggerFactory.getLogger(GeminiCodeModelClient.class);

    private static final int  MAX_RETRIES     = 3;
    private static final long BASE_BACKOFF_MS = 500;
    private static final long MAX_JITTER_MS   = 250;

    private final WebClient webClient;
    private final Random jitterRandom = new Random();

    @Value("${gemini.api.key}")
    private String apiKey;

    @Value("${gemini.api.model:gemini-1.5-flash}")
    private String model;

    @Value("${gemini.api.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl;

    @Value("${gemini.api.request-timeout-seconds:90}")
    private long requestTimeoutSeconds;

    public GeminiCodeModelClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public String getModelId() {
        return "gemini:" + model;
    }

    @Override
    public String generateWithRole(CodeGenRole role, String userPrompt, double temperature, Consumer<String> onChunk) {

        log.info("[Gemini] role={} model={} promptLen={}", role, model, userPrompt.length());

        Map<String, Object> body = Map.of(
            "systemInstruction", Map.of(
                "parts", List.of(Map.of("text", SystemPrompts.forRole(role)))
            ),
            "contents", List.of(
                Map.of(
                    "parts", List.of(
                        Map.of("text", userPrompt)
                    )
                )
            ),
            "generationConfig", Map.of("temperature", temperature)
        );

        int attempt = 0;

        while (true) {
            try {
                attempt++;

                log.debug("[Gemini] Attempt {} sending request", attempt);

                Map<?, ?> response = webClient
                        .post()
                        .uri(baseUrl + "/models/" + model + ":generateContent?key=" + apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(Map.class)
                        .timeout(Duration.ofSeconds(requestTimeoutSeconds))
                        .block();

                log.info("[Gemini] Call succeeded | retries={}", attempt - 1);

                String text = extractText(response);
                if (onChunk != null) onChunk.accept(text);
                return text;

            } catch (RuntimeException ex) {

                if (!isRetryable(ex) || attempt > MAX_RETRIES) {
                    log.error("[Gemini] Final failure | attempts={} | retries={}",
                            attempt, attempt - 1, ex);
                    throw ex;
                }

                long backoff = computeBackoff(attempt);

                log.warn("[Gemini] Transient failure on attempt {}. Retrying after {} ms. Cause: {}",
                        attempt, backoff, rootMessage(ex));

                sleep(backoff);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private String extractText(Map<?, ?> response) {
        try {
            var candidates = (List<Map<String, Object>>) response.get("candidates");
            var content = (Map<String, Object>) candidates.get(0).get("content");
            var parts = (List<Map<String, Object>>) content.get("parts");
            StringBuilder text = new StringBuilder();
            for (Map<String, Object> part : parts) {
                Object piece = part.get("text");
                if (piece != null) text.append(piece);
            }
            return text.toString();
        } catch (RuntimeException e) {
            log.error("[Gemini] Failed to parse response: {}", response, e);
            throw new IllegalStateException("Malformed Gemini response", e);
        }
    }

    /** Retry only transient failures. */
    private boolean isRetryable(Exception ex) {
        return ex instanceof WebClientResponseException.ServiceUnavailable   // 503
            || ex instanceof WebClientResponseException.TooManyRequests      // 429
            || ex.getCause() instanceof IOException;
    }

    /** Exponential backoff with jitter */
    private long computeBackoff(int attempt) {
        long exponential = BASE_BACKOFF_MS * (1L << (attempt - 1));
        long jitter = (long) (jitterRandom.nextDouble() * (MAX_JITTER_MS + 1));
        return exponential + jitter;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
