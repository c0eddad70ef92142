package com.vibeforge.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * OllamaCodeModelClient: default backend, a local Ollama server.
 *
 * With a chunk callback the call uses Ollama's NDJSON streaming mode and
 * forwards each {@code response} fragment; without one it makes a single
 * non-streaming request.
 */
@Component
@Profile("!mock & !gemini")
public class OllamaCodeModelClient implements CodeModelClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaCodeModelClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:qwen2.5-coder:7b}")
    private String model;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper = new ObjectMapper();

    // =========================================================================
    // CodeModelClient contract
    // =========================================================================

    @Override
    public String generateWithRole(CodeGenRole role, String userPrompt, double temperature, Consumer<String> onChunk) {
        String fullPrompt = SystemPrompts.forRole(role) + "\n\n" + userPrompt;

        log.debug("[Ollama] role={} temperature={} promptLen={} streaming={}",
                role, temperature, fullPrompt.length(), onChunk != null);

        return onChunk == null
                ? callOllama(fullPrompt, temperature)
                : streamOllama(fullPrompt, temperature, onChunk);
    }

    @Override
    public String getModelId() {
        return "ollama:" + model;
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private Map<String, Object> requestBody(String prompt, double temperature, boolean stream) {
        Map<String, Object> body = new HashMap<>();
        body.put("model",   model);
        body.put("prompt",  prompt);
        body.put("options", Map.of("temperature", temperature));
        body.put("stream",  stream);
        return body;
    }

    private String callOllama(String prompt, double temperature) {
        try {
            String url = baseUrl + "/api/generate";

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response = restTemplate.postForEntity(
                    url, new HttpEntity<>(requestBody(prompt, temperature, false), headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody());

            String result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (Exception e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new IllegalStateException("Ollama call failed: " + e.getMessage(), e);
        }
    }

    private String streamOllama(String prompt, double temperature, Consumer<String> onChunk) {
        try {
            String url = baseUrl + "/api/generate";
            Map<String, Object> body = requestBody(prompt, temperature, true);

            String result = restTemplate.execute(url, HttpMethod.POST,
                    request -> {
                        request.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                        objectMapper.writeValue(request.getBody(), body);
                    },
                    response -> {
                        StringBuilder text = new StringBuilder();
                        try (BufferedReader reader = new BufferedReader(
                                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
                            String line;
                            while ((line = reader.readLine()) != null) {
                                if (line.isBlank()) continue;
                                JsonNode node = objectMapper.readTree(line);
                                String piece = node.path("response").asText("");
                                if (!piece.isEmpty()) {
                                    text.append(piece);
                                    onChunk.accept(piece);
                                }
                                if (node.path("done").asBoolean(false)) break;
                            }
                        }
                        return text.toString();
                    });

            log.debug("[Ollama] streamed responseLen={}", result != null ? result.length() : 0);
            return result != null ? result : "";

        } catch (Exception e) {
            log.error("[Ollama] Streaming call failed: {}", e.getMessage());
            throw new IllegalStateException("Ollama call failed: " + e.getMessage(), e);
        }
    }
}
