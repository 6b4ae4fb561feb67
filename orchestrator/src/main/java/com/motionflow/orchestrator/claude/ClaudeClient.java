package com.motionflow.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API over java.net.http.
 *
 * Single-turn: one user message per phase, with the phase's system prompt.
 * When the route carries a reasoning budget the request enables extended
 * thinking; thinking blocks in the reply are skipped and only text is returned.
 */
@Component
public class ClaudeClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(List<ContentBlock> content, Usage usage) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record ContentBlock(String type, String text) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Usage(@JsonProperty("input_tokens") long inputTokens,
                     @JsonProperty("output_tokens") long outputTokens) {}

        /** Concatenated text blocks; thinking blocks are dropped. */
        String text() {
            StringBuilder sb = new StringBuilder();
            for (ContentBlock b : content == null ? List.<ContentBlock>of() : content) {
                if ("text".equals(b.type()) && b.text() != null) sb.append(b.text());
            }
            if (sb.isEmpty()) throw new IllegalStateException("No text block in response");
            return sb.toString();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final URI          endpoint;
    private final Duration     requestTimeout;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        @Value("${anthropic.request-timeout:PT10M}") Duration requestTimeout,
                        ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.json           = objectMapper;
        this.endpoint       = URI.create(baseUrl.replaceAll("/+$", "") + "/v1/messages");
        this.requestTimeout = requestTimeout;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public ModelResponse complete(ModelRequest req) {
        String body;
        try {
            body = json.writeValueAsString(requestBody(req));
        } catch (IOException e) {
            throw new ExternalCallException("Could not serialise model request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalCallException("Model call to " + req.model() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException("Model call to " + req.model() + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            log.warn("Model {} returned HTTP {}", req.model(), response.statusCode());
            throw new ExternalCallException(response.statusCode(),
                    "Model API error %d: %s".formatted(response.statusCode(), response.body()));
        }

        try {
            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            long in  = parsed.usage() == null ? 0 : parsed.usage().inputTokens();
            long out = parsed.usage() == null ? 0 : parsed.usage().outputTokens();
            return new ModelResponse(parsed.text(), in, out);
        } catch (IOException | IllegalStateException e) {
            throw new ExternalCallException("Unreadable response from " + req.model(), e);
        }
    }

    /**
     * Request JSON. {@code thinking} is only present when the route has a
     * reasoning budget; its token cap was already raised by the registry.
     */
    Map<String, Object> requestBody(ModelRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",      req.model());
        body.put("max_tokens", req.maxTokens());
        if (req.system() != null && !req.system().isBlank()) {
            body.put("system", req.system());
        }
        if (req.reasoningBudget() != null) {
            body.put("thinking", Map.of("type", "enabled", "budget_tokens", req.reasoningBudget()));
        }
        body.put("messages", List.of(Map.of("role", "user", "content", req.prompt())));
        return body;
    }
}
