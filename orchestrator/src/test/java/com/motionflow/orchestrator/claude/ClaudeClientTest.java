package com.motionflow.orchestrator.claude;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ClaudeClient against a local stub of the Messages endpoint.
 */
class ClaudeClientTest {

    private HttpServer server;
    private ClaudeClient client;

    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private volatile int    replyStatus = 200;
    private volatile String replyBody   = "";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/messages", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = replyBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(replyStatus, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        client = new ClaudeClient("test-key", "http://127.0.0.1:" + server.getAddress().getPort() + "/",
                Duration.ofSeconds(5), new ObjectMapper());
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    // ------------------------------------------------------------------
    // requestBody
    // ------------------------------------------------------------------

    @Test
    void requestBody_withReasoningBudget_enablesThinking() {
        Map<String, Object> body = client.requestBody(
                new ModelRequest("claude-opus-4-5-20251101", 16_000, 128_000, "system", "prompt"));

        assertThat(body).containsEntry("max_tokens", 128_000)
                .containsEntry("thinking", Map.of("type", "enabled", "budget_tokens", 16_000));
    }

    @Test
    void requestBody_withoutReasoning_hasNoThinkingOrBlankSystem() {
        Map<String, Object> body = client.requestBody(
                new ModelRequest("claude-sonnet-4-20250514", null, 64_000, " ", "prompt"));

        assertThat(body).doesNotContainKeys("thinking", "system");
    }

    // ------------------------------------------------------------------
    // complete
    // ------------------------------------------------------------------

    @Test
    void complete_skipsThinkingBlocksAndReadsUsage() {
        replyBody = """
                {"content":[{"type":"thinking","thinking":"..."},{"type":"text","text":"<result>ok</result>"}],
                 "usage":{"input_tokens":1500,"output_tokens":420}}
                """;

        ModelResponse response = client.complete(
                new ModelRequest("claude-sonnet-4-20250514", null, 64_000, "system", "draft it"));

        assertThat(response.text()).isEqualTo("<result>ok</result>");
        assertThat(response.inputTokens()).isEqualTo(1500);
        assertThat(response.outputTokens()).isEqualTo(420);
        assertThat(lastRequest.get()).contains("\"draft it\"");
    }

    @Test
    void complete_overloaded_isCapacityError() {
        replyStatus = 529;
        replyBody = "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\"}}";

        assertThatThrownBy(() -> client.complete(
                new ModelRequest("claude-sonnet-4-20250514", null, 64_000, null, "p")))
                .isInstanceOfSatisfying(ExternalCallException.class, e -> {
                    assertThat(e.statusCode()).isEqualTo(529);
                    assertThat(e.isCapacity()).isTrue();
                });
    }

    @Test
    void complete_noTextBlock_isUnreadable() {
        replyBody = "{\"content\":[],\"usage\":{\"input_tokens\":1,\"output_tokens\":0}}";

        assertThatThrownBy(() -> client.complete(
                new ModelRequest("claude-sonnet-4-20250514", null, 64_000, null, "p")))
                .isInstanceOf(ExternalCallException.class)
                .hasMessageContaining("Unreadable");
    }
}
