package com.leadflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadflow.core.model.ActionResult;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookActionHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final WebhookActionHandler handler =
        new WebhookActionHandler(Duration.ofSeconds(2), Duration.ofSeconds(5));
    
    private final AtomicInteger responseStatus = new AtomicInteger(200);
    private final List<String> receivedBodies = new CopyOnWriteArrayList<>();
    private final List<String> receivedKeys = new CopyOnWriteArrayList<>();
    
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            receivedBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            receivedKeys.add(exchange.getRequestHeaders().getFirst("Idempotency-Key"));
            byte[] response = "{\"accepted\": true}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(responseStatus.get(), response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private ActionContext context() throws Exception {
        JsonNode executionContext = mapper.readTree("{\"trigger\": {\"event\": \"form_submitted\"}}");
        return new ActionContext(UUID.randomUUID(), "crm-sync:v1", "lead-7", 2, 1, executionContext, mapper);
    }

    @Test
    void execute_shouldPostTriggerPayloadByDefault() throws Exception {
        ActionContext context = context();
        
        ActionResult result = handler.execute(mapper.readTree("{\"url\": \"" + baseUrl + "/hook\"}"), context);
        
        assertThat(result.success()).isTrue();
        assertThat(result.output().path("status").asInt()).isEqualTo(200);
        assertThat(result.output().path("response").path("accepted").asBoolean()).isTrue();
        assertThat(receivedBodies).singleElement().asString().contains("form_submitted");
        assertThat(receivedKeys).containsExactly(context.getIdempotencyKey());
    }

    @Test
    void execute_shouldTreatServerErrorsAsRetriable() throws Exception {
        responseStatus.set(503);
        
        ActionResult result = handler.execute(mapper.readTree("{\"url\": \"" + baseUrl + "/hook\"}"), context());
        
        assertThat(result.success()).isFalse();
        assertThat(result.retriable()).isTrue();
        assertThat(result.errorCode()).isEqualTo("WEBHOOK_HTTP_503");
    }

    @Test
    void execute_shouldTreatClientErrorsAsPermanent() throws Exception {
        responseStatus.set(404);
        
        ActionResult result = handler.execute(
            mapper.readTree("{\"url\": \"" + baseUrl + "/hook\", \"body\": {\"x\": 1}}"), context());
        
        assertThat(result.retriable()).isFalse();
        assertThat(receivedBodies).containsExactly("{\"x\":1}");
    }

    @Test
    void execute_shouldRejectMissingUrl() {
        assertThatThrownBy(() -> handler.execute(mapper.createObjectNode(), context()))
            .isInstanceOf(ActionException.class)
            .satisfies(e -> assertThat(((ActionException) e).isRetryable()).isFalse());
    }

    @Test
    void execute_shouldFailRetriablyWhenUnreachable() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        String url = "http://127.0.0.1:" + closedPort + "/hook";
        
        assertThatThrownBy(() -> handler.execute(mapper.readTree("{\"url\": \"" + url + "\"}"), context()))
            .isInstanceOf(ActionException.class)
            .satisfies(e -> assertThat(((ActionException) e).getErrorCode()).isEqualTo("WEBHOOK_UNREACHABLE"));
    }
}
