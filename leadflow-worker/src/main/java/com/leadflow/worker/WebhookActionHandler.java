package com.leadflow.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.model.ActionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Calls an HTTP endpoint ({@code call_webhook}).
 *
 * Parameters: {@code url} (required), {@code method} (POST or PUT, default
 * POST), {@code headers} (object) and {@code body} (any JSON, defaults to the
 * trigger payload). The step idempotency key is sent as
 * {@code Idempotency-Key}. 5xx, 408, 429 and I/O errors are retriable; other
 * non-2xx responses are permanent failures.
 */
public class WebhookActionHandler implements ActionHandler {
    
    private static final Logger log = LoggerFactory.getLogger(WebhookActionHandler.class);
    
    public static final String KIND = "call_webhook";
    
    private static final Set<String> METHODS = Set.of("POST", "PUT");
    
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    
    public WebhookActionHandler(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(), requestTimeout);
    }
    
    public WebhookActionHandler(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }
    
    @Override
    public ActionResult execute(JsonNode parameters, ActionContext context) throws ActionException {
        String url = parameters.path("url").asText("");
        if (url.isBlank()) {
            throw ActionException.permanent("INVALID_PARAMETERS", "call_webhook requires a url");
        }
        String method = parameters.path("method").asText("POST").toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw ActionException.permanent("INVALID_PARAMETERS", "Unsupported webhook method: " + method);
        }
        
        JsonNode body = parameters.has("body") ? parameters.get("body") : context.getTriggerPayload();
        HttpRequest request = buildRequest(URI.create(url), method, parameters.path("headers"), body, context);
        
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ActionException("WEBHOOK_UNREACHABLE", "Webhook call to " + url + " failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException("WEBHOOK_INTERRUPTED", "Webhook call to " + url + " was interrupted", e, true);
        }
        
        int status = response.statusCode();
        log.info("Webhook {} {} answered {} for execution {}", method, url, status, context.getExecutionId());
        
        if (status >= 200 && status < 300) {
            ObjectNode output = context.getObjectMapper().createObjectNode();
            output.put("status", status);
            output.set("response", parseBody(context, response.body()));
            return ActionResult.success(output);
        }
        
        String error = String.format("Webhook %s returned HTTP %d", url, status);
        return isRetriableStatus(status)
            ? ActionResult.transientFailure("WEBHOOK_HTTP_" + status, error)
            : ActionResult.permanentFailure("WEBHOOK_HTTP_" + status, error);
    }
    
    // ========== Internal Methods ==========
    
    private HttpRequest buildRequest(URI uri, String method, JsonNode headers, JsonNode body, ActionContext context)
            throws ActionException {
        String payload;
        try {
            payload = context.getObjectMapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ActionException("INVALID_PARAMETERS", "Webhook body is not serializable", e, false);
        }
        
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .header("Idempotency-Key", context.getIdempotencyKey())
            .method(method, HttpRequest.BodyPublishers.ofString(payload));
        
        Iterator<Map.Entry<String, JsonNode>> fields = headers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> header = fields.next();
            builder.header(header.getKey(), header.getValue().asText());
        }
        return builder.build();
    }
    
    private JsonNode parseBody(ActionContext context, String body) {
        if (body == null || body.isBlank()) {
            return context.getObjectMapper().nullNode();
        }
        try {
            return context.getObjectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            return context.getObjectMapper().getNodeFactory().textNode(body);
        }
    }
    
    private static boolean isRetriableStatus(int status) {
        return status >= 500 || status == 408 || status == 429;
    }
}
