package fr.lapetina.ollama.council.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ollama.council.domain.model.ChatMessage;
import fr.lapetina.ollama.council.domain.model.ErrorType;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;
import fr.lapetina.ollama.council.domain.port.ModelGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * {@link ModelGateway} backed by an Ollama server.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every call goes to
 * {@code POST /api/chat} with {@code stream: false}; the returned future always completes
 * normally, with a classified {@link GatewayResponse} failure when something goes wrong.
 *
 * Also exposes the read-only server endpoints used by the monitoring API:
 * {@code /api/tags}, {@code /api/version} and {@code /api/ps}.
 */
public class OllamaModelGateway implements ModelGateway, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OllamaModelGateway.class);

    private static final Duration STATUS_TIMEOUT = Duration.ofSeconds(2);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public OllamaModelGateway(String baseUrl, Duration connectTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public OllamaModelGateway(String baseUrl) {
        this(baseUrl, Duration.ofSeconds(5));
    }

    @Override
    public CompletableFuture<GatewayResponse> invoke(
            String model,
            List<ChatMessage> messages,
            String systemPrompt,
            Duration timeout
    ) {
        Instant startTime = Instant.now();
        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/chat"))
                    .header("Content-Type", "application/json")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(model, messages, systemPrompt)))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: model={}", model, e);
            return CompletableFuture.completedFuture(GatewayResponse.failure(
                    model, ErrorType.INTERNAL_ERROR, "Failed to build request: " + e.getMessage(), Duration.ZERO));
        }

        log.debug("Sending chat request: model={}, messages={}, endpoint={}",
                model, messages.size(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(model, response, startTime))
                .exceptionally(ex -> handleException(model, ex, startTime));
    }

    /**
     * Builds the {@code /api/chat} body. The system prompt becomes the first message,
     * replacing a system message already in first position.
     */
    String buildRequestBody(String model, List<ChatMessage> messages, String systemPrompt)
            throws JsonProcessingException {
        List<Map<String, String>> finalMessages = new ArrayList<>();
        for (ChatMessage message : messages) {
            finalMessages.add(Map.of("role", message.role(), "content", message.content()));
        }

        if (systemPrompt != null && !systemPrompt.isBlank()) {
            Map<String, String> system = Map.of("role", ChatMessage.SYSTEM, "content", systemPrompt);
            if (!finalMessages.isEmpty() && ChatMessage.SYSTEM.equals(finalMessages.get(0).get("role"))) {
                finalMessages.set(0, system);
            } else {
                finalMessages.add(0, system);
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", finalMessages);
        body.put("stream", false);
        return objectMapper.writeValueAsString(body);
    }

    private GatewayResponse handleResponse(String model, HttpResponse<String> response, Instant startTime) {
        Duration latency = Duration.between(startTime, Instant.now());
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            String errorMessage = extractError(response.body(), statusCode);
            log.warn("Chat request failed with HTTP error: model={}, status={}, error={}, latencyMs={}",
                    model, statusCode, errorMessage, latency.toMillis());
            return GatewayResponse.failure(model, ErrorType.UPSTREAM_ERROR, errorMessage, latency);
        }

        try {
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode content = root == null ? null : root.path("message").get("content");
            if (content == null || !content.isTextual()) {
                log.warn("Chat response without message content: model={}, latencyMs={}", model, latency.toMillis());
                return GatewayResponse.failure(model, ErrorType.MALFORMED_RESPONSE,
                        "Response has no message.content", latency);
            }
            log.debug("Chat request successful: model={}, status={}, latencyMs={}",
                    model, statusCode, latency.toMillis());
            return GatewayResponse.success(model, content.asText(), latency);

        } catch (JsonProcessingException e) {
            log.warn("Failed to parse chat response: model={}, error={}", model, e.getOriginalMessage());
            return GatewayResponse.failure(model, ErrorType.MALFORMED_RESPONSE,
                    "Failed to parse response: " + e.getOriginalMessage(), latency);
        }
    }

    private String extractError(String body, int statusCode) {
        String errorMessage = "HTTP " + statusCode;
        if (body == null || body.isBlank()) {
            return errorMessage;
        }
        try {
            JsonNode error = objectMapper.readTree(body).get("error");
            if (error != null && error.isTextual()) {
                return errorMessage + ": " + error.asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: status={}", statusCode);
        }
        return errorMessage;
    }

    private GatewayResponse handleException(String model, Throwable ex, Instant startTime) {
        Duration latency = Duration.between(startTime, Instant.now());
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        ErrorType errorType = classifyException(cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        if (errorType == ErrorType.INTERNAL_ERROR) {
            log.error("Chat request failed unexpectedly: model={}, errorType={}, error={}",
                    model, cause.getClass().getSimpleName(), message, cause);
        } else {
            log.warn("Chat request failed: model={}, errorType={}, error={}, latencyMs={}",
                    model, errorType, message, latency.toMillis());
        }
        return GatewayResponse.failure(model, errorType, message, latency);
    }

    static ErrorType classifyException(Throwable cause) {
        if (cause instanceof HttpConnectTimeoutException) {
            return ErrorType.TRANSPORT_ERROR;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof IOException) {
            return ErrorType.TRANSPORT_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    /**
     * Lists model names installed on the server. Any failure yields an empty list.
     */
    public CompletableFuture<List<String>> listModels() {
        return getJson("/api/tags")
                .thenApply(root -> {
                    List<String> names = new ArrayList<>();
                    if (root != null) {
                        for (JsonNode model : root.path("models")) {
                            JsonNode name = model.get("name");
                            if (name != null && name.isTextual()) {
                                names.add(name.asText());
                            }
                        }
                    }
                    return List.copyOf(names);
                })
                .exceptionally(ex -> {
                    log.warn("Failed to list models: error={}", ex.getMessage());
                    return List.of();
                });
    }

    /**
     * Reports whether the server is reachable, its version and the models currently loaded.
     */
    public CompletableFuture<OllamaStatus> status() {
        return getJson("/api/version")
                .thenCompose(version -> {
                    if (version == null) {
                        return CompletableFuture.completedFuture(OllamaStatus.unreachable());
                    }
                    String versionText = version.path("version").asText("unknown");
                    return getJson("/api/ps")
                            .thenApply(ps -> OllamaStatus.online(versionText, runningModels(ps)))
                            .exceptionally(ex -> {
                                // Older servers have no /api/ps
                                log.debug("Running models unavailable: error={}", ex.getMessage());
                                return OllamaStatus.online(versionText, List.of());
                            });
                })
                .exceptionally(ex -> {
                    log.warn("Ollama status check failed: url={}, error={}", baseUrl, ex.getMessage());
                    return OllamaStatus.offline(ex.getMessage());
                });
    }

    private List<Object> runningModels(JsonNode ps) {
        if (ps == null || !ps.path("models").isArray()) {
            return List.of();
        }
        List<Object> models = new ArrayList<>();
        for (JsonNode model : ps.path("models")) {
            models.add(objectMapper.convertValue(model, Map.class));
        }
        return models;
    }

    /**
     * GETs a JSON document; completes with null on a non-200 status and exceptionally on I/O errors.
     */
    private CompletableFuture<JsonNode> getJson(String path) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(STATUS_TIMEOUT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        log.debug("Unexpected status: path={}, status={}", path, response.statusCode());
                        return null;
                    }
                    try {
                        return objectMapper.readTree(response.body());
                    } catch (JsonProcessingException e) {
                        throw new CompletionException(e);
                    }
                });
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }
}
