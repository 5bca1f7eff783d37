package fr.lapetina.ollama.council.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.ollama.council.CouncilFactory;
import fr.lapetina.ollama.council.api.dto.CouncilConfigDto;
import fr.lapetina.ollama.council.api.dto.DeliberationRequestDto;
import fr.lapetina.ollama.council.api.dto.DeliberationResponseDto;
import fr.lapetina.ollama.council.domain.event.DeliberationEvent;
import fr.lapetina.ollama.council.domain.event.DeliberationListener;
import fr.lapetina.ollama.council.domain.model.DeliberationResult;
import fr.lapetina.ollama.council.domain.model.DeliberationTranscript;
import fr.lapetina.ollama.council.infrastructure.http.OllamaStatus;
import fr.lapetina.ollama.council.pipeline.DeliberationRequest;
import fr.lapetina.ollama.council.pipeline.exception.DeliberationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /api/models - Models installed on the Ollama server
 * - GET /api/monitoring - Ollama status and per-model call statistics
 * - GET /api/council/config - Current roster (read-only)
 * - POST /api/council/deliberate - Run a deliberation, answer with the full result
 * - POST /api/council/deliberate/stream - Run a deliberation, stream events as Server-Sent Events
 * - GET /api/transcripts - Stored transcripts, newest first
 * - GET /api/transcripts/{id} - One stored transcript
 */
public final class HttpServer implements AutoCloseable {

    public static final String MDC_REQUEST_ID = "requestId";

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final CouncilFactory factory;

    public HttpServer(int port, int backlog, CouncilFactory factory) throws IOException {
        this.factory = factory;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(port), backlog
        );

        // Deliberations block their handler thread for minutes, so the pool grows on demand
        this.executor = Executors.newCachedThreadPool(new HandlerThreadFactory());
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/api/models", new ModelsHandler());
        server.createContext("/api/monitoring", new MonitoringHandler());
        server.createContext("/api/council/config", new ConfigHandler());
        server.createContext("/api/council/deliberate", new DeliberateHandler());
        server.createContext("/api/council/deliberate/stream", new StreamHandler());
        server.createContext("/api/transcripts", new TranscriptsHandler());

        log.info("HTTP server configured on port {}", port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Port actually bound; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("HTTP server stopped");
    }

    // ==================== DELIBERATION HANDLERS ====================

    private class DeliberateHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());
            try {
                if (!"/api/council/deliberate".equals(exchange.getRequestURI().getPath())) {
                    sendError(exchange, 404, "Not Found");
                    return;
                }
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                Optional<DeliberationRequest> request = readDeliberationRequest(exchange);
                if (request.isEmpty()) {
                    return;
                }

                DeliberationResult result = factory.getPipeline().deliberate(request.get());
                int statusCode = result.isComplete() ? 200 : 502;
                sendJson(exchange, statusCode, DeliberationResponseDto.fromResult(result));

            } catch (DeliberationException e) {
                log.warn("Deliberation refused: reason={}, error={}", e.getReason(), e.getMessage());
                sendError(exchange, statusFor(e), e.getMessage());
            } catch (Exception e) {
                log.error("Error handling deliberation request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    private class StreamHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                Optional<DeliberationRequest> request = readDeliberationRequest(exchange);
                if (request.isEmpty()) {
                    return;
                }

                exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
                exchange.getResponseHeaders().set("Cache-Control", "no-cache");
                exchange.sendResponseHeaders(200, 0);

                try (OutputStream os = exchange.getResponseBody()) {
                    SseWriter writer = new SseWriter(os);
                    try {
                        factory.getPipeline().deliberate(request.get(), writer);
                    } catch (DeliberationException e) {
                        // Already reported to the client as an error event
                        log.warn("Streamed deliberation ended with error: reason={}, error={}",
                                e.getReason(), e.getMessage());
                    }
                }

            } catch (Exception e) {
                log.error("Error handling streamed deliberation", e);
            } finally {
                MDC.clear();
            }
        }
    }

    /**
     * Writes each event as one {@code data: {json}} frame and flushes it.
     */
    private class SseWriter implements DeliberationListener {
        private final OutputStream out;

        SseWriter(OutputStream out) {
            this.out = out;
        }

        @Override
        public void onEvent(DeliberationEvent event) {
            try {
                String frame = "data: " + objectMapper.writeValueAsString(event) + "\n\n";
                out.write(frame.getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Event stream closed by client", e);
            }
        }
    }

    private Optional<DeliberationRequest> readDeliberationRequest(HttpExchange exchange) throws IOException {
        DeliberationRequestDto dto;
        try (InputStream is = exchange.getRequestBody()) {
            dto = objectMapper.readValue(is, DeliberationRequestDto.class);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Invalid JSON body: " + e.getOriginalMessage());
            return Optional.empty();
        }
        if (dto == null || dto.getContent() == null || dto.getContent().isBlank()) {
            sendError(exchange, 400, "Missing 'content' field");
            return Optional.empty();
        }
        return Optional.of(dto.toDeliberationRequest(factory.currentRoster(), factory.isTitleEnabled()));
    }

    private static int statusFor(DeliberationException e) {
        return switch (e.getReason()) {
            case EMPTY_ROSTER, INVALID_QUESTION -> 400;
            case SYNTHESIS_FAILED -> 502;
            case ORCHESTRATION_FAILURE -> 500;
        };
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("service", "ollama-council");
            health.put("timestamp", System.currentTimeMillis());
            health.put("advisors", factory.currentRoster().size());
            health.put("inFlightDeliberations", factory.getMetricsRegistry().getInFlightDeliberations());
            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = factory.getMetricsRegistry().scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== OLLAMA HANDLERS ====================

    private class ModelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            List<String> models = factory.getOllamaGateway().listModels().join();
            sendJson(exchange, 200, Map.of("models", models));
        }
    }

    private class MonitoringHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            OllamaStatus status = factory.getOllamaGateway().status().join();

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", status);
            body.put("stats", factory.getMetricsRegistry().stats());
            sendJson(exchange, 200, body);
        }
    }

    // ==================== CONFIG HANDLER ====================

    private class ConfigHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, CouncilConfigDto.fromRoster(factory.currentRoster()));
        }
    }

    // ==================== TRANSCRIPTS HANDLER ====================

    private class TranscriptsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String path = exchange.getRequestURI().getPath();
            if (path.equals("/api/transcripts") || path.equals("/api/transcripts/")) {
                List<Map<String, Object>> summaries = factory.getTranscriptStore().list().stream()
                        .map(HttpServer::summarize)
                        .toList();
                sendJson(exchange, 200, summaries);
                return;
            }

            String id = path.substring("/api/transcripts/".length());
            Optional<DeliberationTranscript> transcript = factory.getTranscriptStore().get(id);
            if (transcript.isEmpty()) {
                sendError(exchange, 404, "Transcript not found: " + id);
                return;
            }
            sendJson(exchange, 200, transcript.get());
        }
    }

    private static Map<String, Object> summarize(DeliberationTranscript transcript) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", transcript.id());
        summary.put("title", transcript.title());
        summary.put("question", transcript.question());
        summary.put("created_at", transcript.createdAt().toString());
        return summary;
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }

    private static final class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "http-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
