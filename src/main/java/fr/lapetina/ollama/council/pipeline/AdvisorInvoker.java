package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.ChatMessage;
import fr.lapetina.ollama.council.domain.model.ErrorType;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;
import fr.lapetina.ollama.council.domain.port.AdvisorCallObserver;
import fr.lapetina.ollama.council.domain.port.ModelGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues one gateway call on behalf of an advisor and turns every possible outcome into a
 * {@link GatewayResponse}.
 *
 * <p>The returned future always completes normally, within the configured timeout:
 * <ul>
 *   <li>a synchronous throw from the gateway becomes an {@code INTERNAL_ERROR} failure</li>
 *   <li>an exceptional completion is classified ({@code TIMEOUT}, {@code TRANSPORT_ERROR}, ...)</li>
 *   <li>a call still pending when the timeout elapses becomes a {@code TIMEOUT} failure;
 *       sibling calls are not affected</li>
 * </ul>
 * Every outcome is reported to the {@link AdvisorCallObserver}.
 */
public final class AdvisorInvoker {

    private static final Logger log = LoggerFactory.getLogger(AdvisorInvoker.class);

    private final ModelGateway gateway;
    private final AdvisorCallObserver observer;

    public AdvisorInvoker(ModelGateway gateway, AdvisorCallObserver observer) {
        this.gateway = gateway;
        this.observer = observer != null ? observer : AdvisorCallObserver.NONE;
    }

    /**
     * Calls the model and returns a future that never completes exceptionally.
     *
     * @param stage        stage tag used for logs and metrics
     * @param advisor      advisor identity on whose behalf the call is made
     * @param model        model identifier
     * @param messages     conversation sent to the model
     * @param systemPrompt persona prompt, null or blank for none
     * @param timeout      bound on the call
     */
    public CompletableFuture<GatewayResponse> invoke(
            String stage,
            String advisor,
            String model,
            List<ChatMessage> messages,
            String systemPrompt,
            Duration timeout
    ) {
        Instant startTime = Instant.now();
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        String prompt = systemPrompt != null && !systemPrompt.isBlank() ? systemPrompt : null;

        log.debug("Invoking model: stage={}, advisor={}, model={}, timeoutMs={}",
                stage, advisor, model, timeout.toMillis());

        CompletableFuture<GatewayResponse> call;
        try {
            call = gateway.invoke(model, messages, prompt, timeout);
            if (call == null) {
                call = CompletableFuture.failedFuture(new IllegalStateException("Gateway returned no future"));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, throwable) -> {
                    Duration latency = Duration.between(startTime, Instant.now());
                    GatewayResponse outcome = throwable != null
                            ? GatewayResponse.failure(model, classifyError(throwable), describe(throwable), latency)
                            : normalize(model, response, latency);

                    // Completion runs on a gateway or timer thread; log under the caller's context
                    Map<String, String> previous = MDC.getCopyOfContextMap();
                    setContext(callerContext);
                    try {
                        report(stage, advisor, outcome);
                    } finally {
                        setContext(previous);
                    }
                    return outcome;
                });
    }

    /**
     * Waits for every call and returns the outcomes in the order of the given list,
     * regardless of completion order.
     */
    public static List<GatewayResponse> joinAll(List<CompletableFuture<GatewayResponse>> calls) {
        CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).join();
        return calls.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private GatewayResponse normalize(String model, GatewayResponse response, Duration latency) {
        if (response == null) {
            return GatewayResponse.failure(model, ErrorType.INTERNAL_ERROR, "Gateway completed without a response", latency);
        }
        return response;
    }

    private void report(String stage, String advisor, GatewayResponse outcome) {
        if (outcome.isError()) {
            log.warn("Advisor call failed: stage={}, advisor={}, model={}, errorType={}, error={}, latencyMs={}",
                    stage, advisor, outcome.model(), outcome.errorType(), outcome.errorMessage(),
                    outcome.latency().toMillis());
        } else {
            log.info("Advisor call completed: stage={}, advisor={}, model={}, chars={}, latencyMs={}",
                    stage, advisor, outcome.model(), outcome.contentOrEmpty().length(),
                    outcome.latency().toMillis());
        }

        try {
            observer.onCallCompleted(stage, advisor, outcome);
        } catch (RuntimeException e) {
            log.error("Advisor call observer failed: stage={}, advisor={}", stage, advisor, e);
        }
    }

    private static void setContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    static ErrorType classifyError(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof HttpTimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof IOException) {
            return ErrorType.TRANSPORT_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    private static String describe(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof TimeoutException) {
            return "Timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
