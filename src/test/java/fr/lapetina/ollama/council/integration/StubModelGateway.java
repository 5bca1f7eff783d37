package fr.lapetina.ollama.council.integration;

import fr.lapetina.ollama.council.domain.model.ChatMessage;
import fr.lapetina.ollama.council.domain.model.ErrorType;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;
import fr.lapetina.ollama.council.domain.port.ModelGateway;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scripted model gateway for tests. Replies are keyed by model name; calls can be delayed,
 * left hanging, failed or made to throw.
 */
public final class StubModelGateway implements ModelGateway {

    public static final String DEFAULT_TITLE = "Stub Title";

    /**
     * One recorded invocation.
     */
    public record Call(String model, List<ChatMessage> messages, String systemPrompt, Duration timeout) {

        public String userMessage() {
            return messages.isEmpty() ? "" : messages.get(messages.size() - 1).content();
        }

        public boolean isRanking() {
            return userMessage().startsWith("You are evaluating different responses");
        }

        // The chairman prompt quotes every ranking, header included
        public boolean isSynthesis() {
            return userMessage().startsWith("You are the Chairman");
        }

        public boolean isTitle() {
            return userMessage().startsWith("Generate a very short title");
        }
    }

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final Map<String, ErrorType> failures = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> throwing = new ConcurrentHashMap<>();
    private final Set<String> hanging = ConcurrentHashMap.newKeySet();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile Function<Call, String> responder = StubModelGateway::defaultReply;

    @Override
    public CompletableFuture<GatewayResponse> invoke(
            String model,
            List<ChatMessage> messages,
            String systemPrompt,
            Duration timeout
    ) {
        Call call = new Call(model, List.copyOf(messages), systemPrompt, timeout);
        calls.add(call);

        RuntimeException toThrow = throwing.get(model);
        if (toThrow != null) {
            throw toThrow;
        }
        if (hanging.contains(model)) {
            return new CompletableFuture<>();
        }

        Duration delay = delays.getOrDefault(model, Duration.ZERO);
        ErrorType failure = failures.get(model);
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        return CompletableFuture.supplyAsync(() -> {
            if (failure != null) {
                return GatewayResponse.failure(model, failure, "stubbed " + failure, delay);
            }
            return GatewayResponse.success(model, responder.apply(call), delay);
        }, CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS))
                .whenComplete((response, error) -> inFlight.decrementAndGet());
    }

    /**
     * Answers Stage 1 with the model name, ranks "Response A" then "Response B", and titles
     * with {@link #DEFAULT_TITLE}.
     */
    public static String defaultReply(Call call) {
        if (call.isTitle()) {
            return DEFAULT_TITLE;
        }
        if (call.isSynthesis()) {
            return "Final answer from " + call.model();
        }
        if (call.isRanking()) {
            return "Response A is thorough. Response B is short.\n\nFINAL RANKING:\n1. Response A\n2. Response B";
        }
        return "Answer from " + call.model();
    }

    public StubModelGateway respondWith(Function<Call, String> responder) {
        this.responder = responder;
        return this;
    }

    public StubModelGateway delay(String model, Duration delay) {
        delays.put(model, delay);
        return this;
    }

    public StubModelGateway fail(String model, ErrorType errorType) {
        failures.put(model, errorType);
        return this;
    }

    public StubModelGateway hang(String model) {
        hanging.add(model);
        return this;
    }

    public StubModelGateway throwOn(String model, RuntimeException exception) {
        throwing.put(model, exception);
        return this;
    }

    public List<Call> getCalls() {
        return List.copyOf(calls);
    }

    public List<Call> callsTo(String model) {
        return calls.stream().filter(c -> c.model().equals(model)).toList();
    }

    public int callCount() {
        return calls.size();
    }

    /**
     * Highest number of calls that were pending at the same time.
     */
    public int maxConcurrentCalls() {
        return maxInFlight.get();
    }

    public void reset() {
        calls.clear();
        delays.clear();
        failures.clear();
        throwing.clear();
        hanging.clear();
        inFlight.set(0);
        maxInFlight.set(0);
        responder = StubModelGateway::defaultReply;
    }
}
