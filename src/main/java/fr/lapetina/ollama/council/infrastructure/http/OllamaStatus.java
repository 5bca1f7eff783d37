package fr.lapetina.ollama.council.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reachability of the Ollama server.
 *
 * @param service       "online", "offline" or "error"
 * @param version       server version, "unknown" when not reachable
 * @param runningModels entries of {@code /api/ps}, as returned by the server
 * @param error         failure description when offline
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaStatus(
        String service,
        String version,
        @JsonProperty("running_models") List<Object> runningModels,
        String error
) {
    public static final String ONLINE = "online";
    public static final String OFFLINE = "offline";
    public static final String ERROR = "error";

    public OllamaStatus {
        runningModels = runningModels != null ? List.copyOf(runningModels) : List.of();
    }

    public static OllamaStatus online(String version, List<Object> runningModels) {
        return new OllamaStatus(ONLINE, version, runningModels, null);
    }

    public static OllamaStatus offline(String error) {
        return new OllamaStatus(OFFLINE, "unknown", List.of(), error);
    }

    public static OllamaStatus unreachable() {
        return new OllamaStatus(ERROR, "unknown", List.of(), null);
    }

    @JsonIgnore
    public boolean isOnline() {
        return ONLINE.equals(service);
    }
}
