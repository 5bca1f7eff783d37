package fr.lapetina.ollama.council.domain.model;

import java.util.Objects;

/**
 * One message of a chat-style model call.
 */
public record ChatMessage(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public ChatMessage {
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(content, "Content is required");
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }
}
