package fr.lapetina.ollama.council.domain.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Externally visible checkpoints of a deliberation, in emission order.
 */
public enum EventType {
    STAGE1_START("stage1_start"),
    STAGE1_COMPLETE("stage1_complete"),
    STAGE2_START("stage2_start"),
    STAGE2_COMPLETE("stage2_complete"),
    STAGE3_START("stage3_start"),
    STAGE3_COMPLETE("stage3_complete"),
    TITLE_COMPLETE("title_complete"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
