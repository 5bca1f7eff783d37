package fr.lapetina.ollama.council.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Anonymous stand-in for an advisor during peer ranking: "Response A", "Response B", ...
 * After "Response Z" the sequence continues with "Response AA", "Response AB", ...
 */
public record Label(String value) {

    public static final String PREFIX = "Response ";

    public Label {
        Objects.requireNonNull(value, "Label value is required");
    }

    /**
     * Returns the label for a zero-based position in Stage 1 output.
     */
    public static Label ofIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Label index must be >= 0: " + index);
        }
        StringBuilder letters = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            letters.append((char) ('A' + n % 26));
            n /= 26;
        }
        return new Label(PREFIX + letters.reverse());
    }

    /**
     * Builds a label from its letter suffix ("B" gives "Response B").
     */
    public static Label ofLetters(String letters) {
        return new Label(PREFIX + letters.toUpperCase());
    }

    @JsonCreator
    public static Label parse(String value) {
        return new Label(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    /**
     * Letter suffix, or the whole value when it does not carry the standard prefix.
     */
    public String letters() {
        return value.startsWith(PREFIX) ? value.substring(PREFIX.length()) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
