package fr.lapetina.ollama.council.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelTest {

    @Test
    @DisplayName("should letter labels from A to Z")
    void shouldLetterSingleLetters() {
        assertThat(Label.ofIndex(0).value()).isEqualTo("Response A");
        assertThat(Label.ofIndex(2).value()).isEqualTo("Response C");
        assertThat(Label.ofIndex(25).value()).isEqualTo("Response Z");
    }

    @Test
    @DisplayName("should continue with AA after Z")
    void shouldContinueWithDoubleLetters() {
        assertThat(Label.ofIndex(26).value()).isEqualTo("Response AA");
        assertThat(Label.ofIndex(27).value()).isEqualTo("Response AB");
        assertThat(Label.ofIndex(52).value()).isEqualTo("Response BA");
    }

    @Test
    @DisplayName("should reject negative indexes")
    void shouldRejectNegativeIndex() {
        assertThatThrownBy(() -> Label.ofIndex(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should compare by value and expose letters")
    void shouldCompareByValue() {
        assertThat(Label.ofLetters("b")).isEqualTo(Label.ofIndex(1));
        assertThat(Label.ofIndex(1).letters()).isEqualTo("B");
        assertThat(Label.ofIndex(1)).hasToString("Response B");
    }
}
