package fr.lapetina.ollama.council.pipeline;

/**
 * Cleans raw model output before it is stored or shown to other advisors.
 *
 * <p>Reasoning models (deepseek-r1, qwq, ...) wrap their chain of thought in
 * {@code <think>...</think>}. Those blocks are removed:
 * <ul>
 *   <li>well-formed blocks anywhere in the text, including mid-sentence</li>
 *   <li>an unterminated opening marker removes everything up to the end of the text</li>
 *   <li>a closing marker without an opener is dropped on its own</li>
 * </ul>
 * Then line endings are normalized, runs of three or more newlines are collapsed to two,
 * and the result is trimmed.
 *
 * <p>{@link #clean(String)} never throws and is idempotent.
 */
public final class ResponseSanitizer {

    static final String OPEN_MARKER = "<think>";
    static final String CLOSE_MARKER = "</think>";

    private ResponseSanitizer() {
        // Utility class
    }

    /**
     * @param raw model output, may be null
     * @return cleaned text, never null
     */
    public static String clean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        // Removing a block can splice two fragments into a new marker, so repeat until stable.
        String text = raw;
        String previous;
        do {
            previous = text;
            text = removeReasoningBlocks(text);
        } while (!text.equals(previous));

        text = text.replace("\r\n", "\n").replace('\r', '\n');
        return collapseBlankLines(text).strip();
    }

    private static String removeReasoningBlocks(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;

        while (pos < text.length()) {
            int open = text.indexOf(OPEN_MARKER, pos);
            int strayClose = text.indexOf(CLOSE_MARKER, pos);

            if (strayClose >= 0 && (open < 0 || strayClose < open)) {
                out.append(text, pos, strayClose);
                pos = strayClose + CLOSE_MARKER.length();
                continue;
            }

            if (open < 0) {
                out.append(text, pos, text.length());
                break;
            }

            out.append(text, pos, open);
            int close = text.indexOf(CLOSE_MARKER, open + OPEN_MARKER.length());
            if (close < 0) {
                // Unterminated block: the rest is reasoning
                break;
            }
            pos = close + CLOSE_MARKER.length();
        }

        return out.toString();
    }

    private static String collapseBlankLines(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int newlineRun = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                newlineRun++;
                if (newlineRun <= 2) {
                    out.append(c);
                }
            } else {
                newlineRun = 0;
                out.append(c);
            }
        }
        return out.toString();
    }
}
