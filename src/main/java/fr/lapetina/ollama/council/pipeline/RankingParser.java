package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.Label;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the ranking protocol out of a Stage 2 evaluation.
 *
 * <p>Expected shape:
 * <pre>
 * ...free-form evaluation...
 * FINAL RANKING:
 * 1. Response C
 * 2. Response A
 * 3. Response B
 * </pre>
 *
 * <p>Parsing steps:
 * <ol>
 *   <li>Locate the last header line followed by at least one item; a later header used in
 *       prose does not hide an earlier ranking block. Markdown emphasis around the header
 *       ({@code **FINAL RANKING:**}, {@code ### Final ranking:}) is tolerated and the match
 *       is case-insensitive.</li>
 *   <li>Read the following lines as {@code <n>. Response X} or {@code <n>) Response X}.
 *       Blank lines are skipped; anything after the label on the same line is ignored.</li>
 *   <li>Stop at the first other line or at the end of the text.</li>
 * </ol>
 * A repeated label keeps its first position. The written numbers are not checked; the
 * order of lines is the ranking. Any failure yields an empty list.
 */
public final class RankingParser {

    public static final String HEADER = "FINAL RANKING:";

    private RankingParser() {
        // Utility class
    }

    /**
     * @param text evaluation text, may be null
     * @return labels best first, possibly empty, never null
     */
    public static List<Label> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String[] lines = text.replace("\r\n", "\n").split("\n", -1);
        for (int header = lines.length - 1; header >= 0; header--) {
            if (!isHeader(lines[header])) {
                continue;
            }
            List<Label> ranking = readItems(lines, header + 1);
            if (!ranking.isEmpty()) {
                return ranking;
            }
        }
        return List.of();
    }

    private static List<Label> readItems(String[] lines, int from) {
        Set<Label> ranking = new LinkedHashSet<>();
        for (int i = from; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            Label label = parseItem(line);
            if (label == null) {
                break;
            }
            ranking.add(label);
        }
        return List.copyOf(ranking);
    }

    static boolean isHeader(String line) {
        String stripped = stripEmphasis(line);
        return stripped.toUpperCase(Locale.ROOT).startsWith(HEADER);
    }

    /**
     * Parses one numbered item, or returns null if the line is not one.
     */
    static Label parseItem(String line) {
        int pos = 0;
        int length = line.length();

        int digitsStart = pos;
        while (pos < length && Character.isDigit(line.charAt(pos))) {
            pos++;
        }
        if (pos == digitsStart || pos >= length) {
            return null;
        }

        char separator = line.charAt(pos);
        if (separator != '.' && separator != ')') {
            return null;
        }
        pos++;

        if (pos >= length || !Character.isWhitespace(line.charAt(pos))) {
            return null;
        }
        while (pos < length && (Character.isWhitespace(line.charAt(pos)) || isEmphasis(line.charAt(pos)))) {
            pos++;
        }

        String prefix = Label.PREFIX;
        if (!line.regionMatches(true, pos, prefix, 0, prefix.length())) {
            return null;
        }
        pos += prefix.length();

        int lettersStart = pos;
        while (pos < length && isAsciiLetter(line.charAt(pos))) {
            pos++;
        }
        if (pos == lettersStart) {
            return null;
        }
        if (pos < length && Character.isLetter(line.charAt(pos))) {
            return null;
        }
        String letters = line.substring(lettersStart, pos);
        // "Response Alpha" is prose, not a label
        if (!letters.equals(letters.toUpperCase(Locale.ROOT)) && letters.length() > 1) {
            return null;
        }
        return Label.ofLetters(letters);
    }

    private static String stripEmphasis(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && (Character.isWhitespace(line.charAt(start)) || isEmphasis(line.charAt(start)))) {
            start++;
        }
        while (end > start && (Character.isWhitespace(line.charAt(end - 1)) || isEmphasis(line.charAt(end - 1)))) {
            end--;
        }
        return line.substring(start, end).replace("*", "").replace("_", "");
    }

    private static boolean isEmphasis(char c) {
        return c == '*' || c == '_' || c == '#';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
