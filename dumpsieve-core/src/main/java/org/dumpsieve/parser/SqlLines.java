package org.dumpsieve.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Line helpers that keep line terminators intact.
 */
public final class SqlLines {

    private SqlLines() {}

    /**
     * Splits on {@code \n}, {@code \r\n} or {@code \r}, keeping the terminator on each line.
     * A trailing fragment without terminator becomes the last line.
     */
    public static List<String> splitKeepEnds(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < text.length() && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(text.substring(start, end));
                start = end;
                i = end;
                continue;
            }
            i++;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    public static String terminator(String line) {
        if (line.endsWith("\r\n")) return "\r\n";
        if (line.endsWith("\n")) return "\n";
        if (line.endsWith("\r")) return "\r";
        return "";
    }

    public static String withoutTerminator(String line) {
        return line.substring(0, line.length() - terminator(line).length());
    }

    /**
     * Removes trailing whitespace, then trailing commas.
     */
    public static String stripTrailingComma(String line) {
        String stripped = line.stripTrailing();
        int end = stripped.length();
        while (end > 0 && stripped.charAt(end - 1) == ',') {
            end--;
        }
        return stripped.substring(0, end);
    }
}
