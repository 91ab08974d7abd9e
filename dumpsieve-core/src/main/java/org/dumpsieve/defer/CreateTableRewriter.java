package org.dumpsieve.defer;

import org.dumpsieve.model.ClauseEntry;
import org.dumpsieve.parser.SqlLines;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes deferred clause lines from a CREATE TABLE statement.
 */
public final class CreateTableRewriter {

    private static final String CLOSE_PAREN = ")";

    private CreateTableRewriter() {}

    /**
     * Re-emits {@code tableDdl} without the lines of {@code deferred}. Lines are matched by content.
     * When the lines right before the closing {@code )} were removed, the last kept body line
     * loses its trailing comma. Otherwise the DDL comes back unchanged.
     */
    public static String rewrite(String tableDdl, Collection<ClauseEntry> deferred) {
        Set<String> deferredLines = deferred.stream()
                .map(ClauseEntry::rawLine)
                .collect(Collectors.toSet());

        List<String> result = new ArrayList<>();
        boolean dropped = false;
        for (String line : SqlLines.splitKeepEnds(tableDdl)) {
            if (dropped && !result.isEmpty() && line.startsWith(CLOSE_PAREN)) {
                int last = result.size() - 1;
                String previous = result.get(last);
                result.set(last, SqlLines.stripTrailingComma(previous) + lineEnd(previous));
            }
            if (deferredLines.contains(line)) {
                dropped = true;
            } else {
                result.add(line);
                dropped = false;
            }
        }
        return String.join("", result);
    }

    /**
     * Replaces the original DDL inside the whole section text and splits the result back into lines.
     */
    public static List<String> patchSection(List<String> sectionLines, String tableDdl, String patchedDdl) {
        String text = String.join("", sectionLines);
        return SqlLines.splitKeepEnds(text.replace(tableDdl, patchedDdl));
    }

    private static String lineEnd(String line) {
        String end = SqlLines.terminator(line);
        return end.isEmpty() ? "\n" : end;
    }
}
