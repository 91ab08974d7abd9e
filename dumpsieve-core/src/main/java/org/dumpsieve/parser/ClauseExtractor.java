package org.dumpsieve.parser;

import org.dumpsieve.model.ClauseEntry;
import org.dumpsieve.model.ClauseKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CREATE TABLE 본문에서 보조 인덱스와 외래키 제약조건 줄을 찾아낸다.
 * 한 줄에 한 절이 있다고 가정하며, 패턴에 맞지 않는 줄은 조용히 무시한다.
 */
public final class ClauseExtractor {

    static final Pattern KEY_PATTERN = Pattern.compile(
            "\\s*(?:UNIQUE )?KEY (?<name>`.+`) \\((?<columns>.+)\\)"
                    + "(?: USING (?:BTREE|HASH))?,?$");

    static final Pattern CONSTRAINT_PATTERN = Pattern.compile(
            "\\s*CONSTRAINT (?<name>`.+`) FOREIGN KEY "
                    + "\\((?<columns>.+)\\) REFERENCES");

    private ClauseExtractor() {}

    public static List<ClauseEntry> extractIndexes(String tableDdl) {
        return extract(tableDdl, KEY_PATTERN, ClauseKind.INDEX);
    }

    public static List<ClauseEntry> extractConstraints(String tableDdl) {
        return extract(tableDdl, CONSTRAINT_PATTERN, ClauseKind.CONSTRAINT);
    }

    private static List<ClauseEntry> extract(String tableDdl, Pattern pattern, ClauseKind kind) {
        List<ClauseEntry> result = new ArrayList<>();
        for (String line : SqlLines.splitKeepEnds(tableDdl)) {
            Matcher m = pattern.matcher(line);
            if (!m.lookingAt()) {
                continue;
            }
            result.add(new ClauseEntry(kind,
                    IdentifierListParser.parseName(m.group("name")),
                    IdentifierListParser.parse(m.group("columns")),
                    line));
        }
        return result;
    }
}
