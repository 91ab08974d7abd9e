package org.dumpsieve.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * 백틱으로 감싼 식별자 목록을 해석한다. 예: {@code `col_a`, `col_b`} -> [col_a, col_b]
 *
 * <ul>
 *   <li>구분자는 콤마이며, 콤마 바로 뒤의 공백은 건너뛴다.</li>
 *   <li>따옴표 안의 {@code ``} 는 백틱 한 글자로 해석한다.</li>
 *   <li>닫는 백틱 뒤의 문자는 다음 콤마까지 필드에 이어 붙인다. ({@code `name`(10)} -> {@code name(10)})</li>
 * </ul>
 */
public final class IdentifierListParser {

    private static final char QUOTE = '`';
    private static final char DELIMITER = ',';

    private IdentifierListParser() {}

    public static List<String> parse(String value) {
        List<String> result = new ArrayList<>();
        if (value == null || value.isEmpty()) {
            return result;
        }

        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < value.length() && value.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i += 2;
                        continue;
                    }
                    quoted = false;
                } else {
                    field.append(c);
                }
            } else if (c == DELIMITER) {
                result.add(field.toString());
                field.setLength(0);
                fieldStart = true;
                i++;
                // 콤마 뒤 공백은 건너뛴다
                while (i < value.length() && value.charAt(i) == ' ') {
                    i++;
                }
                continue;
            } else if (c == QUOTE && fieldStart) {
                quoted = true;
            } else {
                field.append(c);
            }
            fieldStart = false;
            i++;
        }
        result.add(field.toString());
        return result;
    }

    /**
     * 단일 이름 필드의 첫 번째 식별자.
     */
    public static String parseName(String value) {
        return parse(value).get(0);
    }
}
