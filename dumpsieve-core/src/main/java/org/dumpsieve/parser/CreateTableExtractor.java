package org.dumpsieve.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Isolates the {@code CREATE TABLE ... ;} statement of a section.
 */
public final class CreateTableExtractor {

    static final String CREATE_TABLE = "CREATE TABLE";
    private static final String TERMINATOR = ";";
    private static final Pattern TABLE_NAME = Pattern.compile("CREATE TABLE .*`(?<name>.+)` \\($");

    private CreateTableExtractor() {}

    /**
     * {@code CREATE TABLE} 로 시작하는 첫 줄부터, 그 다음 줄들 중 오른쪽 공백을 제거했을 때
     * {@code ;} 로 끝나는 첫 줄까지를 이어 붙여 반환한다.
     *
     * @return 추출한 DDL, CREATE TABLE 이 없으면 빈 문자열
     */
    public static String extract(Iterable<String> lines) {
        StringBuilder ddl = new StringBuilder();
        boolean inside = false;
        for (String line : lines) {
            if (line.startsWith(CREATE_TABLE)) {
                ddl.append(line);
                inside = true;
            } else if (inside) {
                ddl.append(line);
                if (line.stripTrailing().endsWith(TERMINATOR)) {
                    break;
                }
            }
        }
        return ddl.toString();
    }

    /**
     * {@code CREATE TABLE [...] `name` (} 형태의 줄에서 백틱을 제외한 테이블 이름을 꺼낸다.
     * {@code `db`.`t`} 처럼 한정된 이름이면 마지막 식별자를 사용한다.
     *
     * @throws MalformedDdlException 해당 형태의 줄이 없을 때
     */
    public static String tableName(String tableDdl) {
        return findTableName(tableDdl)
                .orElseThrow(() -> new MalformedDdlException("Failed to find table name from DDL: " + tableDdl, tableDdl));
    }

    public static Optional<String> findTableName(String tableDdl) {
        for (String line : SqlLines.splitKeepEnds(tableDdl)) {
            Matcher m = TABLE_NAME.matcher(SqlLines.withoutTerminator(line));
            if (m.lookingAt()) {
                return Optional.of(m.group("name"));
            }
        }
        return Optional.empty();
    }
}
