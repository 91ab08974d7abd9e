package org.dumpsieve.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * CREATE TABLE 본문에서 추출한 인덱스/제약조건 한 줄.
 * rawLine 은 원본 줄(개행 포함)을 그대로 보관하며, 제거/보존 판단의 키로 사용된다.
 *
 * @param kind    INDEX 또는 CONSTRAINT
 * @param name    인덱스 또는 제약조건 이름 (백틱 제거)
 * @param columns 컬럼 목록, 선언 순서 유지
 * @param rawLine 원본 줄
 */
public record ClauseEntry(ClauseKind kind, String name, List<String> columns, String rawLine) {

    public ClauseEntry {
        columns = List.copyOf(columns);
    }

    /**
     * columns 가 주어진 컬럼 목록으로 시작하는지 확인한다.
     * 자신보다 긴 목록은 접두어가 될 수 없다.
     */
    public boolean startsWith(List<String> prefix) {
        if (prefix.size() > columns.size()) {
            return false;
        }
        return columns.subList(0, prefix.size()).equals(prefix);
    }

    @JsonIgnore
    public int columnCount() {
        return columns.size();
    }

    /**
     * ALTER TABLE ... ADD 뒤에 붙일 절. 앞뒤 공백과 끝의 콤마를 제거한다.
     */
    @JsonIgnore
    public String clause() {
        String stripped = rawLine.strip();
        int end = stripped.length();
        while (end > 0 && stripped.charAt(end - 1) == ',') {
            end--;
        }
        return stripped.substring(0, end);
    }
}
