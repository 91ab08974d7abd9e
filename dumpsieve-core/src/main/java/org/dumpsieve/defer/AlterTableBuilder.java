package org.dumpsieve.defer;

import lombok.Getter;
import org.dumpsieve.model.ClauseEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 지연된 절들을 하나의 {@code ALTER TABLE ... ADD ...} 문으로 묶는다.
 */
public class AlterTableBuilder {

    static final String BANNER = String.join("\n",
            "--",
            "-- InnoDB Fast Index Creation (generated by dumpsieve)",
            "--",
            "");

    @Getter
    private final String tableName;
    @Getter
    private final List<ClauseEntry> units = new ArrayList<>();

    public AlterTableBuilder(String tableName) {
        this.tableName = tableName;
    }

    public AlterTableBuilder add(ClauseEntry unit) {
        units.add(unit);
        return this;
    }

    public AlterTableBuilder addAll(List<ClauseEntry> entries) {
        units.addAll(entries);
        return this;
    }

    /**
     * @return 배너가 붙은 ALTER TABLE 문, 추가된 절이 없으면 빈 문자열
     */
    public String build() {
        if (units.isEmpty()) {
            return "";
        }
        String adds = units.stream()
                .map(unit -> "  ADD " + unit.clause())
                .collect(Collectors.joining(",\n"));
        return BANNER + "\n"
                + "ALTER TABLE `" + tableName + "`\n"
                + adds + ";\n";
    }
}
