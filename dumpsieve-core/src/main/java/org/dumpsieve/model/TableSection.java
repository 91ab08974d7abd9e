package org.dumpsieve.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * One table's chunk of a dump: the raw lines (terminators kept) plus the
 * database/table it belongs to.
 */
@Getter
@ToString(exclude = "lines")
public class TableSection {
    private final String database;
    private final String table;
    @Setter
    private Iterable<String> lines;

    public TableSection(String database, String table, Iterable<String> lines) {
        this.database = database;
        this.table = table;
        this.lines = lines;
    }

    /**
     * Copies the lines into a list that can be scanned more than once and stores it back.
     */
    public List<String> materialize() {
        if (lines instanceof List<String> list) {
            return list;
        }
        List<String> copy = new ArrayList<>();
        lines.forEach(copy::add);
        lines = copy;
        return copy;
    }

    public String text() {
        return String.join("", materialize());
    }
}
