package org.dumpsieve.model;

import java.util.List;

/**
 * Index kept in the CREATE TABLE because a foreign key uses its columns as a prefix.
 */
public record PreservedIndex(String indexName, List<String> columns, String rawLine, String constraintName) {

    public static PreservedIndex of(ClauseEntry index, ClauseEntry constraint) {
        return new PreservedIndex(index.name(), index.columns(), index.rawLine(), constraint.name());
    }
}
