package org.dumpsieve.defer;

import org.dumpsieve.model.ClauseEntry;
import org.dumpsieve.model.PreservedIndex;

import java.util.List;

/**
 * @param deferred  clauses moved to the ALTER TABLE, in emission order
 * @param preserved indexes kept in place for a foreign key
 */
public record Resolution(List<ClauseEntry> deferred, List<PreservedIndex> preserved) {

    public Resolution {
        deferred = List.copyOf(deferred);
        preserved = List.copyOf(preserved);
    }
}
