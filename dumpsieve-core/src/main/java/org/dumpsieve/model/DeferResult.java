package org.dumpsieve.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeferResult {
    private String database;
    private String table;
    private boolean skipped;
    @Builder.Default private List<ClauseEntry> deferred = new ArrayList<>();
    @Builder.Default private List<PreservedIndex> preserved = new ArrayList<>();
    @Builder.Default private String alterTable = "";

    public static DeferResult skipped(String database, String table) {
        return DeferResult.builder()
                .database(database)
                .table(table)
                .skipped(true)
                .build();
    }

    @JsonIgnore
    public boolean hasDeferred() {
        return !deferred.isEmpty();
    }
}
