package org.dumpsieve.defer;

import org.dumpsieve.model.ClauseEntry;
import org.dumpsieve.model.DeferResult;
import org.dumpsieve.model.PreservedIndex;
import org.dumpsieve.model.TableSection;
import org.dumpsieve.parser.ClauseExtractor;
import org.dumpsieve.parser.CreateTableExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Moves secondary indexes (and, where possible, foreign keys) out of a table's CREATE TABLE
 * into an ALTER TABLE that runs after the data load.
 * <p>
 * Instances hold no per-call state. Each call needs its own {@link TableSection}; running
 * twice over an already patched section is not supported.
 */
public class IndexDeferrer {

    private static final Logger logger = LoggerFactory.getLogger(IndexDeferrer.class);

    static final String INNODB_ENGINE = "ENGINE=InnoDB";

    private final boolean deferConstraints;
    private final PreservationResolver resolver;

    public IndexDeferrer(boolean deferConstraints) {
        this.deferConstraints = deferConstraints;
        this.resolver = new PreservationResolver(deferConstraints);
    }

    public static IndexDeferrer defaults() {
        return new IndexDeferrer(false);
    }

    public boolean isDeferConstraints() {
        return deferConstraints;
    }

    /**
     * @return the ALTER TABLE text, or an empty string when nothing was deferred
     */
    public String split(TableSection section) {
        return splitIndexes(section).getAlterTable();
    }

    /**
     * Rewrites the section's CREATE TABLE in place and returns what was deferred.
     * <p>
     * Non-InnoDB tables are left alone. The section's lines are replaced only after the
     * ALTER TABLE was formatted, so a {@link org.dumpsieve.parser.MalformedDdlException}
     * leaves the section content as it was.
     */
    public DeferResult splitIndexes(TableSection section) {
        List<String> lines = section.materialize();
        String tableDdl = CreateTableExtractor.extract(lines);

        if (!tableDdl.contains(INNODB_ENGINE)) {
            logger.debug("{}.{} is not an InnoDB table. Skipping index rewrite.",
                    section.getDatabase(), section.getTable());
            return DeferResult.skipped(section.getDatabase(), section.getTable());
        }

        List<ClauseEntry> indexes = ClauseExtractor.extractIndexes(tableDdl);
        List<ClauseEntry> constraints = ClauseExtractor.extractConstraints(tableDdl);
        Resolution resolution = resolver.resolve(indexes, constraints);

        for (PreservedIndex p : resolution.preserved()) {
            logger.warn("{}.{} index {} not deferred - used by constraint {}",
                    section.getDatabase(), section.getTable(), p.indexName(), p.constraintName());
        }

        String alterTable = "";
        if (!resolution.deferred().isEmpty()) {
            alterTable = new AlterTableBuilder(CreateTableExtractor.tableName(tableDdl))
                    .addAll(resolution.deferred())
                    .build();
        }

        String patched = CreateTableRewriter.rewrite(tableDdl, resolution.deferred());
        section.setLines(CreateTableRewriter.patchSection(lines, tableDdl, patched));

        return DeferResult.builder()
                .database(section.getDatabase())
                .table(section.getTable())
                .deferred(resolution.deferred())
                .preserved(resolution.preserved())
                .alterTable(alterTable)
                .build();
    }
}
