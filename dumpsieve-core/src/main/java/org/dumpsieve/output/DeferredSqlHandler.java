package org.dumpsieve.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dumpsieve.model.DeferResult;
import org.dumpsieve.model.TableSection;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the outcome of one section to an output directory:
 * {@code <table>.sql} with the patched section and, when something was deferred,
 * {@code <table>.deferred.sql} with the ALTER TABLE.
 */
public class DeferredSqlHandler {

    static final String SECTION_SUFFIX = ".sql";
    static final String DEFERRED_SUFFIX = ".deferred.sql";
    static final String REPORT_SUFFIX = ".defer.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path outputDir;
    private final Charset charset;

    public DeferredSqlHandler(Path outputDir, Charset charset) {
        this.outputDir = outputDir;
        this.charset = charset;
    }

    /**
     * @return the files written, section file first
     */
    public List<Path> handle(TableSection section, DeferResult result) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();

        Path sectionFile = outputDir.resolve(baseName(section) + SECTION_SUFFIX);
        Files.writeString(sectionFile, section.text(), charset);
        written.add(sectionFile);

        if (result.hasDeferred()) {
            Path deferredFile = outputDir.resolve(baseName(section) + DEFERRED_SUFFIX);
            Files.writeString(deferredFile, result.getAlterTable(), charset);
            written.add(deferredFile);
        }
        return written;
    }

    public Path writeReport(TableSection section, DeferResult result) throws IOException {
        Files.createDirectories(outputDir);
        Path reportFile = outputDir.resolve(baseName(section) + REPORT_SUFFIX);
        objectMapper.writeValue(reportFile.toFile(), result);
        return reportFile;
    }

    private String baseName(TableSection section) {
        return section.getTable().replaceAll("[^A-Za-z0-9_.-]", "_");
    }
}
