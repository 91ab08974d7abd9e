package org.dumpsieve.cli.service;

import org.dumpsieve.model.TableSection;
import org.dumpsieve.parser.CreateTableExtractor;
import org.dumpsieve.parser.SqlLines;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Service for reading a single table section from a file or stdin.
 */
public class SectionIoService {

    static final String STDIN = "-";
    static final String UNKNOWN = "unknown";

    private final Charset charset;

    public SectionIoService(Charset charset) {
        this.charset = charset;
    }

    /**
     * Loads the whole input as one section.
     *
     * @param input    section file, or null / "-" for stdin
     * @param database database name for diagnostics, may be null
     * @param table    table name for diagnostics; when null it is taken from the CREATE TABLE,
     *                 then from the file name
     * @throws IOException if the input cannot be read
     */
    public TableSection load(Path input, String database, String table) throws IOException {
        String text = readText(input);
        String db = database != null ? database : UNKNOWN;
        String tbl = table != null ? table : guessTable(text, input);
        return new TableSection(db, tbl, SqlLines.splitKeepEnds(text));
    }

    String readText(Path input) throws IOException {
        if (isStdin(input)) {
            return readStream(System.in);
        }
        if (!Files.exists(input)) {
            throw new IOException("Section file not found: " + input);
        }
        return Files.readString(input, charset);
    }

    /**
     * Decodes strictly, like {@link Files#readString(Path, Charset)}: undecodable bytes fail
     * with a {@link java.nio.charset.CharacterCodingException} instead of becoming U+FFFD.
     */
    private String readStream(InputStream in) throws IOException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(in.readAllBytes()))
                .toString();
    }

    private String guessTable(String text, Path input) {
        String ddl = CreateTableExtractor.extract(SqlLines.splitKeepEnds(text));
        Optional<String> fromDdl = CreateTableExtractor.findTableName(ddl);
        if (fromDdl.isPresent()) {
            return fromDdl.get();
        }
        if (isStdin(input)) {
            return UNKNOWN;
        }
        String fileName = input.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static boolean isStdin(Path input) {
        return input == null || STDIN.equals(input.toString());
    }
}
