package org.dumpsieve.cli;

import org.dumpsieve.config.ConfigurationLoader;
import org.dumpsieve.defer.IndexDeferrer;
import org.dumpsieve.model.DeferResult;
import org.dumpsieve.model.TableSection;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeferCommandTest {

    private static final String SECTION = """
            --
            -- Table structure for table `t`
            --

            CREATE TABLE `t` (
             `a` INT,
             `b` INT,
             KEY `idx_a` (`a`),
             CONSTRAINT `fk_b` FOREIGN KEY (`b`) REFERENCES `other` (`id`)
            ) ENGINE=InnoDB;
            """;

    @TempDir
    Path tempDir;

    @Mock
    IndexDeferrer deferrer;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private Path writeSection(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private CommandLine command() {
        return new CommandLine(new DeferCommand(IndexDeferrer::new, new ConfigurationLoader(tempDir)));
    }

    @Test
    @DisplayName("Prints the patched section followed by the ALTER TABLE")
    void printsToStdout() throws IOException {
        Path input = writeSection("t.sql", SECTION);

        int exitCode = command().execute(input.toString());

        assertThat(exitCode).isZero();
        String out = outContent.toString();
        String createPart = out.substring(0, out.indexOf("--\n-- InnoDB"));
        assertThat(createPart)
                .contains(" `b` INT\n) ENGINE=InnoDB;\n")
                .doesNotContain("idx_a")
                .doesNotContain("fk_b");
        assertThat(out).contains("ALTER TABLE `t`\n  ADD KEY `idx_a` (`a`),\n  ADD CONSTRAINT `fk_b`");
        assertThat(out.indexOf("CREATE TABLE")).isLessThan(out.indexOf("ALTER TABLE"));
    }

    @Test
    @DisplayName("Writes section, deferred and report files with --out and --report")
    void writesFiles() throws IOException {
        Path input = writeSection("t.sql", SECTION);
        Path outDir = tempDir.resolve("out");

        int exitCode = command().execute(input.toString(), "--database", "shop", "--out", outDir.toString(), "--report");

        assertThat(exitCode).isZero();
        assertThat(outDir.resolve("t.sql")).exists();
        assertThat(Files.readString(outDir.resolve("t.deferred.sql"))).contains("ALTER TABLE `t`");
        assertThat(Files.readString(outDir.resolve("t.defer.json"))).contains("\"database\" : \"shop\"");
        assertThat(outContent.toString()).contains("shop.t: 2 clause(s) deferred, 0 index(es) kept for foreign keys.");
    }

    @Test
    @DisplayName("Reports a malformed CREATE TABLE with exit code 1")
    void malformedDdl() throws IOException {
        Path input = writeSection("bad.sql", "CREATE TABLE bad (\n  `a` int,\n  KEY `k` (`a`)\n) ENGINE=InnoDB;\n");

        int exitCode = command().execute(input.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Malformed CREATE TABLE");
    }

    @Test
    @DisplayName("Returns error when the section file does not exist")
    void missingFile() {
        int exitCode = command().execute(tempDir.resolve("nope.sql").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Section file not found");
    }

    @Test
    @DisplayName("Returns error for an unsupported charset")
    void unsupportedCharset() throws IOException {
        Path input = writeSection("t.sql", SECTION);

        int exitCode = command().execute(input.toString(), "--charset", "no-such-charset");

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Unsupported charset");
    }

    @Test
    @DisplayName("Reads the section from stdin when no file is given")
    void readsStdin() {
        InputStream originalIn = System.in;
        try {
            System.setIn(new ByteArrayInputStream(SECTION.getBytes(StandardCharsets.UTF_8)));

            int exitCode = command().execute("-");

            assertThat(exitCode).isZero();
            assertThat(outContent.toString()).contains("ALTER TABLE `t`");
        } finally {
            System.setIn(originalIn);
        }
    }

    @Test
    @DisplayName("Fails on stdin bytes the charset cannot decode")
    void rejectsUndecodableStdin() {
        InputStream originalIn = System.in;
        try {
            byte[] head = SECTION.getBytes(StandardCharsets.UTF_8);
            byte[] blob = "INSERT INTO `t` VALUES ('".getBytes(StandardCharsets.UTF_8);
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            bytes.writeBytes(head);
            bytes.writeBytes(blob);
            bytes.writeBytes(new byte[]{(byte) 0xff, (byte) 0xfe, (byte) 0x80});
            bytes.writeBytes("');\n".getBytes(StandardCharsets.UTF_8));
            System.setIn(new ByteArrayInputStream(bytes.toByteArray()));

            int exitCode = command().execute("-");

            assertThat(exitCode).isEqualTo(1);
            assertThat(errContent.toString()).contains("Defer failed");
            assertThat(outContent.toString()).doesNotContain("\uFFFD");
        } finally {
            System.setIn(originalIn);
        }
    }

    @Nested
    @DisplayName("defer-constraints resolution")
    class DeferConstraints {

        private final List<Boolean> requested = new ArrayList<>();

        private CommandLine command(Path configDir) {
            return new CommandLine(new DeferCommand(flag -> {
                requested.add(flag);
                return deferrer;
            }, new ConfigurationLoader(configDir)));
        }

        @Test
        @DisplayName("Defaults to keeping indexes used by foreign keys")
        void defaultIsFalse() throws IOException {
            Path input = writeSection("t.sql", SECTION);
            when(deferrer.splitIndexes(any())).thenReturn(DeferResult.skipped("unknown", "t"));

            int exitCode = command(tempDir).execute(input.toString());

            assertThat(exitCode).isZero();
            assertThat(requested).containsExactly(false);
        }

        @Test
        @DisplayName("Uses the profile value when the flag is absent")
        void profileValue() throws IOException {
            Files.writeString(tempDir.resolve("dumpsieve.yaml"), """
                    profiles:
                      restore:
                        defer:
                          constraints: true
                    """);
            Path input = writeSection("t.sql", SECTION);
            when(deferrer.splitIndexes(any())).thenReturn(DeferResult.skipped("unknown", "t"));

            int exitCode = command(tempDir).execute(input.toString(), "--profile", "restore");

            assertThat(exitCode).isZero();
            assertThat(requested).containsExactly(true);
        }

        @Test
        @DisplayName("Passes the loaded section with the given names to the deferrer")
        void passesSection() throws IOException {
            Path input = writeSection("t.sql", SECTION);
            when(deferrer.splitIndexes(any())).thenReturn(DeferResult.skipped("shop", "orders"));

            int exitCode = command(tempDir).execute(input.toString(),
                    "--defer-constraints", "--database", "shop", "--table", "orders");

            assertThat(exitCode).isZero();
            assertThat(requested).containsExactly(true);
            ArgumentCaptor<TableSection> captor = ArgumentCaptor.forClass(TableSection.class);
            verify(deferrer).splitIndexes(captor.capture());
            assertThat(captor.getValue().getDatabase()).isEqualTo("shop");
            assertThat(captor.getValue().getTable()).isEqualTo("orders");
            assertThat(captor.getValue().text()).isEqualTo(SECTION);
        }
    }
}
