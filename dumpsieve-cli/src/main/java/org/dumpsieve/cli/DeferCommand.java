package org.dumpsieve.cli;

import org.dumpsieve.cli.service.SectionIoService;
import org.dumpsieve.config.ConfigurationLoader;
import org.dumpsieve.defer.IndexDeferrer;
import org.dumpsieve.model.DeferResult;
import org.dumpsieve.model.TableSection;
import org.dumpsieve.options.SieveOptions;
import org.dumpsieve.output.DeferredSqlHandler;
import org.dumpsieve.parser.MalformedDdlException;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command for deferring index and foreign key creation of one table section.
 * Prints or writes the patched section and the ALTER TABLE to run after the data load.
 */
@CommandLine.Command(
        name = "defer",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "테이블 섹션의 보조 인덱스/외래키를 ALTER TABLE 로 분리하여 데이터 적재 이후로 미룹니다."
)
public class DeferCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "테이블 섹션 파일 (생략하거나 - 이면 stdin)")
    private Path input;
    @CommandLine.Option(names = "--database", description = "진단 메시지에 사용할 데이터베이스 이름")
    private String database;
    @CommandLine.Option(names = "--table", description = "테이블 이름 (생략 시 CREATE TABLE 에서 추출)")
    private String table;
    @CommandLine.Option(names = "--defer-constraints", description = "외래키가 사용하는 인덱스도 보존하지 않고 모든 제약조건을 함께 미룹니다.")
    private Boolean deferConstraints;
    @CommandLine.Option(names = "--out", description = "결과 파일 저장 위치 (생략 시 stdout)")
    private Path outputDir;
    @CommandLine.Option(names = "--charset", description = "입출력 문자셋")
    private String charsetName;
    @CommandLine.Option(names = "--report", description = "JSON 리포트도 함께 생성합니다. (--out 필요)")
    private boolean report;
    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;

    private final Function<Boolean, IndexDeferrer> deferrerFactory;
    private final ConfigurationLoader configurationLoader;

    public DeferCommand() {
        this(IndexDeferrer::new, new ConfigurationLoader());
    }

    DeferCommand(Function<Boolean, IndexDeferrer> deferrerFactory, ConfigurationLoader configurationLoader) {
        this.deferrerFactory = deferrerFactory;
        this.configurationLoader = configurationLoader;
    }

    @Override
    public Integer call() {
        try {
            applyConfiguration();
            Charset charset = resolveCharset();

            TableSection section = new SectionIoService(charset).load(input, database, table);
            DeferResult result = deferrerFactory.apply(deferConstraints).splitIndexes(section);

            if (outputDir == null) {
                printResult(section, result);
                return 0;
            }

            DeferredSqlHandler handler = new DeferredSqlHandler(outputDir, charset);
            handler.handle(section, result);
            if (report) {
                handler.writeReport(section, result);
            }
            System.out.println(summary(section, result) + " Written to " + outputDir);
            return 0;

        } catch (MalformedDdlException e) {
            System.err.println("Malformed CREATE TABLE: " + e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Defer failed: " + e.getMessage());
            return 1;
        }
    }

    private void printResult(TableSection section, DeferResult result) {
        if (report) {
            System.err.println("Warning: --report requires --out. No report written.");
        }
        System.out.print(section.text());
        if (result.hasDeferred()) {
            System.out.println();
            System.out.print(result.getAlterTable());
        }
    }

    private String summary(TableSection section, DeferResult result) {
        if (result.isSkipped()) {
            return section.getDatabase() + "." + section.getTable() + ": not an InnoDB table, left unchanged.";
        }
        return String.format("%s.%s: %d clause(s) deferred, %d index(es) kept for foreign keys.",
                section.getDatabase(), section.getTable(),
                result.getDeferred().size(), result.getPreserved().size());
    }

    /**
     * Loads configuration from file and applies it to options not given on the command line.
     */
    private void applyConfiguration() {
        Map<String, String> config = configurationLoader.loadConfiguration(profile);

        if (deferConstraints == null) {
            deferConstraints = Boolean.parseBoolean(config.getOrDefault(
                    SieveOptions.Defer.CONSTRAINTS_KEY,
                    String.valueOf(SieveOptions.Defer.CONSTRAINTS_DEFAULT)));
        }
        if (outputDir == null && config.get(SieveOptions.Output.DIRECTORY_KEY) != null) {
            outputDir = Paths.get(config.get(SieveOptions.Output.DIRECTORY_KEY));
        }
        if (charsetName == null) {
            charsetName = config.getOrDefault(SieveOptions.Output.CHARSET_KEY, SieveOptions.Output.CHARSET_DEFAULT);
        }
    }

    private Charset resolveCharset() {
        try {
            return Charset.forName(charsetName);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalArgumentException("Unsupported charset: " + charsetName, e);
        }
    }
}
