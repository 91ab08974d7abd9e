package org.dumpsieve.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for dumpsieve.
 * Rewrites MySQL dump sections so secondary indexes are built after the data load.
 */
@CommandLine.Command(
        name = "dumpsieve",
        mixinStandardHelpOptions = true,
        version = "dumpsieve 0.1.0",
        description = "MySQL 덤프의 보조 인덱스/외래키 생성을 데이터 적재 이후로 미루는 도구",
        subcommands = {
                DeferCommand.class
        }
)
public class SieveCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SieveCli()).execute(args);
        System.exit(exitCode);
    }
}
