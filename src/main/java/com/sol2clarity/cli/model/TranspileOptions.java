package com.sol2clarity.cli.model;

import java.nio.file.Path;

import com.sol2clarity.config.TranspilerConfig;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options of the sol2clarity command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class TranspileOptions {

    @Parameters(index = "0", paramLabel = "<input-file>", description = "Solidity source file to translate")
    private Path inputFile;

    @Option(names = { "--output", "-o" }, description = "Output directory (defaults to current directory)")
    private Path outputDir;

    @Option(names = { "--continue-on-error" },
            description = "Skip contracts with unsupported constructs and translate the rest")
    private boolean continueOnError;

    @Option(names = { "--parallel" }, description = "Convert the contracts of the input in parallel")
    private boolean parallel;

    @Option(names = { "--string-length" }, defaultValue = "" + TranspilerConfig.DEFAULT_STRING_ASCII_LENGTH,
            description = "Length N used for string -> (string-ascii N) (default: ${DEFAULT-VALUE})")
    private int stringLength;
}
