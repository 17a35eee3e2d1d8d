package com.sol2clarity.cli;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.cli.exception.OptionsValidationException;
import com.sol2clarity.cli.model.TranspileOptions;
import com.sol2clarity.cli.model.ValidatedTranspileOptions;
import com.sol2clarity.cli.output.TranspileResultsPrinter;
import com.sol2clarity.cli.validation.TranspileOptionsValidator;
import com.sol2clarity.config.TranspilerConfig;
import com.sol2clarity.exception.TranspilerException;
import com.sol2clarity.output.GeneratedFileWriter;
import com.sol2clarity.pipeline.TranspileResult;
import com.sol2clarity.pipeline.TranspilerPipeline;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command translating a Solidity file into Clarity units.
 *
 * <p>Exit codes: 0 on success, 1 when validation, parsing, conversion or writing
 * fails, 2 for usage errors reported by picocli.
 */
@Command(
        name = "sol2clarity",
        mixinStandardHelpOptions = true,
        version = "sol2clarity 1.0.0",
        description = "Translates the contracts of a Solidity source file into Clarity contracts, one .clar file per contract."
)
public class TranspileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranspileCommand.class);

    @Mixin
    private TranspileOptions options;

    private final TranspileOptionsValidator validator = new TranspileOptionsValidator();
    private final TranspileResultsPrinter printer = new TranspileResultsPrinter();
    private final GeneratedFileWriter writer = new GeneratedFileWriter();

    @Override
    public Integer call() {
        ValidatedTranspileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            TranspilerConfig config = TranspilerConfig.builder()
                    .outputDir(validated.getOutputDir())
                    .sourceName(validated.getInputFile().getFileName().toString())
                    .stringAsciiLength(options.getStringLength())
                    .parallel(options.isParallel())
                    .continueOnError(options.isContinueOnError())
                    .build();

            String source = Files.readString(validated.getInputFile(), StandardCharsets.UTF_8);
            TranspileResult result = new TranspilerPipeline(config).transpile(source);
            List<Path> written = writer.writeAll(result.getOutputs(), config.getOutputDir());

            if (!result.isSuccess()) {
                printer.printPartialFailure(result, written);
                return 1;
            }
            printer.printSuccess(result, written);
            return 0;

        } catch (TranspilerException e) {
            printer.printFailure(TranspileResult.failure(e.getMessage()));
            return 1;
        } catch (Exception e) {
            log.error("Transpilation failed with exception", e);
            return 1;
        }
    }
}
