package com.sol2clarity.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.cli.model.TranspileOptions;
import com.sol2clarity.cli.model.ValidatedTranspileOptions;
import com.sol2clarity.pipeline.ContractFailure;
import com.sol2clarity.pipeline.TranspileResult;

/**
 * Responsible only for printing CLI output for the sol2clarity command.
 * No validation, no execution.
 */
public class TranspileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TranspileResultsPrinter.class);

    public void printBanner(TranspileOptions o, ValidatedTranspileOptions v) {
        log.info("=================================================");
        log.info("sol2clarity: Solidity to Clarity");
        log.info("=================================================");
        log.info("Input File: {}", v.getInputFile());
        log.info("Output Directory: {}", v.getOutputDir());
        log.info("String Length: {}", o.getStringLength());
        log.info("Parallel: {}", o.isParallel());
        log.info("Continue On Error: {}", o.isContinueOnError());
        log.info("=================================================");
    }

    public void printSuccess(TranspileResult result, List<Path> written) {
        log.info("");
        log.info("=================================================");
        log.info("TRANSPILATION SUCCESSFUL");
        log.info("=================================================");
        printSummary(result, written);
        log.info("=================================================");
    }

    /**
     * Used when some contracts were skipped; the others were still written.
     */
    public void printPartialFailure(TranspileResult result, List<Path> written) {
        log.error("=================================================");
        log.error("TRANSPILATION INCOMPLETE: {}", result.getErrorMessage());
        log.error("=================================================");
        for (ContractFailure failure : result.getFailures()) {
            log.error("  {}: {}", failure.getContractName(), failure.getMessage());
        }
        printSummary(result, written);
    }

    public void printFailure(TranspileResult result) {
        log.error("Transpilation failed: {}", result.getErrorMessage());
    }

    private void printSummary(TranspileResult result, List<Path> written) {
        log.info("Contracts Parsed: {}", result.getContractsParsed());
        log.info("Contracts Converted: {}", result.getContractsConverted());
        log.info("Definitions Generated: {}", result.getDefinitionsGenerated());
        log.info("Getters Synthesized: {}", result.getGettersSynthesized());
        log.info("Maps Flattened: {}", result.getMapsFlattened());
        log.info("Contracts Skipped: {}", result.getFailures().size());
        log.info("");
        log.info("Units Written:");
        for (Path path : written) {
            log.info("  {}", path);
        }
    }
}
