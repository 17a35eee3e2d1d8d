package com.sol2clarity.config;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a transpiler run.
 */
@Data
@Builder
public class TranspilerConfig {

    public static final int DEFAULT_STRING_ASCII_LENGTH = 256;

    @Builder.Default
    private String toolName = "sol2clarity";

    @Builder.Default
    private String toolVersion = "1.0.0";

    /**
     * Directory the generated units are written to.
     */
    private Path outputDir;

    /**
     * Input file name shown in the generated header, or {@code null} to omit it.
     */
    private String sourceName;

    /**
     * Length used when mapping {@code string} to {@code (string-ascii N)}.
     */
    @Builder.Default
    private int stringAsciiLength = DEFAULT_STRING_ASCII_LENGTH;

    private boolean parallel;

    /**
     * Skip contracts with unsupported constructs instead of aborting the whole input.
     */
    private boolean continueOnError;

    public static TranspilerConfig defaults() {
        return TranspilerConfig.builder().build();
    }
}
