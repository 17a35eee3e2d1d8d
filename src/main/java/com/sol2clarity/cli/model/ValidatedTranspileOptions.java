package com.sol2clarity.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized paths derived from {@link TranspileOptions}. Keeps TranspileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTranspileOptions {
    Path inputFile;
    Path outputDir;
}
