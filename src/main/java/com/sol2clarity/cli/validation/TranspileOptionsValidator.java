package com.sol2clarity.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.sol2clarity.cli.exception.OptionsValidationException;
import com.sol2clarity.cli.model.TranspileOptions;
import com.sol2clarity.cli.model.ValidatedTranspileOptions;

public class TranspileOptionsValidator {

	public ValidatedTranspileOptions validate(TranspileOptions o) {
		List<String> errors = new ArrayList<>();

		Path inputFile = null;
		if (o.getInputFile() == null) {
			errors.add("Input file is required.");
		} else {
			inputFile = o.getInputFile().toAbsolutePath().normalize();
			if (!Files.exists(inputFile)) {
				errors.add("Input file does not exist: " + inputFile);
			} else if (!Files.isRegularFile(inputFile)) {
				errors.add("Input path is not a regular file: " + inputFile);
			} else if (!Files.isReadable(inputFile)) {
				errors.add("Input file is not readable: " + inputFile);
			}
		}

		// Missing output directories are created on write
		Path outputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath().normalize();
		if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
			errors.add("Output path exists but is not a directory: " + outputDir);
		}

		if (o.getStringLength() <= 0) {
			errors.add("String length must be > 0. Got: " + o.getStringLength());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedTranspileOptions(inputFile, outputDir);
	}
}
