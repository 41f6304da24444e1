package com.panorama.converter.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class InputFileChecks {

	private InputFileChecks() {
		// Utility class
	}

	static void checkInput(Path input, List<String> errors) {
		if (input == null) {
			errors.add("Input file is required.");
		} else if (!Files.exists(input)) {
			errors.add("Input file not found: " + input);
		} else if (!Files.isRegularFile(input)) {
			errors.add("Input file is not a regular file: " + input);
		} else if (!Files.isReadable(input)) {
			errors.add("Input file is not readable: " + input);
		}
	}

	static void checkOutputDir(Path outputDir, List<String> errors) {
		if (outputDir != null && Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
			errors.add("Output path exists and is not a directory: " + outputDir);
		}
	}

	static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
