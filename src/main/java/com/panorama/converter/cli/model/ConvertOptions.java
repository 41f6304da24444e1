package com.panorama.converter.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "convert" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Parameters(index = "0", paramLabel = "<input>", description = "Panorama XML export file")
	private Path inputFile;

	@Option(names = { "--output-dir", "-o" }, defaultValue = "terraform_output",
			description = "Output directory for Terraform files (default: ${DEFAULT-VALUE})")
	private Path outputDir;

	@Option(names = { "--verbose", "-v" }, description = "Log every resolution decision")
	private boolean verbose;
}
