package com.panorama.converter.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "split" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class SplitOptions {

	@Parameters(index = "0", paramLabel = "<input>", description = "Panorama XML export file")
	private Path inputFile;

	@Option(names = { "--output-dir", "-o" },
			description = "Output directory for split configs (defaults to <input-dir>/split_configs)")
	private Path outputDir;

	@Option(names = { "--group", "-g" }, paramLabel = "<device-group>",
			description = "Device group to extract; repeatable. All device groups when omitted")
	private List<String> deviceGroups = new ArrayList<>();

	@Option(names = { "--strip-prefix" }, paramLabel = "<prefix>",
			description = "Prefix removed from a device group name to find its template; repeatable (default: DG-, dg-)")
	private List<String> templatePrefixes = new ArrayList<>();

	@Option(names = { "--verbose", "-v" }, description = "Log every extraction decision")
	private boolean verbose;
}
