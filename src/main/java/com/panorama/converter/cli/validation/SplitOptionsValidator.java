package com.panorama.converter.cli.validation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.panorama.converter.cli.exception.OptionsValidationException;
import com.panorama.converter.cli.model.SplitOptions;
import com.panorama.converter.extract.DeviceGroupExtractor;
import com.panorama.converter.service.ConverterConfig;

public class SplitOptionsValidator {

	static final String DEFAULT_OUTPUT_DIR_NAME = "split_configs";

	public ConverterConfig validate(SplitOptions o) {
		List<String> errors = new ArrayList<>();

		InputFileChecks.checkInput(o.getInputFile(), errors);

		for (String group : o.getDeviceGroups()) {
			if (InputFileChecks.isBlank(group)) {
				errors.add("Device group names must not be blank (--group / -g).");
				break;
			}
		}
		for (String prefix : o.getTemplatePrefixes()) {
			if (prefix == null || prefix.isEmpty()) {
				errors.add("Template prefixes must not be empty (--strip-prefix).");
				break;
			}
		}

		Path outputDir = null;
		if (o.getOutputDir() != null) {
			outputDir = o.getOutputDir().toAbsolutePath().normalize();
		} else if (o.getInputFile() != null) {
			Path parent = o.getInputFile().toAbsolutePath().normalize().getParent();
			outputDir = (parent == null ? Path.of(".") : parent).resolve(DEFAULT_OUTPUT_DIR_NAME);
		}
		InputFileChecks.checkOutputDir(outputDir, errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		List<String> prefixes = o.getTemplatePrefixes().isEmpty()
				? DeviceGroupExtractor.DEFAULT_TEMPLATE_PREFIXES
				: List.copyOf(o.getTemplatePrefixes());

		return ConverterConfig.builder()
				.inputFile(o.getInputFile().toAbsolutePath().normalize())
				.outputDir(outputDir)
				.deviceGroups(o.getDeviceGroups().stream().map(String::trim).toList())
				.templatePrefixes(prefixes)
				.verbose(o.isVerbose())
				.build();
	}
}
