package com.panorama.converter.cli.validation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.panorama.converter.cli.exception.OptionsValidationException;
import com.panorama.converter.cli.model.ConvertOptions;
import com.panorama.converter.service.ConverterConfig;

public class ConvertOptionsValidator {

	public ConverterConfig validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		InputFileChecks.checkInput(o.getInputFile(), errors);

		Path outputDir = (o.getOutputDir() == null ? Path.of("terraform_output") : o.getOutputDir())
				.toAbsolutePath().normalize();
		InputFileChecks.checkOutputDir(outputDir, errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return ConverterConfig.builder()
				.inputFile(o.getInputFile().toAbsolutePath().normalize())
				.outputDir(outputDir)
				.verbose(o.isVerbose())
				.build();
	}
}
