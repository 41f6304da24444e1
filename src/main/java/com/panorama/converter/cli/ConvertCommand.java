package com.panorama.converter.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.cli.exception.OptionsValidationException;
import com.panorama.converter.cli.model.ConvertOptions;
import com.panorama.converter.cli.output.ConvertResultsPrinter;
import com.panorama.converter.cli.output.LogLevels;
import com.panorama.converter.cli.validation.ConvertOptionsValidator;
import com.panorama.converter.parser.exception.ParseException;
import com.panorama.converter.render.exception.RenderException;
import com.panorama.converter.service.ConversionResult;
import com.panorama.converter.service.ConversionService;
import com.panorama.converter.service.ConverterConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command converting a Panorama export into Terraform files.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        description = "Resolves every object of a Panorama XML export and renders Terraform for the PAN-OS provider."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        ConverterConfig config;
        try {
            config = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        LogLevels.applyVerbose(config.isVerbose());
        printer.printBanner(config);

        try {
            ConversionResult result = new ConversionService().convert(config);
            printer.printSuccess(result);
            return 0;
        } catch (ParseException e) {
            log.error("Error: {}", e.getMessage());
            return 1;
        } catch (RenderException e) {
            log.error("Rendering failed: {}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.error("Failed to write output to {}: {}", config.getOutputDir(), e.getMessage(), e);
            return 1;
        }
    }
}
