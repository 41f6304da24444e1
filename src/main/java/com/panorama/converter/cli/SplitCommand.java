package com.panorama.converter.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.cli.exception.OptionsValidationException;
import com.panorama.converter.cli.model.SplitOptions;
import com.panorama.converter.cli.output.LogLevels;
import com.panorama.converter.cli.output.SplitResultsPrinter;
import com.panorama.converter.cli.validation.SplitOptionsValidator;
import com.panorama.converter.parser.exception.ParseException;
import com.panorama.converter.service.ConverterConfig;
import com.panorama.converter.service.SplitResult;
import com.panorama.converter.service.SplitService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command splitting a Panorama export into one document per device group.
 */
@Command(
        name = "split",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        description = "Splits a Panorama XML export into standalone configurations, one per device group."
)
public class SplitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SplitCommand.class);

    @Mixin
    private SplitOptions options;

    private final SplitOptionsValidator validator = new SplitOptionsValidator();
    private final SplitResultsPrinter printer = new SplitResultsPrinter();

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
            SplitResult result = new SplitService().split(config);
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printSuccess(result);
            return 0;
        } catch (ParseException e) {
            log.error("Error: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to write output to {}: {}", config.getOutputDir(), e.getMessage(), e);
            return 1;
        }
    }
}
