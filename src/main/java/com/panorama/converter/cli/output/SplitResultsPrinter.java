package com.panorama.converter.cli.output;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.service.ConverterConfig;
import com.panorama.converter.service.SplitResult;

/**
 * Responsible only for printing CLI output for the "split" command.
 */
public class SplitResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(SplitResultsPrinter.class);

    public void printBanner(ConverterConfig config) {
        log.info("=================================================");
        log.info("Panorama Device Group Splitter");
        log.info("=================================================");
        log.info("Input File: {}", config.getInputFile());
        log.info("Output Directory: {}", config.getOutputDir());
        log.info("Device Groups: {}", config.getDeviceGroups().isEmpty() ? "all" : config.getDeviceGroups());
        log.info("Template Prefixes: {}", config.getTemplatePrefixes());
        log.info("=================================================");
    }

    public void printSuccess(SplitResult result) {
        log.info("");
        log.info("Device groups in export:");
        for (String group : result.getAvailableGroups()) {
            log.info("  - {}", group);
        }
        log.info("");
        log.info("Successfully split {} device groups", result.getWrittenFiles().size());
        for (Map.Entry<String, Path> written : result.getWrittenFiles().entrySet()) {
            log.info("  {} -> {}", written.getKey(), written.getValue().getFileName());
        }
        DiagnosticsPrinter.print(log, result.getDiagnostics());

        log.info("");
        log.info("Next steps:");
        log.info("  1. cd {}", result.getOutputDir());
        log.info("  2. Convert each XML file:");
        log.info("     panorama-converter convert <device-group>.xml --output-dir <device-group>-tf");
    }

    public void printFailure(SplitResult result) {
        for (String error : result.getDiagnostics().getErrors()) {
            log.error(error);
        }
        for (String warning : result.getDiagnostics().getWarnings()) {
            log.warn(warning);
        }
    }
}
