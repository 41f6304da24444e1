package com.panorama.converter.cli.output;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.render.GeneratedFile;
import com.panorama.converter.service.ConversionResult;
import com.panorama.converter.service.ConverterConfig;

/**
 * Responsible only for printing CLI output for the "convert" command.
 * No validation, no execution.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ConverterConfig config) {
        log.info("=================================================");
        log.info("Panorama to Terraform Converter");
        log.info("=================================================");
        log.info("Input File: {}", config.getInputFile());
        log.info("Output Directory: {}", config.getOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(ConversionResult result) {
        log.info("");
        log.info("=================================================");
        log.info("MIGRATION SUMMARY");
        log.info("=================================================");
        for (Map.Entry<String, Integer> count : result.getObjectCounts().entrySet()) {
            if (count.getValue() > 0) {
                log.info("  {}: {}", capitalize(count.getKey()), count.getValue());
            }
        }
        log.info("  Virtual routers: {}", result.getVirtualRouters());
        log.info("  Logical routers: {}", result.getLogicalRouters());
        log.info("");
        log.info("Total objects resolved: {}", result.getTotalObjects());
        if (result.getReferenceOnlyObjects() > 0) {
            log.info("Reference-only objects (not rendered): {}", result.getReferenceOnlyObjects());
        }
        log.info("");
        log.info("Generated files in {}:", result.getOutputDir());
        for (GeneratedFile file : result.getFiles()) {
            log.info("  {} ({} resources)", file.getFileName(), file.getResourceCount());
        }
        DiagnosticsPrinter.print(log, result.getDiagnostics());

        log.info("");
        log.info("=================================================");
        log.info("NEXT STEPS");
        log.info("=================================================");
        log.info("1. Review the generated files:");
        log.info("   cd {}", result.getOutputDir());
        log.info("2. Configure provider credentials (PANOS_HOSTNAME, PANOS_USERNAME, PANOS_PASSWORD)");
        log.info("3. Initialize and plan:");
        log.info("   terraform init");
        log.info("   terraform plan");
        log.info("=================================================");
    }

    private static String capitalize(String label) {
        if (label == null || label.isEmpty()) {
            return label;
        }
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
