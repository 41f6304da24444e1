package com.panorama.converter;

import com.panorama.converter.cli.ConverterCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Panorama converter.
 * Resolves Panorama XML exports into Terraform and splits them per device group.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        return new CommandLine(new ConverterCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
