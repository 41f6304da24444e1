package com.panorama.converter.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; the work happens in the subcommands.
 */
@Command(
        name = "panorama-converter",
        mixinStandardHelpOptions = true,
        version = "panorama-converter 1.0.0",
        exitCodeOnInvalidInput = 1,
        description = "Resolves Panorama configuration exports into Terraform and splits them per device group.",
        subcommands = {ConvertCommand.class, SplitCommand.class}
)
public class ConverterCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand (convert or split)");
    }
}
