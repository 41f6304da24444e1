package com.panorama.converter.cli.validation;

import com.panorama.converter.cli.exception.OptionsValidationException;
import com.panorama.converter.cli.model.ConvertOptions;
import com.panorama.converter.cli.model.SplitOptions;
import com.panorama.converter.service.ConverterConfig;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class SplitOptionsValidatorTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultsNextToInputFile() throws IOException {
        Path input = Files.writeString(tempDir.resolve("panorama.xml"), "<config/>");

        ConverterConfig config = new SplitOptionsValidator().validate(split(input.toString()));

        assertThat(config.getOutputDir()).isEqualTo(tempDir.toAbsolutePath().normalize().resolve("split_configs"));
        assertThat(config.getDeviceGroups()).isEmpty();
        assertThat(config.getTemplatePrefixes()).containsExactly("DG-", "dg-");
    }

    @Test
    void testGroupsAndPrefixesAreCarriedOver() throws IOException {
        Path input = Files.writeString(tempDir.resolve("panorama.xml"), "<config/>");

        ConverterConfig config = new SplitOptionsValidator().validate(split(input.toString(),
                "-g", "DG-A", "--group", "DG-B", "--strip-prefix", "FW_", "-o", tempDir.resolve("out").toString()));

        assertThat(config.getDeviceGroups()).containsExactly("DG-A", "DG-B");
        assertThat(config.getTemplatePrefixes()).containsExactly("FW_");
        assertThat(config.getOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
    }

    @Test
    void testAllErrorsAreReportedTogether() throws IOException {
        Path notADirectory = Files.writeString(tempDir.resolve("file.txt"), "x");

        assertThatThrownBy(() -> new SplitOptionsValidator().validate(split(tempDir.resolve("missing.xml").toString(),
                "-g", " ", "-o", notADirectory.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors()).hasSize(3));
    }

    @Test
    void testConvertDefaultsToTerraformOutput() throws IOException {
        Path input = Files.writeString(tempDir.resolve("panorama.xml"), "<config/>");
        ConvertOptions options = CommandLine.populateCommand(new ConvertOptions(), input.toString());

        ConverterConfig config = new ConvertOptionsValidator().validate(options);

        assertThat(config.getOutputDir().getFileName().toString()).isEqualTo("terraform_output");
    }

    @Test
    void testConvertRejectsDirectoryAsInput() {
        ConvertOptions options = CommandLine.populateCommand(new ConvertOptions(), tempDir.toString());

        assertThatThrownBy(() -> new ConvertOptionsValidator().validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("not a regular file");
    }

    private static SplitOptions split(String... args) {
        return CommandLine.populateCommand(new SplitOptions(), args);
    }
}
