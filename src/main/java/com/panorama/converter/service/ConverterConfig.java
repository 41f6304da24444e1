package com.panorama.converter.service;

import java.nio.file.Path;
import java.util.List;

import com.panorama.converter.extract.DeviceGroupExtractor;

import lombok.Builder;
import lombok.Data;

/**
 * Validated settings for one conversion or split run.
 */
@Data
@Builder
public class ConverterConfig {
    private Path inputFile;
    private Path outputDir;

    /**
     * Device groups to split; all groups when empty.
     */
    @Builder.Default
    private List<String> deviceGroups = List.of();

    @Builder.Default
    private List<String> templatePrefixes = DeviceGroupExtractor.DEFAULT_TEMPLATE_PREFIXES;

    private boolean verbose;
}
