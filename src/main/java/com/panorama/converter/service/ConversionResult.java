package com.panorama.converter.service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.panorama.converter.model.diagnostics.ToolDiagnostics;
import com.panorama.converter.render.GeneratedFile;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one Terraform conversion.
 */
@Data
@Builder
public class ConversionResult {
    private Path outputDir;

    /**
     * Resolved entry count per object type label, in registry order.
     */
    private Map<String, Integer> objectCounts;
    private int totalObjects;
    private long referenceOnlyObjects;

    private int virtualRouters;
    private int logicalRouters;

    private List<GeneratedFile> files;

    @Builder.Default
    private ToolDiagnostics diagnostics = new ToolDiagnostics();

    public int getResourceCount() {
        return files == null ? 0 : files.stream().mapToInt(GeneratedFile::getResourceCount).sum();
    }
}
