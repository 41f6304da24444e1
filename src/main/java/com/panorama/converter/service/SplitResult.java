package com.panorama.converter.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.panorama.converter.model.diagnostics.ToolDiagnostics;

import lombok.Builder;
import lombok.Data;

/**
 * Result of splitting an export per device group.
 */
@Data
@Builder
public class SplitResult {
    private Path outputDir;

    /**
     * Every device group of the document, in document order.
     */
    @Builder.Default
    private List<String> availableGroups = new ArrayList<>();

    /**
     * Written file per device group.
     */
    @Builder.Default
    private Map<String, Path> writtenFiles = new LinkedHashMap<>();

    @Builder.Default
    private List<String> notFound = new ArrayList<>();

    @Builder.Default
    private ToolDiagnostics diagnostics = new ToolDiagnostics();

    public boolean isSuccess() {
        return !writtenFiles.isEmpty();
    }
}
