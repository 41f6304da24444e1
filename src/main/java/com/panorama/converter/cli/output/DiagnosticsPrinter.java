package com.panorama.converter.cli.output;

import org.slf4j.Logger;

import com.panorama.converter.model.diagnostics.ToolDiagnostics;

final class DiagnosticsPrinter {

    private DiagnosticsPrinter() {
        // Utility class
    }

    static void print(Logger log, ToolDiagnostics diagnostics) {
        if (!diagnostics.hasWarnings() && diagnostics.getInfos().isEmpty()) {
            return;
        }
        log.info("");
        for (String warning : diagnostics.getWarnings()) {
            log.warn("  {}", warning);
        }
        for (String info : diagnostics.getInfos()) {
            log.info("  {}", info);
        }
    }
}
