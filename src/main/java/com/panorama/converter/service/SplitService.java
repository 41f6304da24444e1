package com.panorama.converter.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.extract.DeviceGroupExtractor;
import com.panorama.converter.extract.DeviceGroupSplitter;
import com.panorama.converter.extract.ExtractionResult;
import com.panorama.converter.model.ConfigNode;
import com.panorama.converter.parser.ConfigTreeLoader;
import com.panorama.converter.writer.BundleWriter;
import com.panorama.converter.writer.FileWriteUtil;

/**
 * Splits a Panorama export into one standalone document per device group.
 */
public class SplitService {

    private static final Logger log = LoggerFactory.getLogger(SplitService.class);

    private final ConfigTreeLoader loader;

    public SplitService() {
        this.loader = new ConfigTreeLoader();
    }

    /**
     * @throws com.panorama.converter.parser.exception.ParseException if the input is not a readable XML document
     * @throws IOException if a bundle cannot be written
     */
    public SplitResult split(ConverterConfig config) throws IOException {
        ConfigNode root = loader.load(config.getInputFile());
        DeviceGroupSplitter splitter = new DeviceGroupSplitter(new DeviceGroupExtractor(config.getTemplatePrefixes()));

        SplitResult result = SplitResult.builder()
                .outputDir(config.getOutputDir())
                .availableGroups(splitter.listDeviceGroups(root))
                .build();

        if (result.getAvailableGroups().isEmpty()) {
            result.getDiagnostics().error("No device groups found in Panorama configuration. "
                    + "This may be a single firewall export, not a Panorama export.");
            return result;
        }
        log.info("Found {} device groups", result.getAvailableGroups().size());

        Path outputDir = config.getOutputDir();
        FileWriteUtil.createDirectories(outputDir);
        log.info("Splitting configurations into: {}", outputDir);

        BundleWriter bundleWriter = new BundleWriter();
        List<ExtractionResult> extractions = splitter.split(root, config.getDeviceGroups());
        for (ExtractionResult extraction : extractions) {
            if (extraction.isFound()) {
                Path file = bundleWriter.write(extraction.getBundle(), outputDir);
                result.getWrittenFiles().put(extraction.getGroupName(), file);
            } else {
                result.getNotFound().add(extraction.getGroupName());
                result.getDiagnostics().warn("Could not extract config for " + extraction.getGroupName()
                        + ": device group not found");
            }
        }

        if (result.getWrittenFiles().isEmpty()) {
            result.getDiagnostics().error("None of the requested device groups exist: " + config.getDeviceGroups());
        }
        return result;
    }
}
