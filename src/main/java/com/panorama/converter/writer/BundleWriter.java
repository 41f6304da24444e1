package com.panorama.converter.writer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.extract.DeviceGroupBundle;

/**
 * Writes extracted device groups as {@code <sanitized-name>.xml} files.
 *
 * When two groups sanitize to the same name, the later one is written with a
 * {@code _2}, {@code _3}, ... suffix. Collisions are tracked per writer, so use
 * one writer per run.
 */
public class BundleWriter {

    private static final Logger log = LoggerFactory.getLogger(BundleWriter.class);

    private final ConfigTreeWriter treeWriter;
    private final Set<Path> written = new HashSet<>();

    public BundleWriter() {
        this(new ConfigTreeWriter());
    }

    public BundleWriter(ConfigTreeWriter treeWriter) {
        this.treeWriter = treeWriter;
    }

    public Path write(DeviceGroupBundle bundle, Path outputDir) throws IOException {
        String stem = FileWriteUtil.sanitizeFileName(bundle.getGroupName());
        Path file = outputDir.resolve(stem + ".xml").toAbsolutePath().normalize();
        for (int suffix = 2; !written.add(file); suffix++) {
            file = outputDir.resolve(stem + "_" + suffix + ".xml").toAbsolutePath().normalize();
        }
        if (!file.getFileName().toString().equals(stem + ".xml")) {
            log.warn("Device group '{}' collides with another group's file name, writing {}",
                    bundle.getGroupName(), file.getFileName());
        }
        treeWriter.write(bundle.toDocument(), file);
        log.info("  Saved to: {}", file);
        return file;
    }
}
