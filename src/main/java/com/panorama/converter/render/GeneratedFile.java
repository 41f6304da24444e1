package com.panorama.converter.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A rendered output file: name relative to the output directory, and contents.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    @NonNull
    String fileName;

    @NonNull
    String contents;

    /**
     * Number of resources the file declares.
     */
    int resourceCount;
}
