package com.masterbias.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Metadata of one input frame as extracted from its header. Read-only to the combining engine.
 */
public record FileDescriptor(Path absolutePath,
                             int width,
                             int height,
                             int binning,
                             double temperature,
                             double exposure,
                             String filterName,
                             FrameType type) {

    public FileDescriptor {
        Objects.requireNonNull(absolutePath, "absolutePath");
        filterName = (filterName == null) ? "" : filterName;
        type = (type == null) ? FrameType.UNKNOWN : type;
    }

    public SizeKey sizeKey() {
        return new SizeKey(width, height, binning);
    }

    public String fileName() {
        return absolutePath.getFileName().toString();
    }
}
