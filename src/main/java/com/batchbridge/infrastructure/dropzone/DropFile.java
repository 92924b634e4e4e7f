package com.batchbridge.infrastructure.dropzone;

import lombok.Value;

import java.nio.file.Path;

/**
 * A file listed at the drop location.
 */
@Value
public class DropFile {
    String name;
    Path path;
    long sizeBytes;
}
