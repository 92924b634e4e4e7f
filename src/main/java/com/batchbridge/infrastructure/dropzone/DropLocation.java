package com.batchbridge.infrastructure.dropzone;

import java.util.List;

/**
 * File-transfer drop location. Listed files are immutable; marking one
 * processed moves it out of the listing and is idempotent.
 */
public interface DropLocation {

    List<DropFile> list(int limit);

    byte[] read(DropFile file);

    void markProcessed(DropFile file);
}
