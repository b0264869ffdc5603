package com.eainde.xrf.job;

import java.io.InputStream;
import java.util.function.Supplier;

/**
 * One uploaded XRF export: its original file name and a way to open its bytes.
 */
public record UploadedSheet(String fileName, Supplier<InputStream> content) {

    public InputStream open() {
        return content.get();
    }
}
