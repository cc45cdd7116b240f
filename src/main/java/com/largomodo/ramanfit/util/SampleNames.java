package com.largomodo.ramanfit.util;

import java.nio.file.Path;

/**
 * Sample naming from spectrum file names.
 * <p>
 * The sample name is the file name without its last extension, with whitespace replaced by
 * underscores so it stays a single ledger token: {@code "Site 4.b.txt"} becomes {@code "Site_4.b"}.
 * <p>
 * Pure function with no state or dependencies. Safe for concurrent use.
 */
public class SampleNames {

    private SampleNames() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param file spectrum file
     * @return sample name
     * @throws IllegalArgumentException if the file name has no usable base name
     */
    public static String fromFile(Path file) {
        if (file == null || file.getFileName() == null) {
            throw new IllegalArgumentException("File must have a file name: " + file);
        }
        return fromFileName(file.getFileName().toString());
    }

    public static String fromFileName(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        String base = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
        String name = base.strip().replaceAll("\\s+", "_");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a sample name from file: '" + fileName + "'");
        }
        return name;
    }
}
