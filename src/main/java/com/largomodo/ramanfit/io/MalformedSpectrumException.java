package com.largomodo.ramanfit.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A spectrum file line that is not two numbers.
 */
public class MalformedSpectrumException extends IOException {

    private final Path file;
    private final int lineNumber;

    public MalformedSpectrumException(Path file, int lineNumber, String message) {
        super(file + ":" + lineNumber + ": " + message);
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public Path getFile() {
        return file;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
