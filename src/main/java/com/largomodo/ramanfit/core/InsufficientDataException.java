package com.largomodo.ramanfit.core;

/**
 * Thrown when a spectrum lacks the points a pipeline stage needs (fewer than two records for
 * the background, or an empty noise reference window).
 * <p>
 * Fatal for the sample it concerns only. RuntimeException so the pipeline stages stay free of
 * catch blocks; the batch loop catches it per file.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
