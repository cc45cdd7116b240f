package com.largomodo.ramanfit.core.domain;

/**
 * Straight-line baseline {@code intercept + slope * x}.
 */
public record LinearBackground(double intercept, double slope) {

    public double valueAt(double wavenumber) {
        return intercept + slope * wavenumber;
    }
}
