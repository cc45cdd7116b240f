package com.largomodo.ramanfit.core.domain;

/**
 * Standard Raman bands of carbonaceous material.
 * <p>
 * Declaration order is the ledger column order (G first, then D1 to D4).
 */
public enum PeakLabel {
    G("g"),
    D1("d1"),
    D2("d2"),
    D3("d3"),
    D4("d4");

    private final String columnPrefix;

    PeakLabel(String columnPrefix) {
        this.columnPrefix = columnPrefix;
    }

    /**
     * Prefix used by the ledger header, e.g. {@code d1} in {@code d1_height}.
     */
    public String getColumnPrefix() {
        return columnPrefix;
    }
}
