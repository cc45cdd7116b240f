package com.largomodo.ramanfit.core.domain;

/**
 * Terminal classification of a processed spectrum.
 * <ul>
 *   <li>NOISY: signal-to-noise below threshold, nothing fitted</li>
 *   <li>VOIGT1: Voigt fit accepted, R2 below limit and narrow D1</li>
 *   <li>VOIGT3: Voigt fit accepted, R2 below limit and R1 below limit</li>
 *   <li>LORENTZIANS: five-Lorentzian fit accepted</li>
 *   <li>VOIGT2: five-Lorentzian fit rejected on RA2, Voigt results reported instead</li>
 * </ul>
 */
public enum FitStyle {
    NOISY("Noisy"),
    VOIGT1("Voigt1"),
    VOIGT2("Voigt2"),
    VOIGT3("Voigt3"),
    LORENTZIANS("Lorentzians");

    private final String ledgerName;

    FitStyle(String ledgerName) {
        this.ledgerName = ledgerName;
    }

    public String getLedgerName() {
        return ledgerName;
    }

    /**
     * True for the styles that report the five-peak model.
     */
    public boolean reportsFivePeaks() {
        return this == LORENTZIANS;
    }
}
