package com.largomodo.ramanfit.ledger;

/**
 * How a ledger decides that a sample name has already been recorded.
 */
public enum LedgerKeyMatching {

    /**
     * A name is present if any recorded key contains it. Re-running {@code sample1} after
     * {@code sample10} was recorded therefore skips it; kept as the default because existing
     * ledgers were built that way.
     */
    SUBSTRING {
        @Override
        public boolean matches(String existingKey, String name) {
            return existingKey.contains(name);
        }
    },

    /**
     * A name is present only if a recorded key equals it.
     */
    EXACT {
        @Override
        public boolean matches(String existingKey, String name) {
            return existingKey.equals(name);
        }
    };

    public abstract boolean matches(String existingKey, String name);
}
