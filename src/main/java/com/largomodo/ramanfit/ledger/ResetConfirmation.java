package com.largomodo.ramanfit.ledger;

import java.io.IOException;

/**
 * Asks the operator to confirm a destructive ledger reset.
 */
@FunctionalInterface
public interface ResetConfirmation {

    /**
     * @param prompt question to show the operator
     * @return true only on an explicit yes
     * @throws IOException if the answer cannot be read
     */
    boolean confirm(String prompt) throws IOException;
}
