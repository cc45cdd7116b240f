package com.largomodo.ramanfit.ledger;

import com.largomodo.ramanfit.core.domain.SampleRecord;

import java.io.IOException;
import java.util.List;

/**
 * Append-only store of processed samples, keyed by sample name.
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>Each name is recorded at most once; appending a name the ledger already
 *       {@link #contains(String) contains} leaves it unchanged</li>
 *   <li>Rows keep their append order</li>
 *   <li>{@link #reset(ResetConfirmation)} is the only way to remove rows and requires
 *       confirmation</li>
 *   <li>Appends are serialised; concurrent callers cannot interleave rows</li>
 * </ul>
 */
public interface ResultLedger {

    String RESET_PROMPT = "Really delete all records? (y/n)";

    /**
     * True if a sample with this name has already been recorded, under the ledger's
     * {@link LedgerKeyMatching}.
     */
    boolean contains(String name);

    /**
     * Records a sample unless its name is already present.
     *
     * @return true if a row was added
     * @throws IOException if the row cannot be persisted
     */
    boolean append(SampleRecord record) throws IOException;

    /**
     * Deletes every row after the operator confirms, keeping the header.
     *
     * @return true if the ledger was cleared
     * @throws IOException if the confirmation cannot be read or the ledger cannot be rewritten
     */
    boolean reset(ResetConfirmation confirmation) throws IOException;

    /**
     * Recorded sample names in append order.
     */
    List<String> names();

    default int size() {
        return names().size();
    }
}
