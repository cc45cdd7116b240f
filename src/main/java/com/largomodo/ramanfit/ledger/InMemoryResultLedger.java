package com.largomodo.ramanfit.ledger;

import com.largomodo.ramanfit.core.domain.SampleRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger held in memory, for library callers and tests.
 */
public class InMemoryResultLedger implements ResultLedger {

    private final LedgerKeyMatching matching;
    private final List<SampleRecord> records = new ArrayList<>();

    public InMemoryResultLedger(LedgerKeyMatching matching) {
        if (matching == null) {
            throw new IllegalArgumentException("matching must not be null");
        }
        this.matching = matching;
    }

    @Override
    public synchronized boolean contains(String name) {
        return records.stream().anyMatch(r -> matching.matches(r.name(), name));
    }

    @Override
    public synchronized boolean append(SampleRecord record) {
        if (contains(record.name())) {
            return false;
        }
        records.add(record);
        return true;
    }

    @Override
    public synchronized boolean reset(ResetConfirmation confirmation) throws IOException {
        if (!confirmation.confirm(RESET_PROMPT)) {
            return false;
        }
        records.clear();
        return true;
    }

    @Override
    public synchronized List<String> names() {
        return records.stream().map(SampleRecord::name).toList();
    }

    /**
     * Recorded samples in append order (read-only snapshot).
     */
    public synchronized List<SampleRecord> records() {
        return List.copyOf(records);
    }
}
