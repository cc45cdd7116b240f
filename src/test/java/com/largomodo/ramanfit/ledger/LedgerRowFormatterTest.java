package com.largomodo.ramanfit.ledger;

import com.largomodo.ramanfit.core.domain.SampleRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerRowFormatterTest {

    @Test
    void testHeaderHasEveryColumn() {
        String[] columns = LedgerRowFormatter.header().split(" ");

        assertEquals(LedgerRowFormatter.COLUMN_COUNT, columns.length);
        assertEquals("name", columns[0]);
        assertEquals("iterations", columns[columns.length - 1]);
    }

    @Test
    void testNoisyRowIsFullWidth() {
        String row = LedgerRowFormatter.format(SampleRecord.noisy("quartz7", 1));
        String[] columns = row.split(" ");

        assertEquals(LedgerRowFormatter.COLUMN_COUNT, columns.length);
        assertEquals("quartz7", columns[0]);
        assertEquals("na", columns[1]);
        assertEquals("Noisy", columns[32]);
        assertEquals("1", columns[33]);
        assertEquals("na", columns[34]);
    }

    @Test
    void testMetadataRecordsVersionAndThreshold() {
        String metadata = LedgerRowFormatter.metadata("1.1.5", 2);

        assertTrue(metadata.startsWith("Version = 1.1.5."));
        assertTrue(metadata.contains("Noise threshold = 2"));
        assertTrue(LedgerRowFormatter.isPreamble(metadata));
        assertTrue(LedgerRowFormatter.isPreamble(LedgerRowFormatter.header()));
    }

    @Test
    void testRowKeyedNameIsNotPreamble() {
        String row = LedgerRowFormatter.format(SampleRecord.noisy("name", 0));

        assertFalse(LedgerRowFormatter.isPreamble(row));
        assertFalse(LedgerRowFormatter.isPreamble(LedgerRowFormatter.format(SampleRecord.noisy("Version", 0))));
    }

    @Test
    void testKeyOfRow() {
        assertEquals("s1", LedgerRowFormatter.keyOf("s1 na na"));
        assertEquals("s2", LedgerRowFormatter.keyOf("  s2  "));
        assertNull(LedgerRowFormatter.keyOf("   "));
    }
}
