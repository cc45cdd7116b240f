package com.largomodo.ramanfit.core.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ReportedValueTest {

    @ParameterizedTest
    @CsvSource({
            "12, 12",
            "-3, -3",
            "0.5, 0.50000",
            "641.123456, 641.12346",
            "-0.000001, -0.00000"
    })
    void testValueRendering(double value, String expected) {
        assertEquals(expected, ReportedValue.of(value).render());
    }

    @Test
    void testNonFiniteBecomesNotApplicable() {
        assertEquals(ReportedValue.notApplicable(), ReportedValue.of(Double.NaN));
        assertEquals(ReportedValue.notApplicable(), ReportedValue.of(Double.POSITIVE_INFINITY));
        assertEquals("na", ReportedValue.of(Double.NEGATIVE_INFINITY).render());
    }

    @Test
    void testRatioWithZeroDenominatorIsNotApplicable() {
        assertFalse(ReportedValue.ratio(1, 0).isPresent());
        assertFalse(ReportedValue.ratio(0, 0).isPresent());
        assertEquals(0.25, ReportedValue.ratio(1, 4).asDouble());
    }

    @Test
    void testExceededCapRendersWithPrefix() {
        ReportedValue cap = ReportedValue.exceededCap(500);
        assertEquals(">500", cap.render());
        assertFalse(cap.isPresent());
        assertThrows(IllegalStateException.class, cap::asDouble);
    }

    @Test
    void testMapSkipsAbsentValues() {
        assertEquals(ReportedValue.of(10), ReportedValue.of(5).map(v -> v * 2));
        assertSame(ReportedValue.notApplicable(), ReportedValue.notApplicable().map(v -> v * 2));
        assertEquals(ReportedValue.exceededCap(3), ReportedValue.exceededCap(3).map(v -> v * 2));
    }

    @Test
    void testMapToNonFiniteBecomesNotApplicable() {
        assertFalse(ReportedValue.of(0).map(v -> 1 / v).isPresent());
    }

    @Test
    void testValueRejectsNonFinite() {
        assertThrows(IllegalArgumentException.class, () -> new ReportedValue.Value(Double.NaN));
    }
}
