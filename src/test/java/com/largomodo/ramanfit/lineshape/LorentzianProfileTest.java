package com.largomodo.ramanfit.lineshape;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LorentzianProfileTest {

    @Test
    void testHalfMaximumAtHalfWidth() {
        assertEquals(1.0, LorentzianProfile.value(0, 20));
        assertEquals(0.5, LorentzianProfile.value(20, 20), 1e-12);
        assertEquals(0.5, LorentzianProfile.value(-20, 20), 1e-12);
    }

    @Test
    void testArea() {
        assertEquals(Math.PI * 300, LorentzianProfile.area(10, 30), 1e-9);
    }
}
