package com.loomcom.logsim.devices;

import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

import java.util.Arrays;

/**
 * Pin layout and logic of the individual device kinds.
 */
public class DeviceTest extends TestCase {

    public DeviceTest(String testName) {
        super(testName);
    }

    public static Test suite() {
        return new TestSuite(DeviceTest.class);
    }

    private static boolean[] levels(int... bits) {
        boolean[] levels = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) {
            levels[i] = bits[i] != 0;
        }
        return levels;
    }

    public void testGatePins() {
        Gate gate = new Gate("G", DeviceKind.NAND, 3);

        assertEquals(Arrays.asList("I1", "I2", "I3"), gate.getInputPins());
        assertEquals(2, gate.inputIndex("I3"));
        assertEquals(-1, gate.inputIndex("I4"));
        assertEquals(0, gate.outputIndex(null));
        assertEquals(-1, gate.outputIndex("Q"));
        assertEquals("G", gate.signalName(0));
        assertEquals(Integer.valueOf(3), gate.getQualifier());
    }

    public void testGateTruthTables() {
        Gate and = new Gate("A", DeviceKind.AND, 2);
        Gate or = new Gate("O", DeviceKind.OR, 2);
        Gate nand = new Gate("NA", DeviceKind.NAND, 2);
        Gate nor = new Gate("NO", DeviceKind.NOR, 2);
        XorGate xor = new XorGate("X");

        int[][] rows = {{0, 0}, {0, 1}, {1, 0}, {1, 1}};
        boolean[] andOut = {false, false, false, true};
        boolean[] orOut = {false, true, true, true};
        boolean[] xorOut = {false, true, true, false};
        for (int i = 0; i < rows.length; i++) {
            boolean[] in = levels(rows[i]);
            assertEquals(andOut[i], and.evaluate(in));
            assertEquals(orOut[i], or.evaluate(in));
            assertEquals(!andOut[i], nand.evaluate(in));
            assertEquals(!orOut[i], nor.evaluate(in));
            assertEquals(xorOut[i], xor.evaluate(in));
        }
    }

    public void testSingleInputGates() {
        assertTrue(new Gate("A", DeviceKind.AND, 1).evaluate(levels(1)));
        assertFalse(new Gate("N", DeviceKind.NAND, 1).evaluate(levels(1)));
        assertTrue(new Gate("N", DeviceKind.NOR, 1).evaluate(levels(0)));
    }

    public void testGateRejectsFixedArityKind() {
        try {
            new Gate("X", DeviceKind.XOR, 2);
            fail("XOR is not a variable-arity gate");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("XOR"));
        }
    }

    public void testInputNumber() {
        assertEquals(1, Gate.inputNumber("I1"));
        assertEquals(16, Gate.inputNumber("I16"));
        assertEquals(-1, Gate.inputNumber("I0"));
        assertEquals(-1, Gate.inputNumber("I01"));
        assertEquals(-1, Gate.inputNumber("IX"));
        assertEquals(-1, Gate.inputNumber("DATA"));
        assertEquals(-1, Gate.inputNumber(null));
        assertEquals(Integer.MAX_VALUE, Gate.inputNumber("I99999999999"));
    }

    public void testDTypePins() {
        DType ff = new DType("FF");

        assertEquals(4, ff.getInputCount());
        assertEquals(DType.CLEAR_INPUT, ff.inputIndex("CLEAR"));
        assertEquals(DType.QBAR_OUTPUT, ff.outputIndex("QBAR"));
        assertEquals(-1, ff.outputIndex(null));
        assertEquals("FF.Q", ff.signalName(DType.Q_OUTPUT));
        assertNull(ff.getQualifier());
    }

    public void testDTypeNextState() {
        // set wins over clear, clear wins over the clock
        assertTrue(DType.nextState(false, false, true, true, true));
        assertFalse(DType.nextState(true, true, true, false, true));
        assertTrue(DType.nextState(false, true, true, false, false));
        assertFalse(DType.nextState(true, false, true, false, false));
        assertTrue(DType.nextState(true, false, false, false, false));
        assertFalse(DType.nextState(false, true, false, false, false));
    }

    public void testSourcesHaveNoInputs() {
        Switch sw = new Switch("SW", true);
        Clock clock = new Clock("CK", 4);

        assertEquals(0, sw.getInputCount());
        assertEquals(0, clock.getInputCount());
        assertEquals(Integer.valueOf(1), sw.getQualifier());
        assertEquals(4, clock.getHalfPeriod());
    }

    public void testClockRejectsZeroHalfPeriod() {
        try {
            new Clock("CK", 0);
            fail("half period 0 accepted");
        } catch (IllegalArgumentException expected) {
            // expected
        }
    }

    public void testQualifierRules() {
        assertEquals(DeviceKind.QualifierProblem.NONE, DeviceKind.SWITCH.checkQualifier(1, 16));
        assertEquals(DeviceKind.QualifierProblem.OUT_OF_RANGE, DeviceKind.SWITCH.checkQualifier(2, 16));
        assertEquals(DeviceKind.QualifierProblem.MISSING, DeviceKind.CLOCK.checkQualifier(null, 16));
        assertEquals(DeviceKind.QualifierProblem.OUT_OF_RANGE, DeviceKind.CLOCK.checkQualifier(0, 16));
        assertEquals(DeviceKind.QualifierProblem.NONE, DeviceKind.AND.checkQualifier(16, 16));
        assertEquals(DeviceKind.QualifierProblem.OUT_OF_RANGE, DeviceKind.AND.checkQualifier(17, 16));
        assertEquals(DeviceKind.QualifierProblem.OUT_OF_RANGE, DeviceKind.NOR.checkQualifier(0, 16));
        assertEquals(DeviceKind.QualifierProblem.NOT_ALLOWED, DeviceKind.XOR.checkQualifier(2, 16));
        assertEquals(DeviceKind.QualifierProblem.NONE, DeviceKind.DTYPE.checkQualifier(null, 16));
    }

    public void testKindLookupIsCaseSensitive() {
        assertEquals(DeviceKind.DTYPE, DeviceKind.fromName("DTYPE"));
        assertNull(DeviceKind.fromName("dtype"));
        assertNull(DeviceKind.fromName("LATCH"));
    }

    public void testEquality() {
        assertEquals(new Gate("G", DeviceKind.OR, 2), new Gate("G", DeviceKind.OR, 2));
        assertFalse(new Gate("G", DeviceKind.OR, 2).equals(new Gate("G", DeviceKind.OR, 3)));
        assertFalse(new Switch("S", false).equals(new Switch("S", true)));
    }
}
