package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.action.Deposit;
import com.hdlsim.proxy.action.Force;
import com.hdlsim.proxy.action.Freeze;
import com.hdlsim.proxy.action.Release;
import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.api.Range;
import com.hdlsim.proxy.engine.BufferedWriteScheduler;
import com.hdlsim.proxy.engine.SimulationContext;
import com.hdlsim.proxy.error.IndexOutOfRangeException;
import com.hdlsim.proxy.error.UnsupportedAssignmentException;
import com.hdlsim.proxy.sim.InMemorySimulator;
import com.hdlsim.proxy.value.BitVector;

import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ModifiableObjectTest {
    private InMemorySimulator sim;
    private long byteReg;
    private BufferedWriteScheduler scheduler;
    private ModifiableObject data;
    private ModifiableObject wide;
    private long vhdlSig;
    private long vec;
    private HierarchyObject top;

    @Before
    public void setUp() {
        sim = new InMemorySimulator();
        long root = sim.addRoot("top");
        byteReg = sim.addRegister(root, "data", 8);
        sim.addRegister(root, "wide", 64);
        vhdlSig = sim.addNet(root, "sig", 4);
        vec = sim.addRegister(root, "vec", 4);
        sim.setRange(vec, new Range(3, 0));
        for (int i = 0; i < 4; i++)
            sim.addElement(vec, i, "vec(" + i + ")", HandleType.REGISTER.code());
        scheduler = new BufferedWriteScheduler();
        top = SimulationContext.builder(sim).scheduler(scheduler).build().root("top");
        data = top.child("data");
        wide = top.child("wide");
        sim.resetCounters();
    }

    @Test
    public void testRoundTripThroughScheduler() {
        data.setValue(200);
        scheduler.flush();
        BitVector v = data.getValue();
        assertEquals(8, v.width());
        assertEquals(200L, v.toLong());
        assertEquals("11001000", v.binStr());
    }

    @Test
    public void testImmediateRoundTrip() {
        data.setImmediateValue(200);
        BitVector v = data.getValue();
        assertEquals(8, v.width());
        assertEquals(200L, v.toLong());
    }

    @Test
    public void testReadUninitialisedStdLogic() {
        sim.setStoredValue(vhdlSig, "UUUU");
        ModifiableObject sig = top.child("sig");
        BitVector v = sig.getValue();
        assertEquals("UUUU", v.binStr());
        assertEquals(4, v.width());
        assertFalse(v.isResolvable());

        sig.setImmediateValue(new Freeze());
        assertTrue(sim.isForced(vhdlSig));
        assertEquals("UUUU", sig.getValue().binStr());

        sim.setStoredValue(vhdlSig, "HL0-");
        sig.setImmediateValue(new Release());
        assertEquals(8L, sig.getValue().toLong());
    }

    @Test
    public void testRangedRegisterElements() {
        sim.setStoredValue(sim.childByIndex(vec, 3), "1");
        sim.setStoredValue(vec, "1010");
        ModifiableObject v = top.child("vec");

        assertEquals(new Range(3, 0), v.range());
        assertEquals(List.of(3, 2, 1, 0), v.indices());
        ModifiableObject msb = v.element(3);
        assertEquals("top.vec[3]", msb.path());
        assertEquals("1", msb.getValue().binStr());
        assertSame(msb, v.get(3));

        List<String> paths = new ArrayList<>();
        for (SimHandleBase bit : v)
            paths.add(bit.path());
        assertEquals(List.of("top.vec[3]", "top.vec[2]", "top.vec[1]", "top.vec[0]"), paths);

        // the whole value is still a single vector
        assertEquals(4, v.length());
        assertEquals(10L, v.getValue().toLong());
        v.setImmediateValue(5);
        assertEquals("0101", v.getValue().binStr());
    }

    @Test
    public void testUnrangedSignalHasNoElements() {
        assertNull(data.range());
        assertTrue(data.indices().isEmpty());
        assertFalse(data.iterator().hasNext());
        try {
            data.get(0);
            fail("data has no declared range");
        } catch (IndexOutOfRangeException e) {
            assertTrue(e.getMessage().contains("not indexable"));
        }
    }

    @Test
    public void testSmallIntegersUseIntegerPath() {
        data.setImmediateValue(17);
        assertEquals(1, sim.queryCount("writeLong"));
        assertEquals(0, sim.queryCount("writeBinStr"));
        data.setImmediateValue((byte) -1);
        assertEquals("11111111", data.getValue().binStr());
    }

    @Test
    public void testWideTargetsUseBitString() {
        wide.setImmediateValue(5);
        assertEquals(0, sim.queryCount("writeLong"));
        assertEquals(1, sim.queryCount("writeBinStr"));
        assertEquals(5L, wide.getValue().toLong());

        wide.setImmediateValue(-1L);
        assertEquals(BigInteger.valueOf(-1), wide.getValue().toSignedBigInteger());
    }

    @Test
    public void testLargeIntegerOnNarrowTarget() {
        try {
            data.setImmediateValue(0x1_0000_0000L);
            fail("Does not fit 8 bits");
        } catch (UnsupportedAssignmentException e) {
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
        assertEquals("xxxxxxxx", data.getValue().binStr());
    }

    @Test
    public void testBigInteger() {
        BigInteger value = BigInteger.ONE.shiftLeft(63);
        wide.setImmediateValue(value);
        assertEquals(value, wide.getValue().toBigInteger());
        try {
            wide.setImmediateValue(BigInteger.ONE.shiftLeft(64));
            fail("65 bits do not fit 64");
        } catch (UnsupportedAssignmentException e) {
            assertTrue(e.getMessage().contains("width 64"));
        }
    }

    @Test
    public void testBitVector() {
        data.setImmediateValue(new BitVector("1010xxzz"));
        assertEquals("1010xxzz", data.getValue().binStr());
    }

    @Test
    public void testPackedValuesElementZeroInLowBits() {
        data.setImmediateValue(Map.of("values", List.of(1, 2), "bits", 4));
        assertEquals("00100001", data.getValue().binStr());
    }

    @Test
    public void testPackedWidthMismatch() {
        try {
            data.setImmediateValue(Map.of("values", List.of(1, 2, 3), "bits", 4));
            fail("12 bits packed into 8");
        } catch (UnsupportedAssignmentException e) {
            assertTrue(e.getMessage().contains("target is only 8 bits long"));
        }
    }

    @Test
    public void testPackedElementOutOfRange() {
        try {
            data.setImmediateValue(Map.of("values", List.of(16, 0), "bits", 4));
            fail("16 does not fit 4 bits");
        } catch (UnsupportedAssignmentException e) {
            assertTrue(e.getMessage().contains("java.lang.Integer"));
        }
    }

    @Test
    public void testUnsupportedTypes() {
        for (Object bad : new Object[] { "12", 1.5, null, List.of(1) }) {
            try {
                data.setImmediateValue(bad);
                fail("Should reject " + bad);
            } catch (UnsupportedAssignmentException e) {
                assertTrue(e.getMessage().startsWith("Unable to set simulator value with type"));
            }
        }
    }

    @Test
    public void testForceHidesDepositsUntilRelease() {
        data.setImmediateValue(3);
        data.setImmediateValue(new Force(9));
        assertTrue(sim.isForced(byteReg));
        assertEquals(9L, data.getValue().toLong());

        data.setImmediateValue(5);
        assertEquals(9L, data.getValue().toLong());

        data.setImmediateValue(new Release());
        assertFalse(sim.isForced(byteReg));
        assertEquals(5L, data.getValue().toLong());
    }

    @Test
    public void testDepositAction() {
        data.setImmediateValue(new Deposit(42));
        assertEquals(42L, data.getValue().toLong());
        assertFalse(sim.isForced(byteReg));
    }

    @Test
    public void testDeferredForceAndRelease() {
        data.setImmediateValue(1);
        data.setValue(new Force(0xaa));
        assertFalse(sim.isForced(byteReg));
        scheduler.flush();
        assertEquals(0xaaL, data.getValue().toLong());
        data.setValue(new Release());
        scheduler.flush();
        assertEquals(1L, data.getValue().toLong());
    }

    @Test
    public void testDeferredFreezeCapturesValueAtFlush() {
        data.setImmediateValue(1);
        data.setValue(new Freeze());
        sim.setStoredValue(byteReg, 7);
        scheduler.flush();
        assertTrue(sim.isForced(byteReg));
        assertEquals(7L, data.getValue().toLong());

        data.setImmediateValue(99);
        assertEquals(7L, data.getValue().toLong());
        data.setImmediateValue(new Release());
        assertEquals(99L, data.getValue().toLong());
    }

    @Test
    public void testReadsAreNotCached() {
        data.setImmediateValue(1);
        BitVector before = data.getValue();
        sim.setStoredValue(byteReg, 2);
        assertEquals(1L, before.toLong());
        assertEquals(2L, data.getValue().toLong());
    }
}
