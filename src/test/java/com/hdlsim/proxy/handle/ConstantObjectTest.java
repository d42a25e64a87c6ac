package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.engine.BufferedWriteScheduler;
import com.hdlsim.proxy.engine.SimulationContext;
import com.hdlsim.proxy.error.ReadOnlyValueException;
import com.hdlsim.proxy.error.UnsupportedAssignmentException;
import com.hdlsim.proxy.sim.InMemorySimulator;
import com.hdlsim.proxy.value.BitVector;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ConstantObjectTest {
    private InMemorySimulator sim;
    private long widthHandle;
    private BufferedWriteScheduler scheduler;
    private HierarchyObject top;

    @Before
    public void setUp() {
        sim = new InMemorySimulator();
        long root = sim.addRoot("top");
        widthHandle = sim.addConstant(root, "WIDTH", HandleType.INTEGER.code(), 8);
        sim.addConstant(root, "RATIO", HandleType.REAL.code(), 0.25);
        sim.addConstant(root, "NAME", HandleType.STRING.code(), "soc");
        sim.addConstant(root, "MODE", HandleType.ENUM.code(), 2);
        sim.addConstant(root, "RESET", HandleType.PARAMETER.code(), "1010");
        sim.addConstant(root, "TEXT", HandleType.PARAMETER.code(), "hello");
        long mask = sim.addRegister(root, "MASK", 4);
        sim.setStoredValue(mask, 0b0110);
        sim.setConstant(mask, true);
        scheduler = new BufferedWriteScheduler();
        top = SimulationContext.builder(sim).scheduler(scheduler).build().root("top");
    }

    @Test
    public void testValuesByKind() {
        assertEquals(8L, top.<ConstantObject>child("WIDTH").getValue());
        assertEquals(0.25, top.<ConstantObject>child("RATIO").getValue());
        assertEquals("soc", top.<ConstantObject>child("NAME").getValue());
        assertEquals(2L, top.<ConstantObject>child("MODE").getValue());
        assertEquals(new BitVector("1010"), top.<ConstantObject>child("RESET").getValue());
        assertEquals(new BitVector("0110"), top.<ConstantObject>child("MASK").getValue());
    }

    @Test
    public void testUnparseableBitsKeepRawText() {
        assertEquals("hello", top.<ConstantObject>child("TEXT").getValue());
    }

    @Test
    public void testValueReadOnce() {
        ConstantObject width = top.child("WIDTH");
        int reads = sim.queryCount("readLong");
        sim.setStoredValue(widthHandle, 16);
        assertEquals(8L, width.getValue());
        assertEquals(8L, width.getValue());
        assertEquals(reads, sim.queryCount("readLong"));
    }

    @Test
    public void testImmutable() {
        ConstantObject width = top.child("WIDTH");
        try {
            width.setValue(1);
            fail("Constants are read-only");
        } catch (ReadOnlyValueException e) {
            assertTrue(e.getMessage().contains("WIDTH"));
        }
        try {
            width.setImmediateValue(1);
            fail("Constants are read-only");
        } catch (ReadOnlyValueException e) {
            assertTrue(e instanceof UnsupportedAssignmentException);
        }
        try {
            top.setChild("WIDTH", 1);
            fail("Constants are read-only");
        } catch (ReadOnlyValueException e) {
            assertTrue(e.getMessage().contains("constant"));
        }
        assertFalse(scheduler.hasPending());
        assertEquals(8L, width.getValue());
    }
}
