package com.hdlsim.proxy.engine;

import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.api.WriteScheduler;
import com.hdlsim.proxy.error.NoSuchChildException;
import com.hdlsim.proxy.handle.HierarchyArrayObject;
import com.hdlsim.proxy.handle.HierarchyObject;
import com.hdlsim.proxy.handle.ModifiableObject;
import com.hdlsim.proxy.handle.NonHierarchyObject;
import com.hdlsim.proxy.sim.InMemorySimulator;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.Assert.*;

public class SimulationContextTest {
    private InMemorySimulator sim;
    private long root;

    @Before
    public void setUp() {
        sim = new InMemorySimulator();
        root = sim.addRoot("top");
        sim.addRoot("tb");
    }

    @Test
    public void testRootLookup() {
        SimulationContext ctx = SimulationContext.builder(sim).build();
        HierarchyObject top = ctx.root("top");
        assertEquals("top", top.path());
        assertSame(top, ctx.root("top"));
        assertSame(top, ctx.resolve(root));
        assertEquals("tb", ctx.root("tb").name());
        assertTrue(ctx.scheduler() instanceof BufferedWriteScheduler);
    }

    @Test
    public void testMissingRoot() {
        SimulationContext ctx = SimulationContext.builder(sim).build();
        try {
            ctx.root("nope");
            fail("No root named nope");
        } catch (NoSuchChildException e) {
            assertEquals("nope", e.childName());
        }
    }

    @Test
    public void testCustomScheduler() {
        List<Object> seen = new ArrayList<>();
        WriteScheduler recording = (NonHierarchyObject target, Object value) -> seen.add(target.path() + "=" + value);
        sim.addRegister(root, "r", 4);
        SimulationContext ctx = SimulationContext.builder(sim).scheduler(recording).build();

        ModifiableObject r = ctx.root("top").child("r");
        r.setValue(3);
        assertEquals(List.of("top.r=3"), seen);
        try {
            ctx.flushWrites();
            fail("Custom schedulers flush themselves");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("flushes on its own"));
        }
    }

    @Test
    public void testExtraFactoryAndIndexPattern() {
        long mem = sim.add(root, "mem", HandleType.MEMORY);
        sim.setWidth(mem, 8);
        long gen = sim.addGenArray(root, "blk", "%s_g%d", 0, 1);

        SimulationContext ctx = SimulationContext.builder(sim)
                .proxyFactory(HandleType.MEMORY, ModifiableObject::new)
                .indexPattern((arrayName, childName) -> childName.startsWith(arrayName + "_g")
                        ? OptionalInt.of(Integer.parseInt(childName.substring(arrayName.length() + 2)))
                        : OptionalInt.empty())
                .build();

        HierarchyObject top = ctx.root("top");
        assertTrue(top.getChild("mem") instanceof ModifiableObject);
        HierarchyArrayObject blk = top.child("blk");
        assertEquals(2, blk.length());
        assertEquals(List.of(0, 1), blk.indices());
        assertSame(ctx.resolve(gen), blk);
    }

    @Test
    public void testFlushThroughContext() {
        sim.addRegister(root, "r", 4);
        SimulationContext ctx = SimulationContext.builder(sim).build();
        ModifiableObject r = ctx.root("top").child("r");
        r.setValue(9);
        assertEquals(1, ctx.flushWrites());
        assertEquals(9L, r.getValue().toLong());
    }
}
