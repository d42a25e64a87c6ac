package com.hdlsim.proxy.wiring;

import com.hdlsim.proxy.api.WriteScheduler;
import com.hdlsim.proxy.engine.BufferedWriteScheduler;
import com.hdlsim.proxy.engine.SimulationContext;
import com.hdlsim.proxy.handle.HierarchyObject;
import com.hdlsim.proxy.handle.ModifiableObject;
import com.hdlsim.proxy.handle.NonHierarchyObject;
import com.hdlsim.proxy.sim.InMemorySimulator;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ExternalWriteBridgeTest {
    private BufferedWriteScheduler scheduler;
    private ModifiableObject a;
    private ModifiableObject b;

    @Before
    public void setUp() {
        InMemorySimulator sim = new InMemorySimulator();
        long root = sim.addRoot("top");
        sim.addRegister(root, "a", 16);
        sim.addRegister(root, "b", 16);
        scheduler = new BufferedWriteScheduler();
        HierarchyObject top = SimulationContext.builder(sim).scheduler(scheduler).build().root("top");
        a = top.child("a");
        b = top.child("b");
    }

    @Test
    public void testDrainMovesWritesToScheduler() {
        ExternalWriteBridge bridge = new ExternalWriteBridge(scheduler, 64);
        bridge.publish(a, 1);
        bridge.publish(b, 2);
        assertFalse(scheduler.hasPending());

        assertEquals(2, bridge.drain());
        assertEquals(2, scheduler.pendingCount());
        assertEquals(0, bridge.drain());

        scheduler.flush();
        assertEquals(1L, a.getValue().toLong());
        assertEquals(2L, b.getValue().toLong());
        assertEquals(2, bridge.drainedCount());
        assertEquals(64, bridge.remainingCapacity());
    }

    @Test
    public void testWritesFromProducerThreads() throws Exception {
        ExternalWriteBridge bridge = new ExternalWriteBridge(scheduler, 1024);
        Thread t1 = new Thread(() -> {
            for (int i = 0; i < 100; i++)
                bridge.publish(a, i);
        });
        Thread t2 = new Thread(() -> {
            for (int i = 0; i < 100; i++)
                bridge.publish(b, 1000 + i);
        });
        t1.start();
        t2.start();
        t1.join();
        t2.join();

        assertEquals(200, bridge.drain());
        scheduler.flush();
        // Per-producer order is preserved, so each target ends on its last value.
        assertEquals(99L, a.getValue().toLong());
        assertEquals(1099L, b.getValue().toLong());
    }

    @Test
    public void testTryPublishWhenFull() {
        ExternalWriteBridge bridge = new ExternalWriteBridge(scheduler, 2);
        assertTrue(bridge.tryPublish(a, 1));
        assertTrue(bridge.tryPublish(a, 2));
        assertFalse(bridge.tryPublish(a, 3));
        assertEquals(2, bridge.drain());
        assertTrue(bridge.tryPublish(a, 4));
    }

    @Test
    public void testRejectedWriteIsSkipped() {
        List<Object> accepted = new ArrayList<>();
        WriteScheduler picky = (NonHierarchyObject target, Object value) -> {
            if (value == null)
                throw new IllegalArgumentException("null value");
            accepted.add(value);
        };
        ExternalWriteBridge bridge = new ExternalWriteBridge(picky, 8);
        bridge.publish(a, 1);
        bridge.publish(a, null);
        bridge.publish(b, 3);

        assertEquals(2, bridge.drain());
        assertEquals(List.of(1, 3), accepted);
        assertEquals(1, bridge.failedCount());
    }
}
