package com.hdlsim.proxy;

import com.hdlsim.proxy.action.Force;
import com.hdlsim.proxy.action.Release;
import com.hdlsim.proxy.engine.BufferedWriteScheduler;
import com.hdlsim.proxy.engine.SimulationContext;
import com.hdlsim.proxy.handle.HierarchyArrayObject;
import com.hdlsim.proxy.handle.HierarchyObject;
import com.hdlsim.proxy.handle.IntegerObject;
import com.hdlsim.proxy.handle.ModifiableObject;
import com.hdlsim.proxy.handle.NonHierarchyIndexableObject;
import com.hdlsim.proxy.io.HierarchyJsonWriter;
import com.hdlsim.proxy.io.JsonDesignLoader;
import com.hdlsim.proxy.util.HierarchyExplain;
import com.hdlsim.proxy.wiring.ExternalWriteBridge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Walks through the proxy layer on the bundled {@code designs/soc.json}
 * design: navigation, deferred and immediate writes, overrides, bulk array
 * access and writes handed over from another thread.
 */
public class SimProxyDemo {
    private static final Logger log = LogManager.getLogger(SimProxyDemo.class);
    private static final int RING_BUFFER_SIZE = 1024;

    public static void main(String[] args) throws Exception {
        String resource = args.length > 0 ? args[0] : "designs/soc.json";
        JsonDesignLoader.LoadedDesign design = new JsonDesignLoader().loadResource(resource);

        BufferedWriteScheduler scheduler = new BufferedWriteScheduler();
        SimulationContext ctx = SimulationContext.builder(design.simulator())
                .scheduler(scheduler)
                .build();
        HierarchyObject top = ctx.root(design.roots().get(0));
        log.info("Root: {}", top.describe());

        // 1. Deferred writes land at the end of the time step
        ModifiableObject data = top.child("data");
        data.setValue(200);
        top.setChild("counter", 42);
        log.info("Before flush: data={} pending={}", data.getValue(), scheduler.pendingCount());
        ctx.flushWrites();
        log.info("After flush: data={} ({}) counter={}", data.getValue(), data.getValue().toLong(),
                top.<IntegerObject>child("counter").getValue());

        // 2. Force and release
        data.setImmediateValue(new Force(0x55));
        data.setImmediateValue(17);
        log.info("Forced: data={} (deposit of 17 hidden)", data.getValue().toLong());
        data.setImmediateValue(new Release());
        log.info("Released: data={}", data.getValue().toLong());

        // 3. Bulk array access follows the declared range
        NonHierarchyIndexableObject mem = top.child("mem");
        log.info("mem{} = {}", mem.range(), mem.getValue());
        mem.setImmediateValue(List.of(10, 11, 12, 13, 14, 15, 16, 17));
        log.info("mem[7] = {}", mem.<ModifiableObject>element(7).getValue().toLong());

        // 4. Generate arrays
        HierarchyArrayObject lanes = top.child("lanes");
        for (int i : lanes.indices())
            lanes.<HierarchyObject>element(i).setChild("valid", 1);
        ctx.flushWrites();

        // 5. Writes from another thread go through the bridge
        ExternalWriteBridge bridge = new ExternalWriteBridge(scheduler, RING_BUFFER_SIZE);
        Thread producer = new Thread(() -> {
            for (int i = 0; i < 8; i++)
                bridge.publish(data, i);
        }, "stimulus");
        producer.start();
        producer.join();
        int drained = bridge.drain();
        ctx.flushWrites();
        log.info("Drained {} external writes, data={}", drained, data.getValue().toLong());

        log.info("Hierarchy:\n{}", HierarchyExplain.explainTree(top));
        log.info("Core accumulator:\n{}", HierarchyExplain.explainObject(top.<HierarchyObject>child("u_core").getChild("acc")));
        log.info("Snapshot:\n{}", new HierarchyJsonWriter().write(top));
        log.info("Proxies created: {}", ctx.factory().size());
    }
}
