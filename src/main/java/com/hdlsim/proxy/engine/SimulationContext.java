package com.hdlsim.proxy.engine;

import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.api.WriteScheduler;
import com.hdlsim.proxy.error.NoSuchChildException;
import com.hdlsim.proxy.handle.HierarchyObject;
import com.hdlsim.proxy.handle.IndexNamePattern;
import com.hdlsim.proxy.handle.SimHandleBase;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The entry point for test code: a simulator binding plus the proxy layer on
 * top of it.
 *
 * Responsibilities:
 * 1. Wiring: connects the {@link NativeSimulator}, the {@link WriteScheduler}
 * and the {@link HandleFactory} so every proxy shares one identity cache and
 * one write queue.
 * 2. Root Lookup: turns the name of a top-level instance into its scope.
 * 3. Configuration: extra proxy factories and index naming schemes are
 * registered through the {@link Builder} before the first handle is resolved.
 *
 * Thread Safety:
 * Not thread-safe. All access is expected from the simulator callback thread;
 * other threads hand writes over through
 * {@link com.hdlsim.proxy.wiring.ExternalWriteBridge}.
 */
public final class SimulationContext {
    private static final Logger log = LogManager.getLogger(SimulationContext.class);

    private final NativeSimulator simulator;
    private final WriteScheduler scheduler;
    private final HandleFactory factory;

    private SimulationContext(Builder builder) {
        this.simulator = builder.simulator;
        this.scheduler = builder.scheduler != null ? builder.scheduler : new BufferedWriteScheduler();
        this.factory = new HandleFactory(simulator, scheduler);
        builder.factories.forEach(factory::registerFactory);
        builder.indexPatterns.forEach(factory::registerIndexPattern);
        log.info("Simulation context ready (scheduler={}, extra factories={}, extra index patterns={})",
                scheduler.getClass().getSimpleName(), builder.factories.size(), builder.indexPatterns.size());
    }

    public static Builder builder(NativeSimulator simulator) {
        return new Builder(simulator);
    }

    public NativeSimulator simulator() {
        return simulator;
    }

    public WriteScheduler scheduler() {
        return scheduler;
    }

    public HandleFactory factory() {
        return factory;
    }

    /**
     * The scope of a top-level instance.
     *
     * @throws NoSuchChildException if the simulator has no root of that name
     */
    public HierarchyObject root(String name) {
        long handle = simulator.rootHandle(name);
        if (handle == NativeSimulator.NULL_HANDLE)
            throw new NoSuchChildException("<root>", name);
        SimHandleBase root = factory.resolve(handle, null);
        if (!(root instanceof HierarchyObject scope))
            throw new IllegalStateException("Root " + name + " is not a scope: " + root.describe());
        return scope;
    }

    /** Proxy for a handle obtained elsewhere, for example from a callback. */
    public SimHandleBase resolve(long handle) {
        return factory.resolve(handle, null);
    }

    /**
     * Applies every buffered write if the scheduler is the built-in
     * {@link BufferedWriteScheduler}. Simulator integrations call this at the
     * end of each time step.
     *
     * @return the number of writes applied
     * @throws IllegalStateException if a custom scheduler is configured
     */
    public int flushWrites() {
        if (scheduler instanceof BufferedWriteScheduler buffered)
            return buffered.flush();
        throw new IllegalStateException("Scheduler " + scheduler.getClass().getName() + " flushes on its own");
    }

    public static final class Builder {
        private final NativeSimulator simulator;
        private WriteScheduler scheduler;
        private final Map<HandleType, HandleFactory.ProxyFactory> factories = new EnumMap<>(HandleType.class);
        private final List<IndexNamePattern> indexPatterns = new ArrayList<>();

        private Builder(NativeSimulator simulator) {
            this.simulator = Objects.requireNonNull(simulator, "simulator");
        }

        /** Scheduler for deferred writes; defaults to a {@link BufferedWriteScheduler}. */
        public Builder scheduler(WriteScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder proxyFactory(HandleType type, HandleFactory.ProxyFactory factory) {
            factories.put(type, factory);
            return this;
        }

        public Builder indexPattern(IndexNamePattern pattern) {
            indexPatterns.add(pattern);
            return this;
        }

        public SimulationContext build() {
            return new SimulationContext(this);
        }
    }
}
