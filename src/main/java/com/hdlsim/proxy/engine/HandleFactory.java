package com.hdlsim.proxy.engine;

import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.api.WriteScheduler;
import com.hdlsim.proxy.error.UnknownHandleTypeException;
import com.hdlsim.proxy.handle.ConstantObject;
import com.hdlsim.proxy.handle.EnumObject;
import com.hdlsim.proxy.handle.HierarchyArrayObject;
import com.hdlsim.proxy.handle.HierarchyObject;
import com.hdlsim.proxy.handle.IndexNamePattern;
import com.hdlsim.proxy.handle.IndexNamePatterns;
import com.hdlsim.proxy.handle.IntegerObject;
import com.hdlsim.proxy.handle.ModifiableObject;
import com.hdlsim.proxy.handle.NonHierarchyIndexableObject;
import com.hdlsim.proxy.handle.RealObject;
import com.hdlsim.proxy.handle.SimHandleBase;
import com.hdlsim.proxy.handle.StringObject;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns native handles into proxies and guarantees one proxy per handle.
 *
 * Identity:
 * The same native object can be reached along several routes: by name from
 * its parent scope, through discovery, or as the driver or load of another
 * signal. Every route ends here, and the first resolution of a handle decides
 * its proxy for the rest of the process. Later resolutions return that instance
 * and ignore the path they were given.
 *
 * Type Dispatch:
 * Constants of any non-structural kind become {@link ConstantObject}s.
 * Everything else is built by the factory registered for its {@link HandleType};
 * a tag with no factory fails with {@link UnknownHandleTypeException}.
 */
public final class HandleFactory {
    private static final Logger log = LogManager.getLogger(HandleFactory.class);

    /** Creates the proxy for one handle of a given type. */
    @FunctionalInterface
    public interface ProxyFactory {
        SimHandleBase create(HandleFactory factory, long handle, String path);
    }

    private final NativeSimulator simulator;
    private final WriteScheduler scheduler;
    private final Map<Long, SimHandleBase> handleToObject = new HashMap<>();
    private final Map<HandleType, ProxyFactory> registry = new EnumMap<>(HandleType.class);
    private final List<IndexNamePattern> indexPatterns = new ArrayList<>();

    public HandleFactory(NativeSimulator simulator, WriteScheduler scheduler) {
        this.simulator = simulator;
        this.scheduler = scheduler;
        registerBuiltIns();
        indexPatterns.addAll(List.of(IndexNamePatterns.values()));
    }

    public NativeSimulator simulator() {
        return simulator;
    }

    public WriteScheduler scheduler() {
        return scheduler;
    }

    /**
     * Maps a native type to a proxy factory, replacing any existing mapping.
     * Only affects handles resolved afterwards.
     */
    public HandleFactory registerFactory(HandleType type, ProxyFactory factory) {
        registry.put(type, factory);
        return this;
    }

    /** Adds a generate-array naming scheme, tried after the built-in ones. */
    public HandleFactory registerIndexPattern(IndexNamePattern pattern) {
        indexPatterns.add(pattern);
        return this;
    }

    public List<IndexNamePattern> indexPatterns() {
        return Collections.unmodifiableList(indexPatterns);
    }

    /**
     * Returns the proxy for a handle, creating it on first use.
     *
     * @param handle native handle
     * @param path   path used if the proxy has to be created; null for a root
     * @throws UnknownHandleTypeException if the handle's type has no mapping
     */
    public SimHandleBase resolve(long handle, String path) {
        SimHandleBase existing = handleToObject.get(handle);
        if (existing != null)
            return existing;

        int code = simulator.typeOf(handle);
        HandleType type = HandleType.fromCode(code);

        SimHandleBase obj;
        if (simulator.isConst(handle) && (type == null || !type.isStructural())) {
            obj = new ConstantObject(this, handle, path, code);
        } else {
            ProxyFactory factory = type == null ? null : registry.get(type);
            if (factory == null)
                throw new UnknownHandleTypeException(code, path);
            obj = factory.create(this, handle, path);
        }

        handleToObject.put(handle, obj);
        log.debug("Resolved {} as {}", obj.path(), obj.getClass().getSimpleName());
        return obj;
    }

    /** The proxy already created for a handle, or null. */
    public SimHandleBase cached(long handle) {
        return handleToObject.get(handle);
    }

    /** Number of proxies created so far. */
    public int size() {
        return handleToObject.size();
    }

    // ── Built-in Factories ──────────────────────────────────────────

    private void registerBuiltIns() {
        registerFactory(HandleType.MODULE, HierarchyObject::new);
        registerFactory(HandleType.STRUCTURE, HierarchyObject::new);
        registerFactory(HandleType.REGISTER, ModifiableObject::new);
        registerFactory(HandleType.NET, ModifiableObject::new);
        registerFactory(HandleType.NET_ARRAY, NonHierarchyIndexableObject::new);
        registerFactory(HandleType.REAL, RealObject::new);
        registerFactory(HandleType.INTEGER, IntegerObject::new);
        registerFactory(HandleType.ENUM, EnumObject::new);
        registerFactory(HandleType.STRING, StringObject::new);
        registerFactory(HandleType.GEN_ARRAY, HierarchyArrayObject::new);
    }
}
