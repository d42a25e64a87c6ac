package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.api.SimObject;
import com.hdlsim.proxy.engine.HandleFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for all simulation object proxies.
 *
 * Holds the native handle plus the metadata that never changes after
 * elaboration (name, type, definition). Subclasses add navigation or value
 * access depending on the kind of object.
 *
 * Instances are only created by the {@link HandleFactory}, which keeps one
 * proxy per handle. Equality and hashing are by handle.
 */
public abstract class SimHandleBase implements SimObject {
    private static final Logger log = LogManager.getLogger(SimHandleBase.class);

    protected final HandleFactory factory;
    protected final NativeSimulator simulator;
    protected final long handle;

    private final String name;
    private final String typeName;
    private final String path;
    private final String definitionName;
    private final String definitionFile;
    private int length = -1;

    /**
     * @param factory the factory that owns this proxy
     * @param handle  native handle
     * @param path    path to this object, or null for a root
     */
    protected SimHandleBase(HandleFactory factory, long handle, String path) {
        this.factory = factory;
        this.simulator = factory.simulator();
        this.handle = handle;
        this.name = simulator.nameOf(handle);
        this.typeName = simulator.typeNameOf(handle);
        this.path = path == null ? name : path;
        this.definitionName = simulator.definitionName(handle);
        this.definitionFile = simulator.definitionFile(handle);
        log.debug("Created {} ({})", this.path, typeName);
    }

    @Override
    public final long handle() {
        return handle;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final String path() {
        return path;
    }

    @Override
    public final String typeName() {
        return typeName;
    }

    /** Name qualified with the native type, e.g. {@code clk(GPI_NET)}. */
    public final String fullName() {
        return name + "(" + typeName + ")";
    }

    @Override
    public final String definitionName() {
        return definitionName;
    }

    @Override
    public final String definitionFile() {
        return definitionFile;
    }

    /** Native element count, fetched on first use. */
    @Override
    public int length() {
        if (length < 0)
            length = simulator.elementCount(handle);
        return length;
    }

    /**
     * Longer description for logs, e.g.
     * {@code HierarchyObject(top.u_core with definition core (at core.sv))}.
     */
    public String describe() {
        StringBuilder desc = new StringBuilder(path);
        if (definitionName != null && !definitionName.isEmpty()) {
            desc.append(" with definition ").append(definitionName);
            if (definitionFile != null && !definitionFile.isEmpty())
                desc.append(" (at ").append(definitionFile).append(')');
        }
        return getClass().getSimpleName() + "(" + desc + ")";
    }

    @Override
    public final boolean equals(Object o) {
        return o instanceof SimHandleBase other && handle == other.handle;
    }

    @Override
    public final int hashCode() {
        return Long.hashCode(handle);
    }

    @Override
    public String toString() {
        return path;
    }
}
