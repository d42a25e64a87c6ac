package com.hdlsim.proxy.api;

/**
 * An object in the simulated design, as seen from the host process.
 *
 * Every proxy wraps exactly one native handle. Two proxies are equal if and
 * only if they wrap the same handle, and the factory guarantees there is never
 * more than one proxy per handle, so in practice equal proxies are also the
 * same instance.
 *
 * The path is a diagnostic: it records how the object was first reached
 * ({@code top.u_core.regs[3]}) and is never used to identify it.
 */
public interface SimObject {

    /** The native handle this proxy wraps. */
    long handle();

    /** Declared name as reported by the simulator. */
    String name();

    /** Hierarchical path through which this object was first resolved. */
    String path();

    /** Native type name, e.g. {@code GPI_REGISTER}. */
    String typeName();

    /** Defining construct (module or entity name), or null. */
    String definitionName();

    /** Source file of the defining construct, or null. */
    String definitionFile();

    /**
     * Length of the object: bit width for vectors, element or child count for
     * collections.
     */
    int length();
}
