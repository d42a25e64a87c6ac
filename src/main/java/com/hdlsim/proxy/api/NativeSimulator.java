package com.hdlsim.proxy.api;

import java.util.PrimitiveIterator;

/**
 * The native simulation interface this layer is built on.
 *
 * A running simulator exposes its elaborated design as a set of opaque
 * handles. This interface is the only way the proxy layer talks to the
 * simulator: it asks for metadata, walks relationships, and reads or writes
 * values through the accessor matching the object's kind.
 *
 * Handle Contract:
 * Handles are plain {@code long} values issued by the implementation. A handle
 * identifies exactly one native object for the lifetime of the simulation, and
 * the value {@link #NULL_HANDLE} means "no such object". Callers never do
 * arithmetic on handles; they only store and compare them.
 *
 * Threading:
 * Implementations are driven from the simulator's own callback context. Every
 * method is expected to be called from that single context only.
 */
public interface NativeSimulator {

    /** Returned by lookups when no object exists. */
    long NULL_HANDLE = 0L;

    /**
     * Returns the handle of a top-level design unit.
     *
     * @param name root name, or null for the first root
     * @return the root handle or {@link #NULL_HANDLE}
     */
    long rootHandle(String name);

    String nameOf(long handle);

    /** Raw native type tag, see {@link HandleType#fromCode(int)}. */
    int typeOf(long handle);

    /** Display name of the native type tag. */
    String typeNameOf(long handle);

    boolean isConst(long handle);

    /** Name of the defining construct (module/entity), or null. */
    String definitionName(long handle);

    /** Source file of the defining construct, or null. */
    String definitionFile(long handle);

    long childByName(long parent, String name);

    long childByIndex(long parent, int index);

    /** Declared range, or null if the object is not indexable. */
    Range rangeOf(long handle);

    /** Number of elements; the bit width for vectors. */
    int elementCount(long handle);

    PrimitiveIterator.OfLong iterate(long handle, IterationMode mode);

    long readLong(long handle);

    double readReal(long handle);

    String readString(long handle);

    /**
     * Bit pattern, most significant bit first. Verilog backends use 0/1/x/z;
     * VHDL backends may also report the std_logic values U, W, L, H and -.
     */
    String readBinStr(long handle);

    void writeLong(long handle, long value, ActionCode action);

    void writeReal(long handle, double value, ActionCode action);

    void writeString(long handle, String value, ActionCode action);

    void writeBinStr(long handle, String value, ActionCode action);
}
