package com.hdlsim.proxy.api;

/** Relationship walked by {@link NativeSimulator#iterate(long, IterationMode)}. */
public enum IterationMode {
    /** Every child object of a scope. */
    OBJECTS,
    /** Objects driving a signal. */
    DRIVERS,
    /** Objects loading a signal. */
    LOADS
}
