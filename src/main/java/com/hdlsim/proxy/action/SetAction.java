package com.hdlsim.proxy.action;

import com.hdlsim.proxy.handle.NonHierarchyObject;

/**
 * A write intent that can be passed wherever a value is accepted.
 *
 * Value-bearing proxies unwrap a set action before encoding, so
 * {@code sig.setValue(new Force(5))} forces the signal instead of trying to
 * encode the Force object itself.
 */
public interface SetAction {

    /**
     * Produces the value and native action for the given target. Called at the
     * moment the write is issued to the simulator, not when the intent is
     * created.
     *
     * @param target the object being written
     */
    WriteRequest asWriteFor(NonHierarchyObject target);
}
