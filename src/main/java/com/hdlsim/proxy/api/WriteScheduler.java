package com.hdlsim.proxy.api;

import com.hdlsim.proxy.handle.NonHierarchyObject;

/**
 * Hand-off point for deferred writes.
 *
 * Assigning a proxy's value through its deferred setter does not touch the
 * simulator. The raw value (which may be a set action such as Force) is passed
 * here and applied later, once per target, at the end of the current time
 * step, through the target's immediate write path.
 *
 * Usage Contract:
 * Multiple writes to the same target before the flush overwrite each other;
 * only the last one is applied. Nothing written here is visible to reads until
 * the flush has run.
 */
public interface WriteScheduler {

    /**
     * Records a write to be applied at the end of the current time step.
     *
     * @param target the object to write
     * @param value  the raw value, including any set action wrapper
     */
    void scheduleWrite(NonHierarchyObject target, Object value);
}
