package com.hdlsim.proxy.wiring;

import com.hdlsim.proxy.handle.NonHierarchyObject;

/**
 * A mutable slot in the {@link ExternalWriteBridge} ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is created and reused for
 * every write handed from a producer thread to the simulator thread. The
 * consumer clears the slot once the write has been queued so the ring does not
 * keep targets or values reachable.
 */
public final class WriteEvent {
    private NonHierarchyObject target;
    private Object value;
    private long sequenceId;

    /**
     * @param target object to write
     * @param value  raw value or set action
     * @param seqId  producer-side sequence, for logging
     */
    public void set(NonHierarchyObject target, Object value, long seqId) {
        this.target = target;
        this.value = value;
        this.sequenceId = seqId;
    }

    public NonHierarchyObject target() {
        return target;
    }

    public Object value() {
        return value;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        target = null;
        value = null;
        sequenceId = 0;
    }
}
