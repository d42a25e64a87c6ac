package com.hdlsim.proxy.action;

import com.hdlsim.proxy.api.ActionCode;
import com.hdlsim.proxy.handle.NonHierarchyObject;

/**
 * Holds the target at whatever value it has when the write is issued, until a
 * {@link Release}. For a deferred write that is the value at the scheduler's
 * flush, not at the time this intent was created.
 */
public final class Freeze implements SetAction {

    @Override
    public WriteRequest asWriteFor(NonHierarchyObject target) {
        return new WriteRequest(target.getValue(), ActionCode.FORCE);
    }

    @Override
    public String toString() {
        return "Freeze()";
    }
}
