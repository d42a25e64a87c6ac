package com.hdlsim.proxy.action;

import com.hdlsim.proxy.api.ActionCode;
import com.hdlsim.proxy.handle.NonHierarchyObject;

/** Cancels an active {@link Force} or {@link Freeze}. */
public final class Release implements SetAction {

    @Override
    public WriteRequest asWriteFor(NonHierarchyObject target) {
        return new WriteRequest(0, ActionCode.RELEASE);
    }

    @Override
    public String toString() {
        return "Release()";
    }
}
