package com.hdlsim.proxy.action;

import com.hdlsim.proxy.api.ActionCode;
import com.hdlsim.proxy.handle.NonHierarchyObject;

/** Holds the target at a value until a {@link Release} is applied. */
public final class Force implements SetAction {
    private final Object value;

    public Force(Object value) {
        this.value = value;
    }

    public Object value() {
        return value;
    }

    @Override
    public WriteRequest asWriteFor(NonHierarchyObject target) {
        return new WriteRequest(value, ActionCode.FORCE);
    }

    @Override
    public String toString() {
        return "Force(" + value + ")";
    }
}
