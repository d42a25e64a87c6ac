package com.hdlsim.proxy.action;

import com.hdlsim.proxy.handle.NonHierarchyObject;

/** Places a value into the target, like an ordinary assignment. */
public final class Deposit implements SetAction {
    private final Object value;

    public Deposit(Object value) {
        this.value = value;
    }

    public Object value() {
        return value;
    }

    @Override
    public WriteRequest asWriteFor(NonHierarchyObject target) {
        return WriteRequest.deposit(value);
    }

    @Override
    public String toString() {
        return "Deposit(" + value + ")";
    }
}
