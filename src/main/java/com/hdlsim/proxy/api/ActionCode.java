package com.hdlsim.proxy.api;

/**
 * Write action understood by the native write accessors.
 *
 * DEPOSIT is an ordinary assignment. FORCE holds the object at the written
 * value until a RELEASE, which hands control back to the design's own drivers.
 */
public enum ActionCode {
    DEPOSIT(0),
    FORCE(1),
    RELEASE(2);

    private final int code;

    ActionCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
