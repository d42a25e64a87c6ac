package com.hdlsim.proxy.error;

/** Bulk array write whose length differs from the declared element count. */
public class LengthMismatchException extends SimHandleException {
    private final int expected;
    private final int actual;

    public LengthMismatchException(String target, int expected, int actual) {
        super("Assigning list of length " + actual + " to object " + target + " of length " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
