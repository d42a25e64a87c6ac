package com.hdlsim.proxy.error;

/** No object exists at an index, or the object is not indexable at all. */
public class IndexOutOfRangeException extends SimHandleException {
    private final int index;

    public IndexOutOfRangeException(String message, int index) {
        super(message);
        this.index = index;
    }

    public int index() {
        return index;
    }
}
