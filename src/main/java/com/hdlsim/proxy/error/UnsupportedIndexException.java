package com.hdlsim.proxy.error;

/** Slice or multi-element indexing was requested. */
public class UnsupportedIndexException extends SimHandleException {

    public UnsupportedIndexException(String message) {
        super(message);
    }
}
