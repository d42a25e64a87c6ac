package com.hdlsim.proxy.error;

/** The native type tag of a handle has no proxy mapping. */
public class UnknownHandleTypeException extends SimHandleException {
    private final int typeCode;
    private final String path;

    public UnknownHandleTypeException(int typeCode, String path) {
        super("Couldn't find a matching object for GPI type " + typeCode + " (path=" + path + ")");
        this.typeCode = typeCode;
        this.path = path;
    }

    public int typeCode() {
        return typeCode;
    }

    public String path() {
        return path;
    }
}
