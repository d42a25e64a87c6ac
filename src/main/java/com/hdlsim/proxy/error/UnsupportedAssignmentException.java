package com.hdlsim.proxy.error;

/**
 * A value cannot be encoded for the target, or the target does not accept
 * assignment at all.
 */
public class UnsupportedAssignmentException extends SimHandleException {

    public UnsupportedAssignmentException(String message) {
        super(message);
    }

    public UnsupportedAssignmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
