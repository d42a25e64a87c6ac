package com.hdlsim.proxy.error;

/** Index assignment on a hierarchy array, whose elements are scopes. */
public class ReadOnlyIndexException extends UnsupportedAssignmentException {

    public ReadOnlyIndexException(String message) {
        super(message);
    }
}
