package com.hdlsim.proxy.error;

/** Write attempted on an object whose value was fixed at elaboration. */
public class ReadOnlyValueException extends UnsupportedAssignmentException {

    public ReadOnlyValueException(String message) {
        super(message);
    }
}
