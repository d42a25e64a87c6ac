package com.hdlsim.proxy.error;

/** A scope has no object with the requested name. */
public class NoSuchChildException extends SimHandleException {
    private final String childName;

    public NoSuchChildException(String scopeName, String childName) {
        super(scopeName + " contains no object named " + childName);
        this.childName = childName;
    }

    public String childName() {
        return childName;
    }
}
