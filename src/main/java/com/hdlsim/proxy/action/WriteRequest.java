package com.hdlsim.proxy.action;

import com.hdlsim.proxy.api.ActionCode;

/**
 * A value paired with the native action used to write it.
 *
 * @param value  value to encode for the target
 * @param action native write action
 */
public record WriteRequest(Object value, ActionCode action) {

    public static WriteRequest deposit(Object value) {
        return new WriteRequest(value, ActionCode.DEPOSIT);
    }
}
