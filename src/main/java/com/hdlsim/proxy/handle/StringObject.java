package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.action.WriteRequest;
import com.hdlsim.proxy.api.ActionCode;
import com.hdlsim.proxy.engine.HandleFactory;

/** A string variable. */
public class StringObject extends AbstractModifiableObject {

    public StringObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    @Override
    public String getValue() {
        return simulator.readString(handle);
    }

    /** Accepts any {@link CharSequence}. A release writes the empty string. */
    @Override
    public void setImmediateValue(Object value) {
        WriteRequest request = checkForSetAction(value);
        if (request.action() == ActionCode.RELEASE) {
            simulator.writeString(handle, "", ActionCode.RELEASE);
            return;
        }
        if (!(request.value() instanceof CharSequence text))
            throw unsupported("string", request.value());
        simulator.writeString(handle, text.toString(), request.action());
    }
}
