package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.action.WriteRequest;
import com.hdlsim.proxy.engine.HandleFactory;

/** A real-valued signal or variable. */
public class RealObject extends AbstractModifiableObject {

    public RealObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    @Override
    public Double getValue() {
        return simulator.readReal(handle);
    }

    /** Accepts any {@link Number} and numeric text. */
    @Override
    public void setImmediateValue(Object value) {
        WriteRequest request = checkForSetAction(value);
        simulator.writeReal(handle, toDouble(request.value()), request.action());
    }

    private double toDouble(Object v) {
        if (v instanceof Number n)
            return n.doubleValue();
        if (v instanceof CharSequence text) {
            try {
                return Double.parseDouble(text.toString().trim());
            } catch (NumberFormatException e) {
                throw unsupported("real", v);
            }
        }
        throw unsupported("real", v);
    }
}
