package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.action.WriteRequest;
import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.value.BitVector;

import java.math.BigInteger;

/** An integer signal or variable, read and written as a {@code long}. */
public class IntegerObject extends AbstractModifiableObject {

    public IntegerObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    @Override
    public Long getValue() {
        return simulator.readLong(handle);
    }

    /**
     * Accepts integral numbers, {@link BigInteger}s within the {@code long}
     * range, and fully resolvable {@link BitVector}s.
     */
    @Override
    public void setImmediateValue(Object value) {
        WriteRequest request = checkForSetAction(value);
        simulator.writeLong(handle, toLong(request.value()), request.action());
    }

    private long toLong(Object v) {
        if (isIntegral(v))
            return ((Number) v).longValue();
        if (v instanceof BitVector bits && bits.isResolvable())
            return bits.toLong();
        if (v instanceof BigInteger big && big.bitLength() < Long.SIZE)
            return big.longValue();
        throw unsupported("integer", v);
    }
}
