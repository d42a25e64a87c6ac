package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.action.WriteRequest;
import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.UnsupportedAssignmentException;
import com.hdlsim.proxy.value.BitVector;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * A register or net, read and written as a bit vector.
 *
 * Encoding Rules for immediate writes:
 * 1. A small integer (below 0x7fffffff) on an object of at most 32 bits goes
 * through the native integer write, which is the cheapest path.
 * 2. Any other integer, including {@link BigInteger}, is encoded as a bit
 * vector of the object's width (two's complement when negative).
 * 3. A map {@code {"values": [..], "bits": n}} packs the list into one vector,
 * element 0 in the least significant {@code n} bits. The total width must
 * match the object exactly.
 * 4. A {@link BitVector} is written as is.
 *
 * Anything else is rejected with {@link UnsupportedAssignmentException}.
 */
public class ModifiableObject extends AbstractModifiableObject {
    private static final Logger log = LogManager.getLogger(ModifiableObject.class);

    private static final long FAST_PATH_LIMIT = 0x7fffffffL;

    public ModifiableObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    /** A fresh snapshot; never cached since the signal may change. */
    @Override
    public BitVector getValue() {
        String binStr = simulator.readBinStr(handle);
        return new BitVector(binStr);
    }

    @Override
    public void setImmediateValue(Object value) {
        WriteRequest request = checkForSetAction(value);
        Object v = request.value();

        if (isIntegral(v) && ((Number) v).longValue() < FAST_PATH_LIMIT && length() <= 32) {
            simulator.writeLong(handle, ((Number) v).longValue(), request.action());
            return;
        }
        simulator.writeBinStr(handle, toBitVector(v).binStr(), request.action());
    }

    private BitVector toBitVector(Object v) {
        if (v instanceof BitVector bits)
            return bits;
        if (isIntegral(v))
            return encode(BigInteger.valueOf(((Number) v).longValue()));
        if (v instanceof BigInteger big)
            return encode(big);
        if (v instanceof Map<?, ?> map)
            return pack(map);
        throw unsupported("bit vector", v);
    }

    private BitVector encode(BigInteger value) {
        try {
            return BitVector.of(value, length());
        } catch (IllegalArgumentException e) {
            log.error("Value {} does not fit {} ({} bits)", value, path(), length());
            throw new UnsupportedAssignmentException(
                    "Unable to set " + value + " on " + name() + " of width " + length(), e);
        }
    }

    private BitVector pack(Map<?, ?> map) {
        if (!(map.get("values") instanceof List<?> values) || !(map.get("bits") instanceof Number bitsNumber))
            throw unsupported("packed", map);

        int bits = bitsNumber.intValue();
        int total = values.size() * bits;
        if (total != length()) {
            String message = "Unable to set with array length " + values.size() + " of " + bits
                    + " bit entries = " + total + " total, target is only " + length() + " bits long";
            log.error(message);
            throw new UnsupportedAssignmentException(message);
        }

        BigInteger limit = BigInteger.ONE.shiftLeft(bits);
        BigInteger num = BigInteger.ZERO;
        for (int i = values.size() - 1; i >= 0; i--) {
            BigInteger element = toBigInteger(values.get(i));
            if (element == null || element.signum() < 0 || element.compareTo(limit) >= 0)
                throw unsupported("packed element", values.get(i));
            num = num.shiftLeft(bits).add(element);
        }
        return BitVector.of(num, length());
    }

    private static BigInteger toBigInteger(Object v) {
        if (isIntegral(v))
            return BigInteger.valueOf(((Number) v).longValue());
        if (v instanceof BigInteger big)
            return big;
        return null;
    }
}
