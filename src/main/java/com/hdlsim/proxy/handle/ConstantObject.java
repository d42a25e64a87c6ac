package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.ReadOnlyValueException;
import com.hdlsim.proxy.value.BitVector;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An object whose value is fixed at elaboration: a parameter, generic or
 * constant.
 *
 * The value is read once, in the constructor, and served from memory after
 * that. Integer and enum constants hold a {@code Long}, reals a
 * {@code Double}, strings a {@code String}; everything else is read as a bit
 * pattern and held as a {@link BitVector}, or as the raw text if the pattern
 * cannot be parsed.
 */
public class ConstantObject extends NonHierarchyObject {
    private static final Logger log = LogManager.getLogger(ConstantObject.class);

    private final Object value;

    /**
     * @param typeCode native type tag, used to pick the read accessor
     */
    public ConstantObject(HandleFactory factory, long handle, String path, int typeCode) {
        super(factory, handle, path);
        HandleType type = HandleType.fromCode(typeCode);
        if (type == HandleType.INTEGER || type == HandleType.ENUM) {
            this.value = simulator.readLong(handle);
        } else if (type == HandleType.REAL) {
            this.value = simulator.readReal(handle);
        } else if (type == HandleType.STRING) {
            this.value = simulator.readString(handle);
        } else {
            this.value = readBits();
        }
    }

    private Object readBits() {
        String raw = simulator.readBinStr(handle);
        try {
            return new BitVector(raw);
        } catch (IllegalArgumentException e) {
            log.debug("Keeping raw value of {}: {}", path(), e.getMessage());
            return raw;
        }
    }

    @Override
    public Object getValue() {
        return value;
    }

    /** @throws ReadOnlyValueException always */
    @Override
    public void setValue(Object value) {
        throw readOnly();
    }

    /** @throws ReadOnlyValueException always */
    @Override
    public void setImmediateValue(Object value) {
        throw readOnly();
    }

    private ReadOnlyValueException readOnly() {
        return new ReadOnlyValueException("Not permissible to set values on constant object " + name());
    }
}
