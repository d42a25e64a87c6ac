package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.engine.HandleFactory;

/**
 * An enumeration signal or variable. The simulator exposes enum literals by
 * their ordinal, so reads and writes behave exactly as for integers.
 */
public class EnumObject extends IntegerObject {

    public EnumObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }
}
