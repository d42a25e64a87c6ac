package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.IterationMode;
import com.hdlsim.proxy.engine.HandleFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.PrimitiveIterator;

/**
 * A value-bearing object whose value can change during simulation.
 *
 * A signal with a declared range also exposes its elements by index, in the
 * direction of the range, while its value is still read and written as a
 * whole.
 */
public abstract class NonConstantObject extends AbstractIndexableObject {

    protected NonConstantObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    /** Objects driving this one. */
    public List<SimHandleBase> drivers() {
        return collect(IterationMode.DRIVERS);
    }

    /** Objects loaded by this one. */
    public List<SimHandleBase> loads() {
        return collect(IterationMode.LOADS);
    }

    // Drivers and loads can live anywhere in the design, so they are resolved
    // through the identity cache without a path of their own.
    private List<SimHandleBase> collect(IterationMode mode) {
        List<SimHandleBase> result = new ArrayList<>();
        PrimitiveIterator.OfLong it = simulator.iterate(handle, mode);
        while (it.hasNext())
            result.add(factory.resolve(it.nextLong(), null));
        return result;
    }
}
