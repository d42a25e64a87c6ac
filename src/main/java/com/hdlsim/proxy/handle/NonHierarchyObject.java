package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.UnsupportedAssignmentException;

/**
 * Common base for every object that is not a scope: signals, variables,
 * constants and arrays of them.
 *
 * Value Access:
 * - getValue() reads the current value from the simulator.
 * - setImmediateValue() writes it right away.
 * - setValue() hands the write to the scheduler, which applies it at the end of
 * the current time step.
 *
 * Subclasses that accept writes override the setters; the defaults reject the
 * assignment.
 */
public abstract class NonHierarchyObject extends SimHandleBase {

    protected NonHierarchyObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    /** The current value of this object. */
    public abstract Object getValue();

    /**
     * Deferred write, applied at the end of the current time step.
     *
     * @param value a plain value or a {@link com.hdlsim.proxy.action.SetAction}
     */
    public void setValue(Object value) {
        throw new UnsupportedAssignmentException(
                "Not permissible to set values on object " + name() + " of type " + getClass().getSimpleName());
    }

    /**
     * Writes the value to the simulator now.
     *
     * @param value a plain value or a {@link com.hdlsim.proxy.action.SetAction}
     */
    public void setImmediateValue(Object value) {
        throw new UnsupportedAssignmentException(
                "Not permissible to set values on object " + name() + " of type " + getClass().getSimpleName());
    }
}
