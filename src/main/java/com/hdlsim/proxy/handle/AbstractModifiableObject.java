package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.action.SetAction;
import com.hdlsim.proxy.action.WriteRequest;
import com.hdlsim.proxy.api.WriteScheduler;
import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.UnsupportedAssignmentException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for simulator objects whose values can be modified: nets,
 * signals and variables.
 *
 * Write Paths:
 * - {@link #setValue(Object)} is the normal way to assign. The value is stored
 * by the {@link WriteScheduler} and all stored values are written together at
 * the end of the current time step.
 * - {@link #setImmediateValue(Object)} writes now. Subclasses implement it with
 * the accessor and encoding that match their kind.
 *
 * Both accept a {@link SetAction} (Deposit, Force, Freeze, Release) in place of
 * a plain value. The action is unwrapped when the write is issued, so a
 * deferred Freeze captures the value at the end of the time step.
 */
public abstract class AbstractModifiableObject extends NonConstantObject {
    private static final Logger log = LogManager.getLogger(AbstractModifiableObject.class);

    private final WriteScheduler scheduler;

    protected AbstractModifiableObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
        this.scheduler = factory.scheduler();
    }

    @Override
    public final void setValue(Object value) {
        scheduler.scheduleWrite(this, value);
    }

    @Override
    public abstract void setImmediateValue(Object value);

    /** Splits a raw value into the value to encode and the native action. */
    protected final WriteRequest checkForSetAction(Object value) {
        if (value instanceof SetAction action)
            return action.asWriteFor(this);
        return WriteRequest.deposit(value);
    }

    /** Logs and builds the error for a value this object cannot encode. */
    protected final UnsupportedAssignmentException unsupported(String kind, Object value) {
        String type = value == null ? "null" : value.getClass().getName();
        log.error("Unsupported type for {} value assignment: {} ({})", kind, type, value);
        return new UnsupportedAssignmentException("Unable to set simulator value with type " + type);
    }

    /** True for the boxed integral types that fit in a long. */
    protected static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }
}
