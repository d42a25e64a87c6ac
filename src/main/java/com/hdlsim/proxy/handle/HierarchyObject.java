package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.NoSuchChildException;
import com.hdlsim.proxy.error.UnsupportedAssignmentException;

import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A scope in the design hierarchy: a module instance, a struct, a named block.
 *
 * Children are looked up by name on demand and cached, so a lookup hits the
 * simulator at most once per name. This includes names that do not exist: a
 * failed lookup is remembered and later lookups of the same name fail straight
 * from the cache.
 */
public class HierarchyObject extends RegionObject<String> {
    private final Set<String> invalidSubHandles = new HashSet<>();

    public HierarchyObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    /**
     * Returns the child with the given local name.
     *
     * @throws NoSuchChildException if the design has no such object
     * @throws com.hdlsim.proxy.error.UnknownHandleTypeException if the child
     *         exists but has no proxy mapping
     */
    public SimHandleBase getChild(String name) {
        SimHandleBase child = lookup(name);
        if (child == null)
            throw new NoSuchChildException(name(), name);
        return child;
    }

    /**
     * Type-safe variant of {@link #getChild(String)}.
     *
     * @param <T> expected proxy type
     */
    @SuppressWarnings("unchecked")
    public <T extends SimHandleBase> T child(String name) {
        return (T) getChild(name);
    }

    /**
     * Probes for a child without treating absence as an error. The result is
     * cached exactly as for {@link #getChild(String)}.
     */
    public Optional<SimHandleBase> findChild(String name) {
        return Optional.ofNullable(lookup(name));
    }

    /**
     * Assigns a value to the named child through its deferred write.
     *
     * @throws NoSuchChildException           if the design has no such object;
     *                                        new names cannot be created
     * @throws UnsupportedAssignmentException if the child does not carry a
     *                                        value
     */
    public void setChild(String name, Object value) {
        SimHandleBase child = getChild(name);
        if (!(child instanceof NonHierarchyObject target))
            throw new UnsupportedAssignmentException(
                    "Not permissible to set values on object " + child.name() + " of type "
                            + child.getClass().getSimpleName());
        target.setValue(value);
    }

    /**
     * Looks up an extended identifier, which the simulator stores with
     * surrounding backslashes (e.g. VHDL {@code \weird name\}).
     */
    public SimHandleBase getExtended(String name) {
        return getChild("\\" + name + "\\");
    }

    /** Local names of all children, running discovery first. */
    public Set<String> childNames() {
        discoverAll();
        return Collections.unmodifiableSet(subHandles.keySet());
    }

    private SimHandleBase lookup(String name) {
        SimHandleBase child = subHandles.get(name);
        if (child != null)
            return child;
        if (invalidSubHandles.contains(name))
            return null;

        long newHandle = simulator.childByName(handle, name);
        if (newHandle == NativeSimulator.NULL_HANDLE) {
            invalidSubHandles.add(name);
            return null;
        }
        child = factory.resolve(newHandle, childPath(name));
        subHandles.put(name, child);
        return child;
    }

    @Override
    protected String subHandleKey(String childName) {
        return lastSegment(childName);
    }

    @Override
    protected String childPath(String key) {
        return path() + "." + key;
    }
}
