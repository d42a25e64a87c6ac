package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.api.Range;
import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.IndexOutOfRangeException;
import com.hdlsim.proxy.error.ReadOnlyIndexException;
import com.hdlsim.proxy.error.UnsupportedIndexException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * A generate array: a fixed, indexed collection of scopes.
 *
 * Elements are addressed by integer index. Their native names encode the
 * index in a simulator-specific way, so discovery runs each name through the
 * factory's {@link IndexNamePattern}s to recover it.
 *
 * The array itself is not assignable; values are set on signals inside the
 * element scopes.
 */
public class HierarchyArrayObject extends RegionObject<Integer> implements IndexedCollection {
    private static final Logger log = LogManager.getLogger(HierarchyArrayObject.class);

    private int length = -1;

    public HierarchyArrayObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    /** Number of elements, which requires a full discovery. */
    @Override
    public int length() {
        if (length < 0) {
            discoverAll();
            length = subHandles.size();
        }
        return length;
    }

    /**
     * @throws IndexOutOfRangeException if the array has no element at
     *                                  {@code index}
     */
    @Override
    public SimHandleBase get(int index) {
        SimHandleBase cached = subHandles.get(index);
        if (cached != null)
            return cached;

        long newHandle = simulator.childByIndex(handle, index);
        if (newHandle == NativeSimulator.NULL_HANDLE)
            throw new IndexOutOfRangeException(name() + " contains no object at index " + index, index);

        SimHandleBase child = factory.resolve(newHandle, childPath(index));
        subHandles.put(index, child);
        return child;
    }

    /** Type-safe variant of {@link #get(int)}. */
    @SuppressWarnings("unchecked")
    public <T extends SimHandleBase> T element(int index) {
        return (T) get(index);
    }

    /** @throws UnsupportedIndexException always */
    public SimHandleBase slice(int left, int right) {
        throw new UnsupportedIndexException("Slice indexing is not supported");
    }

    /** @throws ReadOnlyIndexException always */
    public void set(int index, Object value) {
        throw new ReadOnlyIndexException("Not permissible to set " + name() + " at index " + index);
    }

    /**
     * Declared range if the simulator reports one, otherwise the discovered
     * indices in ascending order.
     */
    @Override
    public List<Integer> indices() {
        Range range = simulator.rangeOf(handle);
        List<Integer> result = new ArrayList<>();
        if (range != null) {
            range.walk().forEachRemaining((int i) -> result.add(i));
            return result;
        }
        discoverAll();
        result.addAll(subHandles.keySet());
        Collections.sort(result);
        return result;
    }

    @Override
    protected Integer subHandleKey(String childName) {
        String arrayName = lastSegment(name());
        String local = lastSegment(childName);
        for (IndexNamePattern pattern : factory.indexPatterns()) {
            OptionalInt index = pattern.extractIndex(arrayName, local);
            if (index.isPresent())
                return index.getAsInt();
        }
        log.error("Unable to match an index pattern: {}", childName);
        return null;
    }

    @Override
    protected String childPath(Integer index) {
        return path() + "[" + index + "]";
    }
}
