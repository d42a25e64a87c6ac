package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.api.Range;
import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.IndexOutOfRangeException;
import com.hdlsim.proxy.error.UnsupportedIndexException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A value-bearing object that may have a declared range, and so elements
 * reachable by index: the elements of an unpacked array, or the bits of a
 * VHDL vector such as {@code sig(7 downto 0)}.
 *
 * Indexing follows the declared range. Element paths are
 * {@code path + "[" + index + "]"} and each element is cached after the
 * first lookup. Objects without a range have no elements.
 */
public abstract class AbstractIndexableObject extends NonHierarchyObject implements Iterable<SimHandleBase> {
    private static final Logger log = LogManager.getLogger(AbstractIndexableObject.class);

    protected final Range range;
    private final Map<Integer, SimHandleBase> subHandles = new HashMap<>();

    protected AbstractIndexableObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
        this.range = simulator.rangeOf(handle);
    }

    /** Declared range, or null if the simulator reports none. */
    public Range range() {
        return range;
    }

    /**
     * @throws IndexOutOfRangeException if the object is not indexable or has no
     *                                  element at {@code index}
     */
    public SimHandleBase get(int index) {
        if (range == null)
            throw new IndexOutOfRangeException(
                    fullName() + " is not indexable.  Unable to get object at index " + index, index);

        SimHandleBase cached = subHandles.get(index);
        if (cached != null)
            return cached;

        long newHandle = simulator.childByIndex(handle, index);
        if (newHandle == NativeSimulator.NULL_HANDLE)
            throw new IndexOutOfRangeException(fullName() + " contains no object at index " + index, index);

        SimHandleBase child = factory.resolve(newHandle, path() + "[" + index + "]");
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

    /** Indices of the declared range, left bound first. */
    public List<Integer> indices() {
        if (range == null)
            return Collections.emptyList();
        List<Integer> result = new ArrayList<>(range.count());
        range.walk().forEachRemaining((int i) -> result.add(i));
        return result;
    }

    /**
     * Iterates the elements in declared direction. Indices with no object
     * behind them are skipped.
     */
    @Override
    public Iterator<SimHandleBase> iterator() {
        List<SimHandleBase> result = new ArrayList<>();
        if (range == null)
            return result.iterator();

        log.debug("Iterating with range {}", range);
        for (int index : indices()) {
            try {
                result.add(get(index));
            } catch (IndexOutOfRangeException e) {
                log.debug("Skipping {}", e.getMessage());
            }
        }
        return result.iterator();
    }
}
