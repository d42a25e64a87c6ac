package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.IterationMode;
import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.IndexOutOfRangeException;
import com.hdlsim.proxy.error.UnknownHandleTypeException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PrimitiveIterator;

/**
 * A region of the design: a scope or namespace that has children but no value.
 *
 * Children are resolved lazily and cached by key. A full discovery, needed for
 * iteration, walks every native child once; the hierarchy is fixed after
 * elaboration so it never has to run again.
 *
 * @param <K> child key type: the local name for scopes, the index for arrays
 */
public abstract class RegionObject<K> extends SimHandleBase implements Iterable<SimHandleBase> {
    private static final Logger log = LogManager.getLogger(RegionObject.class);

    protected final Map<K, SimHandleBase> subHandles = new LinkedHashMap<>();
    private boolean discovered;

    protected RegionObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    /**
     * Resolves every child of this region and caches it under its key.
     *
     * Children whose type has no proxy mapping, and children whose name cannot
     * be turned into a key, are logged and skipped.
     */
    public final void discoverAll() {
        if (discovered)
            return;
        log.debug("Discovering all on {}", path());

        PrimitiveIterator.OfLong it = simulator.iterate(handle, IterationMode.OBJECTS);
        while (it.hasNext()) {
            long thing = it.nextLong();
            String childName = simulator.nameOf(thing);

            K key = subHandleKey(childName);
            if (key == null) {
                log.debug("Unable to translate handle >{}< to a valid sub-handle key", childName);
                continue;
            }

            SimHandleBase hdl;
            try {
                hdl = factory.resolve(thing, childPath(key));
            } catch (UnknownHandleTypeException e) {
                log.debug("{}", e.getMessage());
                continue;
            }
            subHandles.put(key, hdl);
        }
        discovered = true;
    }

    public final boolean isDiscovered() {
        return discovered;
    }

    /**
     * Translates a native child name into the key used in the child cache.
     *
     * @return the key, or null if the child should be dropped
     */
    protected abstract K subHandleKey(String childName);

    /** Path of the child stored under {@code key}. */
    protected abstract String childPath(K key);

    /**
     * Iterates every object in this layer of hierarchy, running discovery first.
     * Indexed children are expanded into their elements; an index that does not
     * resolve is logged and skipped.
     */
    @Override
    public Iterator<SimHandleBase> iterator() {
        discoverAll();

        List<SimHandleBase> result = new ArrayList<>(subHandles.size());
        for (Map.Entry<K, SimHandleBase> entry : subHandles.entrySet()) {
            SimHandleBase child = entry.getValue();
            if (child instanceof IndexedCollection collection) {
                List<Integer> indices = collection.indices();
                log.debug("Found index list length {}", indices.size());
                for (int index : indices) {
                    try {
                        result.add(collection.get(index));
                    } catch (IndexOutOfRangeException e) {
                        log.warn("Index {} doesn't exist in {}.{}", index, name(), entry.getKey());
                    }
                }
            } else {
                result.add(child);
            }
        }
        return result.iterator();
    }

    /** Local name with any hierarchical prefix removed. */
    protected static String lastSegment(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }
}
