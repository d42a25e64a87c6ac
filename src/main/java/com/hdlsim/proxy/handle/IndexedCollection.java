package com.hdlsim.proxy.handle;

import java.util.List;

/**
 * A proxy whose children are addressed by integer index.
 *
 * Scopes use this when iterating: a child that is an indexed collection is
 * expanded into its elements rather than yielded as a whole.
 */
public interface IndexedCollection {

    /** Indices in iteration order. Some may not resolve to an object. */
    List<Integer> indices();

    /**
     * @throws com.hdlsim.proxy.error.IndexOutOfRangeException if nothing
     *                                                         exists at the
     *                                                         index
     */
    SimHandleBase get(int index);
}
