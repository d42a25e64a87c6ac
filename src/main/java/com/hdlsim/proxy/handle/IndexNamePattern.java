package com.hdlsim.proxy.handle;

import java.util.OptionalInt;

/**
 * Extracts the element index from the name a simulator gives to one element
 * of a generate array.
 *
 * Simulators do not agree on this naming. A {@link HierarchyArrayObject} tries
 * every registered pattern in order and uses the first match, so supporting a
 * new backend means registering one more pattern with the factory.
 */
@FunctionalInterface
public interface IndexNamePattern {

    /**
     * @param arrayName name of the generate array, e.g. {@code gen_lane}
     * @param childName name of the element, e.g. {@code gen_lane[3]}
     * @return the index, or empty if this pattern does not apply
     */
    OptionalInt extractIndex(String arrayName, String childName);
}
