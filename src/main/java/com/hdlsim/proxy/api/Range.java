package com.hdlsim.proxy.api;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Declared bounds of an array-like object, as written in the HDL source.
 *
 * Direction matters: {@code [7:0]} (or {@code 7 downto 0}) is descending and
 * {@code [0:7]} is ascending. Walking a range always starts at {@code left} and
 * ends at {@code right}, inclusive, which is what gives bulk array access its
 * left-to-right meaning regardless of how the native indices run.
 *
 * @param left  left bound
 * @param right right bound
 */
public record Range(int left, int right) {

    public boolean isDescending() {
        return left > right;
    }

    /** Number of indices covered, both bounds included. */
    public int count() {
        return Math.abs(left - right) + 1;
    }

    public boolean contains(int index) {
        return isDescending() ? index <= left && index >= right : index >= left && index <= right;
    }

    /**
     * Returns the native index visited at the given walk position.
     *
     * @param position 0-based position in the walk
     */
    public int indexAt(int position) {
        if (position < 0 || position >= count())
            throw new IndexOutOfBoundsException("Position " + position + " outside " + this);
        return isDescending() ? left - position : left + position;
    }

    /** Indices from left to right inclusive, in declared direction. */
    public PrimitiveIterator.OfInt walk() {
        return new PrimitiveIterator.OfInt() {
            private int position;

            @Override
            public boolean hasNext() {
                return position < count();
            }

            @Override
            public int nextInt() {
                if (!hasNext())
                    throw new NoSuchElementException();
                return indexAt(position++);
            }
        };
    }

    @Override
    public String toString() {
        return "[" + left + ":" + right + "]";
    }
}
