package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.engine.HandleFactory;
import com.hdlsim.proxy.error.IndexOutOfRangeException;
import com.hdlsim.proxy.error.LengthMismatchException;
import com.hdlsim.proxy.error.UnsupportedAssignmentException;

import java.util.ArrayList;
import java.util.List;
import java.util.PrimitiveIterator;

/**
 * An array of value-bearing elements, such as an unpacked array of registers.
 *
 * Direction:
 * The declared range decides the order of bulk access. Reading the value walks
 * from the left bound to the right bound, so for {@code arr[7:0]} element 0 of
 * the returned list is {@code arr[7]}, and for {@code arr[0:7]} it is
 * {@code arr[0]}. Writing a list uses the same mapping.
 *
 * <pre>
 * Verilog     VHDL               getValue() is equivalent to
 * arr[4:7]    arr(4 to 7)        [arr[4], arr[5], arr[6], arr[7]]
 * arr[7:4]    arr(7 downto 4)    [arr[7], arr[6], arr[5], arr[4]]
 * </pre>
 *
 * To write a single element use {@code arr.get(i).setValue(v)} or
 * {@link #set(int, Object)}; modifying the list returned by
 * {@link #getValue()} has no effect on the simulation.
 */
public class NonHierarchyIndexableObject extends AbstractIndexableObject implements IndexedCollection {

    public NonHierarchyIndexableObject(HandleFactory factory, long handle, String path) {
        super(factory, handle, path);
    }

    /** Element count of the declared range. */
    @Override
    public int length() {
        return range != null ? range.count() : super.length();
    }

    /** Deferred write of a single element. */
    public void set(int index, Object value) {
        valueElement(index).setValue(value);
    }

    /**
     * Values of all elements, walked from the left bound to the right bound.
     * Unlike iteration, a missing element here is an error.
     */
    @Override
    public List<Object> getValue() {
        if (range == null)
            throw new IndexOutOfRangeException(fullName() + " is not indexable", 0);

        List<Object> values = new ArrayList<>(range.count());
        PrimitiveIterator.OfInt walk = range.walk();
        while (walk.hasNext())
            values.add(valueElement(walk.nextInt()).getValue());
        return values;
    }

    /**
     * Deferred write of every element from a list of the same length. List
     * position 0 maps to the left bound.
     *
     * @throws LengthMismatchException if the list length differs from
     *                                 {@link #length()}; nothing is written
     */
    @Override
    public void setValue(Object value) {
        List<?> values = checkList(value);
        List<NonHierarchyObject> targets = targets();
        for (int i = 0; i < values.size(); i++)
            targets.get(i).setValue(values.get(i));
    }

    /**
     * Immediate write of every element, with the same mapping and checks as
     * {@link #setValue(Object)}.
     */
    @Override
    public void setImmediateValue(Object value) {
        List<?> values = checkList(value);
        List<NonHierarchyObject> targets = targets();
        for (int i = 0; i < values.size(); i++)
            targets.get(i).setImmediateValue(values.get(i));
    }

    private List<?> checkList(Object value) {
        if (!(value instanceof List<?> values))
            throw new UnsupportedAssignmentException(
                    "Assigning non-list value to object " + name() + " of type " + getClass().getSimpleName());
        if (range == null)
            throw new IndexOutOfRangeException(fullName() + " is not indexable", 0);
        if (values.size() != length())
            throw new LengthMismatchException(name(), length(), values.size());
        return values;
    }

    // Every element is resolved before the first write so a missing index fails
    // without leaving a partial update behind.
    private List<NonHierarchyObject> targets() {
        List<NonHierarchyObject> targets = new ArrayList<>(range.count());
        PrimitiveIterator.OfInt walk = range.walk();
        while (walk.hasNext())
            targets.add(valueElement(walk.nextInt()));
        return targets;
    }

    private NonHierarchyObject valueElement(int index) {
        SimHandleBase element = get(index);
        if (element instanceof NonHierarchyObject valueObject)
            return valueObject;
        throw new UnsupportedAssignmentException(
                "Element " + element.path() + " of type " + element.getClass().getSimpleName() + " has no value");
    }
}
