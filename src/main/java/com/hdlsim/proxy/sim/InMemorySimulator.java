package com.hdlsim.proxy.sim;

import com.hdlsim.proxy.api.ActionCode;
import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.api.IterationMode;
import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.api.Range;
import com.hdlsim.proxy.value.BitVector;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PrimitiveIterator;
import java.util.TreeMap;

/**
 * A {@link NativeSimulator} over an elaborated design held in memory.
 *
 * The design is built once, either programmatically through the {@code add*}
 * methods or from a JSON file by {@link com.hdlsim.proxy.io.JsonDesignLoader},
 * and then only its values change.
 *
 * Value Model:
 * Every value-bearing object stores a driven value and, while forced, a forced
 * value. Reads return the forced value if there is one and the driven value
 * otherwise. A deposit changes the driven value only, so it stays invisible
 * until the force is released. Bit-vector objects store their bits as a
 * binary string of the object's width; integer writes are truncated to that
 * width, as a simulator would.
 *
 * Names:
 * By default {@link #nameOf(long)} returns the local name. With
 * {@link #setQualifiedNames(boolean)} it returns the dotted name from the root
 * instead, the way some native interfaces report discovered children.
 *
 * Every native call is counted per operation, so tests can check how often
 * the proxy layer reached the simulator.
 */
public final class InMemorySimulator implements NativeSimulator {
    private static final Logger log = LogManager.getLogger(InMemorySimulator.class);

    private static final int INTEGER_WIDTH = 32;

    private final Map<Long, SimNode> nodes = new HashMap<>();
    private final Map<String, SimNode> roots = new LinkedHashMap<>();
    private final Map<String, SimNode> byPath = new HashMap<>();
    private final Map<String, Integer> queryCounts = new TreeMap<>();
    private long nextHandle = 1;
    private boolean qualifiedNames;

    // ── Design Construction ─────────────────────────────────────────

    /** Adds a top-level module. */
    public long addRoot(String name) {
        if (roots.containsKey(name))
            throw new IllegalArgumentException("Duplicate root: " + name);
        SimNode root = newNode(null, name, HandleType.MODULE.code());
        roots.put(name, root);
        register(root, name);
        return root.handle;
    }

    /**
     * Adds a child object under a parent.
     *
     * @param typeCode native type tag; need not map to a {@link HandleType}
     */
    public long add(long parent, String name, int typeCode) {
        SimNode p = node(parent);
        if (p.children.containsKey(name))
            throw new IllegalArgumentException("Duplicate child " + name + " in " + p.path);
        SimNode child = newNode(p, name, typeCode);
        p.children.put(name, child);
        register(child, p.path + "." + name);
        return child.handle;
    }

    public long add(long parent, String name, HandleType type) {
        return add(parent, name, type.code());
    }

    public long addModule(long parent, String name) {
        return add(parent, name, HandleType.MODULE);
    }

    /** Adds a register of the given width, initially all {@code x}. */
    public long addRegister(long parent, String name, int width) {
        long h = add(parent, name, HandleType.REGISTER);
        setWidth(h, width);
        return h;
    }

    /** Adds a net of the given width, initially all {@code z}. */
    public long addNet(long parent, String name, int width) {
        long h = add(parent, name, HandleType.NET);
        setWidth(h, width);
        return h;
    }

    public long addInteger(long parent, String name, long value) {
        long h = add(parent, name, HandleType.INTEGER);
        setStoredValue(h, value);
        return h;
    }

    public long addEnum(long parent, String name, long value) {
        long h = add(parent, name, HandleType.ENUM);
        setStoredValue(h, value);
        return h;
    }

    public long addReal(long parent, String name, double value) {
        long h = add(parent, name, HandleType.REAL);
        setStoredValue(h, value);
        return h;
    }

    public long addString(long parent, String name, String value) {
        long h = add(parent, name, HandleType.STRING);
        setStoredValue(h, value);
        return h;
    }

    /**
     * Adds a constant of the given kind and value, e.g. a parameter or generic.
     */
    public long addConstant(long parent, String name, int typeCode, Object value) {
        long h = add(parent, name, typeCode);
        setStoredValue(h, value);
        setConstant(h, true);
        return h;
    }

    /**
     * Adds an array of registers named {@code name[i]}, one element per index
     * of the range.
     */
    public long addNetArray(long parent, String name, Range range, int elementWidth) {
        long array = add(parent, name, HandleType.NET_ARRAY);
        setRange(array, range);
        PrimitiveIterator.OfInt walk = range.walk();
        while (walk.hasNext()) {
            int index = walk.nextInt();
            long element = addElement(array, index, name + "[" + index + "]", HandleType.REGISTER.code());
            setWidth(element, elementWidth);
        }
        return array;
    }

    /**
     * Adds a generate array whose element scopes are named with
     * {@code nameFormat}, formatted with the array name and the index, e.g.
     * {@code "%s[%d]"} or {@code "%s__%d"}.
     */
    public long addGenArray(long parent, String name, String nameFormat, int... indices) {
        long array = add(parent, name, HandleType.GEN_ARRAY);
        for (int index : indices)
            addElement(array, index, String.format(nameFormat, name, index), HandleType.MODULE.code());
        return array;
    }

    /**
     * Adds an indexed element to an array object.
     *
     * @param nativeName name the element reports through {@link #nameOf(long)}
     */
    public long addElement(long array, int index, String nativeName, int typeCode) {
        SimNode a = node(array);
        if (a.indexed.containsKey(index))
            throw new IllegalArgumentException("Duplicate index " + index + " in " + a.path);
        SimNode element = newNode(a, nativeName, typeCode);
        a.children.put(nativeName, element);
        a.indexed.put(index, element);
        register(element, a.path + "[" + index + "]");
        return element.handle;
    }

    /**
     * Adds a child that is only reachable through iteration. Used for objects
     * a backend reports during discovery but cannot look up by name.
     */
    public long addHiddenChild(long parent, String nativeName, int typeCode) {
        SimNode p = node(parent);
        SimNode child = newNode(p, nativeName, typeCode);
        child.hidden = true;
        p.children.put(nativeName, child);
        register(child, p.path + "." + nativeName);
        return child.handle;
    }

    public void setWidth(long handle, int width) {
        if (width <= 0)
            throw new IllegalArgumentException("Width must be positive: " + width);
        SimNode n = node(handle);
        n.width = width;
        if (n.isVector())
            n.driven = initialBits(n);
    }

    public void setRange(long handle, Range range) {
        node(handle).range = range;
    }

    public void setConstant(long handle, boolean constant) {
        node(handle).constant = constant;
    }

    public void setDefinition(long handle, String name, String file) {
        SimNode n = node(handle);
        n.definitionName = name;
        n.definitionFile = file;
    }

    /**
     * Sets the driven value directly, bypassing write actions. Bit-vector
     * objects take a {@link BitVector}, a binary string or an integer.
     */
    public void setStoredValue(long handle, Object value) {
        SimNode n = node(handle);
        HandleType type = n.type();
        if (n.isVector())
            n.driven = toBits(n, value);
        else if ((type == HandleType.INTEGER || type == HandleType.ENUM) && value instanceof Number num)
            n.driven = num.longValue();
        else if (type == HandleType.REAL && value instanceof Number num)
            n.driven = num.doubleValue();
        else
            n.driven = value;
    }

    public void addDriver(long handle, long driver) {
        node(handle).drivers.add(node(driver));
    }

    public void addLoad(long handle, long load) {
        node(handle).loads.add(node(load));
    }

    public void setQualifiedNames(boolean qualifiedNames) {
        this.qualifiedNames = qualifiedNames;
    }

    // ── Inspection ──────────────────────────────────────────────────

    /**
     * Handle of the object at a path such as {@code top.u_core.arr[3]}, or
     * {@link #NULL_HANDLE}.
     */
    public long handleAt(String path) {
        SimNode n = byPath.get(path);
        return n == null ? NULL_HANDLE : n.handle;
    }

    public boolean isForced(long handle) {
        return node(handle).forced;
    }

    /** The driven value, ignoring any force. */
    public Object storedValue(long handle) {
        return node(handle).driven;
    }

    /** Number of calls made to a native operation, e.g. {@code "childByName"}. */
    public int queryCount(String operation) {
        return queryCounts.getOrDefault(operation, 0);
    }

    public Map<String, Integer> queryCounts() {
        return Collections.unmodifiableMap(queryCounts);
    }

    public void resetCounters() {
        queryCounts.clear();
    }

    /** Number of objects in the design. */
    public int objectCount() {
        return nodes.size();
    }

    // ── NativeSimulator ─────────────────────────────────────────────

    @Override
    public long rootHandle(String name) {
        count("rootHandle");
        SimNode root = name == null
                ? roots.values().stream().findFirst().orElse(null)
                : roots.get(name);
        return root == null ? NULL_HANDLE : root.handle;
    }

    @Override
    public String nameOf(long handle) {
        count("nameOf");
        SimNode n = node(handle);
        return qualifiedNames ? qualifiedName(n) : n.name;
    }

    @Override
    public int typeOf(long handle) {
        count("typeOf");
        return node(handle).typeCode;
    }

    @Override
    public String typeNameOf(long handle) {
        count("typeNameOf");
        int code = node(handle).typeCode;
        HandleType type = HandleType.fromCode(code);
        return type == null ? "GPI_UNKNOWN(" + code + ")" : type.displayName();
    }

    @Override
    public boolean isConst(long handle) {
        count("isConst");
        return node(handle).constant;
    }

    @Override
    public String definitionName(long handle) {
        count("definitionName");
        return node(handle).definitionName;
    }

    @Override
    public String definitionFile(long handle) {
        count("definitionFile");
        return node(handle).definitionFile;
    }

    @Override
    public long childByName(long parent, String name) {
        count("childByName");
        SimNode child = node(parent).children.get(name);
        return child == null || child.hidden ? NULL_HANDLE : child.handle;
    }

    @Override
    public long childByIndex(long parent, int index) {
        count("childByIndex");
        SimNode child = node(parent).indexed.get(index);
        return child == null ? NULL_HANDLE : child.handle;
    }

    @Override
    public Range rangeOf(long handle) {
        count("rangeOf");
        return node(handle).range;
    }

    @Override
    public int elementCount(long handle) {
        count("elementCount");
        SimNode n = node(handle);
        HandleType type = n.type();
        if (n.isVector())
            return n.width;
        if (type == HandleType.NET_ARRAY || type == HandleType.GEN_ARRAY)
            return n.range != null ? n.range.count() : n.indexed.size();
        if (type == HandleType.INTEGER || type == HandleType.ENUM)
            return INTEGER_WIDTH;
        if (type == HandleType.STRING && n.visible() instanceof String s)
            return s.length();
        if (type == HandleType.MODULE || type == HandleType.STRUCTURE)
            return n.children.size();
        return 1;
    }

    @Override
    public PrimitiveIterator.OfLong iterate(long handle, IterationMode mode) {
        count("iterate");
        SimNode n = node(handle);
        List<SimNode> source = switch (mode) {
            case OBJECTS -> new ArrayList<>(n.children.values());
            case DRIVERS -> n.drivers;
            case LOADS -> n.loads;
        };
        return source.stream().mapToLong(c -> c.handle).iterator();
    }

    @Override
    public long readLong(long handle) {
        count("readLong");
        SimNode n = node(handle);
        Object v = n.visible();
        if (v instanceof Number num)
            return num.longValue();
        if (n.isVector())
            return new BitVector((String) v).toLong();
        throw new IllegalStateException("No integer value on " + n.path);
    }

    @Override
    public double readReal(long handle) {
        count("readReal");
        SimNode n = node(handle);
        if (n.visible() instanceof Number num)
            return num.doubleValue();
        throw new IllegalStateException("No real value on " + n.path);
    }

    @Override
    public String readString(long handle) {
        count("readString");
        return String.valueOf(node(handle).visible());
    }

    @Override
    public String readBinStr(long handle) {
        count("readBinStr");
        SimNode n = node(handle);
        Object v = n.visible();
        if (n.isVector())
            return (String) v;
        if (v instanceof Long || v instanceof Integer)
            return truncate(((Number) v).longValue(), INTEGER_WIDTH);
        return String.valueOf(v);
    }

    @Override
    public void writeLong(long handle, long value, ActionCode action) {
        count("writeLong");
        SimNode n = writable(handle);
        HandleType type = n.type();
        if (n.isVector())
            apply(n, truncate(value, n.width), action);
        else if (type == HandleType.INTEGER || type == HandleType.ENUM)
            apply(n, value, action);
        else if (type == HandleType.REAL)
            apply(n, (double) value, action);
        else
            throw new IllegalArgumentException("Integer write not supported on " + n.path);
    }

    @Override
    public void writeReal(long handle, double value, ActionCode action) {
        count("writeReal");
        SimNode n = writable(handle);
        if (n.type() != HandleType.REAL)
            throw new IllegalArgumentException("Real write not supported on " + n.path);
        apply(n, value, action);
    }

    @Override
    public void writeString(long handle, String value, ActionCode action) {
        count("writeString");
        SimNode n = writable(handle);
        if (n.type() != HandleType.STRING)
            throw new IllegalArgumentException("String write not supported on " + n.path);
        apply(n, value, action);
    }

    @Override
    public void writeBinStr(long handle, String value, ActionCode action) {
        count("writeBinStr");
        SimNode n = writable(handle);
        HandleType type = n.type();
        if (n.isVector())
            apply(n, fit(value, n.width), action);
        else if (type == HandleType.INTEGER || type == HandleType.ENUM)
            apply(n, new BitVector(value).toSignedBigInteger().longValue(), action);
        else
            throw new IllegalArgumentException("Bit-string write not supported on " + n.path);
    }

    // ── Internals ───────────────────────────────────────────────────

    private void apply(SimNode n, Object value, ActionCode action) {
        switch (action) {
            case DEPOSIT -> n.driven = value;
            case FORCE -> {
                n.forced = true;
                n.forcedValue = value;
            }
            case RELEASE -> {
                n.forced = false;
                n.forcedValue = null;
            }
        }
        log.trace("{} {} = {}", action, n.path, value);
    }

    private SimNode newNode(SimNode parent, String name, int typeCode) {
        SimNode n = new SimNode(nextHandle++, parent, name, typeCode);
        nodes.put(n.handle, n);
        if (n.isVector())
            n.driven = initialBits(n);
        return n;
    }

    private void register(SimNode n, String path) {
        n.path = path;
        byPath.put(path, n);
    }

    private SimNode node(long handle) {
        SimNode n = nodes.get(handle);
        if (n == null)
            throw new IllegalArgumentException("Invalid handle: " + handle);
        return n;
    }

    private SimNode writable(long handle) {
        SimNode n = node(handle);
        if (n.constant)
            throw new IllegalStateException("Cannot write constant " + n.path);
        return n;
    }

    private void count(String operation) {
        queryCounts.merge(operation, 1, Integer::sum);
    }

    private static String qualifiedName(SimNode n) {
        return n.parent == null ? n.name : qualifiedName(n.parent) + "." + n.name;
    }

    private static String initialBits(SimNode n) {
        char fill = n.type() == HandleType.NET ? 'z' : 'x';
        return String.valueOf(fill).repeat(n.width);
    }

    private static String toBits(SimNode n, Object value) {
        if (value instanceof BitVector bits)
            return fit(bits.binStr(), n.width);
        if (value instanceof BigInteger big)
            return BitVector.of(big.and(BigInteger.ONE.shiftLeft(n.width).subtract(BigInteger.ONE)), n.width).binStr();
        if (value instanceof Number num)
            return truncate(num.longValue(), n.width);
        if (value instanceof String s)
            return fit(new BitVector(s).binStr(), n.width);
        throw new IllegalArgumentException("Unsupported bit-vector value: " + value);
    }

    // Two's complement of the value, keeping only the low bits.
    private static String truncate(long value, int width) {
        BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
        return BitVector.of(BigInteger.valueOf(value).and(mask), width).binStr();
    }

    // Zero-extends or drops high bits so the pattern matches the width.
    private static String fit(String bits, int width) {
        String normalized = new BitVector(bits).binStr();
        if (normalized.length() >= width)
            return normalized.substring(normalized.length() - width);
        return "0".repeat(width - normalized.length()) + normalized;
    }

    private static final class SimNode {
        final long handle;
        final SimNode parent;
        final String name;
        final int typeCode;
        final Map<String, SimNode> children = new LinkedHashMap<>();
        final Map<Integer, SimNode> indexed = new TreeMap<>();
        final List<SimNode> drivers = new ArrayList<>();
        final List<SimNode> loads = new ArrayList<>();
        String path;
        String definitionName;
        String definitionFile;
        Range range;
        int width = 1;
        boolean constant;
        boolean hidden;
        Object driven;
        boolean forced;
        Object forcedValue;

        SimNode(long handle, SimNode parent, String name, int typeCode) {
            this.handle = handle;
            this.parent = parent;
            this.name = name;
            this.typeCode = typeCode;
        }

        HandleType type() {
            return HandleType.fromCode(typeCode);
        }

        boolean isVector() {
            HandleType t = type();
            return t == HandleType.REGISTER || t == HandleType.NET;
        }

        Object visible() {
            return forced ? forcedValue : driven;
        }
    }
}
