package com.hdlsim.proxy.api;

/**
 * Object kinds reported by the native simulation interface.
 *
 * Each constant carries the integer tag the native layer returns from
 * {@link NativeSimulator#typeOf(long)}. The tag, not the enum, is what crosses
 * the native boundary: a backend may report a code that has no constant here,
 * in which case {@link #fromCode(int)} returns null and resolution fails with
 * an unknown-type error.
 */
public enum HandleType {
    UNKNOWN(0),
    MEMORY(1),
    MODULE(2),
    NET(3),
    PARAMETER(4),
    REGISTER(5),
    NET_ARRAY(6),
    ENUM(7),
    STRUCTURE(8),
    REAL(9),
    INTEGER(10),
    STRING(11),
    GEN_ARRAY(12);

    private static final HandleType[] BY_CODE = new HandleType[13];

    static {
        for (HandleType t : values())
            BY_CODE[t.code] = t;
    }

    private final int code;

    HandleType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Native display name, e.g. {@code GPI_MODULE}. */
    public String displayName() {
        return "GPI_" + name().replace("_", "");
    }

    /**
     * True for kinds that are structural containers (scopes and arrays).
     * These are never turned into constant snapshots even when the native
     * layer flags them as constant.
     */
    public boolean isStructural() {
        return this == MODULE || this == STRUCTURE || this == NET_ARRAY || this == GEN_ARRAY;
    }

    /**
     * @param code native type tag
     * @return the matching kind, or null if the tag is not known
     */
    public static HandleType fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length)
            return null;
        return BY_CODE[code];
    }

    public static HandleType fromString(String text) {
        for (HandleType t : HandleType.values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown HandleType: " + text);
    }
}
