package com.hdlsim.proxy.handle;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Element naming schemes of the supported simulator interfaces. */
public enum IndexNamePatterns implements IndexNamePattern {
    /** VHPI (Aldec): {@code name__3} */
    DOUBLE_UNDERSCORE("__(\\d+)"),
    /** FLI and VHPI (IUS): {@code name(3)} */
    PARENTHESES("\\((\\d+)\\)"),
    /** VPI: {@code name[3]} */
    BRACKETS("\\[(\\d+)\\]");

    private final Pattern suffix;

    IndexNamePatterns(String suffix) {
        this.suffix = Pattern.compile(suffix);
    }

    @Override
    public OptionalInt extractIndex(String arrayName, String childName) {
        if (!childName.startsWith(arrayName))
            return OptionalInt.empty();
        Matcher m = suffix.matcher(childName).region(arrayName.length(), childName.length());
        if (!m.matches())
            return OptionalInt.empty();
        return OptionalInt.of(Integer.parseInt(m.group(1)));
    }
}
