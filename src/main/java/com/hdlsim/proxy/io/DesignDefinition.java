package com.hdlsim.proxy.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of an elaborated design, as read from a JSON design
 * file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DesignDefinition {
    private DesignInfo design;

    /** Meta-information about the design plus its top-level instances. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class DesignInfo {
        private String name, version;
        private boolean qualifiedNames;
        private List<ObjectDef> roots;
    }

    /**
     * Definition of a single object.
     *
     * {@code type} is a {@code HandleType} name; {@code typeCode} overrides it
     * with a raw native tag. {@code index} marks the object as an element of
     * its parent array, reported natively as {@code nativeName}.
     *
     * Arrays with {@code autoExpand} set get one element per index of their
     * range (or of {@code indices}), named with {@code elementNameFormat}.
     * Value arrays take {@code elementType}, {@code elementWidth} and initial
     * {@code values} in range order; generate arrays copy
     * {@code elementChildren} into every element scope.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ObjectDef {
        private String name, type, nativeName;
        private Integer typeCode, width, left, right, index;
        private Object value;
        private boolean constant, hidden;
        private String definitionName, definitionFile;
        private List<ObjectDef> children;
        private List<String> drivers, loads;

        private boolean autoExpand;
        private String elementType, elementNameFormat;
        private Integer elementWidth;
        private List<Integer> indices;
        private List<Object> values;
        private List<ObjectDef> elementChildren;
    }
}
