package com.hdlsim.proxy.io;

import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.api.Range;
import com.hdlsim.proxy.sim.InMemorySimulator;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PrimitiveIterator;

/**
 * Builds an {@link InMemorySimulator} from a JSON {@link DesignDefinition}.
 *
 * Loading runs in two passes. The first creates every object, expanding
 * auto-expand arrays as it goes. The second connects driver and load lists,
 * which refer to other objects by path and so need the whole design in place.
 */
public final class JsonDesignLoader {
    private static final Logger log = LogManager.getLogger(JsonDesignLoader.class);

    private static final String DEFAULT_ELEMENT_FORMAT = "%s[%d]";

    private final ObjectMapper mapper = new ObjectMapper();

    public LoadedDesign load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public LoadedDesign load(InputStream in) throws IOException {
        return build(mapper.readValue(in, DesignDefinition.class));
    }

    public LoadedDesign parse(String json) throws IOException {
        return build(mapper.readValue(json, DesignDefinition.class));
    }

    /**
     * Loads a design bundled on the classpath, e.g. {@code designs/soc.json}.
     *
     * @throws IOException if the resource is missing or unreadable
     */
    public LoadedDesign loadResource(String resource) throws IOException {
        try (InputStream in = JsonDesignLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Design resource not found: " + resource);
            return load(in);
        }
    }

    /**
     * Builds the simulator for a parsed definition.
     *
     * @throws IllegalArgumentException if the definition is inconsistent
     */
    public LoadedDesign build(DesignDefinition def) {
        DesignDefinition.DesignInfo info = def.getDesign();
        if (info == null)
            throw new IllegalArgumentException("Missing 'design' key");
        if (info.getRoots() == null || info.getRoots().isEmpty())
            throw new IllegalArgumentException("Design " + info.getName() + " has no roots");

        InMemorySimulator sim = new InMemorySimulator();
        sim.setQualifiedNames(info.isQualifiedNames());

        List<String> rootNames = new ArrayList<>();
        List<Connection> connections = new ArrayList<>();

        // 1. Create objects
        for (DesignDefinition.ObjectDef rootDef : info.getRoots()) {
            if (rootDef.getType() != null && HandleType.fromString(rootDef.getType()) != HandleType.MODULE)
                throw new IllegalArgumentException("Root " + rootDef.getName() + " must be a module");
            long root = sim.addRoot(rootDef.getName());
            rootNames.add(rootDef.getName());
            configure(sim, root, rootDef, rootDef.getName(), connections);
        }

        // 2. Connect drivers and loads
        for (Connection c : connections) {
            long target = sim.handleAt(c.targetPath());
            if (target == NativeSimulator.NULL_HANDLE)
                throw new IllegalArgumentException(
                        "Unknown " + (c.driver() ? "driver" : "load") + " " + c.targetPath() + " of " + c.ownerPath());
            if (c.driver())
                sim.addDriver(c.owner(), target);
            else
                sim.addLoad(c.owner(), target);
        }

        log.info("Loaded design {} ({} objects, roots={})", info.getName(), sim.objectCount(), rootNames);
        return new LoadedDesign(info.getName(), sim, Collections.unmodifiableList(rootNames));
    }

    private void createChild(InMemorySimulator sim, long parent, String parentPath, DesignDefinition.ObjectDef od,
            List<Connection> connections) {
        if (od.getName() == null && od.getIndex() == null)
            throw new IllegalArgumentException("Object under " + parentPath + " has neither name nor index");

        int code = typeCode(od);
        long h;
        String path;
        if (od.getIndex() != null) {
            String nativeName = od.getNativeName() != null ? od.getNativeName()
                    : String.format(DEFAULT_ELEMENT_FORMAT, lastSegment(parentPath), od.getIndex());
            h = sim.addElement(parent, od.getIndex(), nativeName, code);
            path = parentPath + "[" + od.getIndex() + "]";
        } else if (od.isHidden()) {
            h = sim.addHiddenChild(parent, od.getName(), code);
            path = parentPath + "." + od.getName();
        } else {
            h = sim.add(parent, od.getName(), code);
            path = parentPath + "." + od.getName();
        }
        configure(sim, h, od, path, connections);
    }

    private void configure(InMemorySimulator sim, long h, DesignDefinition.ObjectDef od, String path,
            List<Connection> connections) {
        if (od.getWidth() != null)
            sim.setWidth(h, od.getWidth());
        if (od.getLeft() != null || od.getRight() != null) {
            if (od.getLeft() == null || od.getRight() == null)
                throw new IllegalArgumentException("Range of " + path + " needs both left and right");
            sim.setRange(h, new Range(od.getLeft(), od.getRight()));
        }
        if (od.getDefinitionName() != null || od.getDefinitionFile() != null)
            sim.setDefinition(h, od.getDefinitionName(), od.getDefinitionFile());
        if (od.getValue() != null)
            sim.setStoredValue(h, od.getValue());

        if (od.getChildren() != null) {
            for (DesignDefinition.ObjectDef child : od.getChildren())
                createChild(sim, h, path, child, connections);
        }
        if (od.isAutoExpand())
            expand(sim, h, od, path, connections);

        if (od.getDrivers() != null)
            od.getDrivers().forEach(d -> connections.add(new Connection(h, path, d, true)));
        if (od.getLoads() != null)
            od.getLoads().forEach(l -> connections.add(new Connection(h, path, l, false)));

        // Last, so initial values can still be stored above.
        if (od.isConstant())
            sim.setConstant(h, true);
    }

    // ── Auto-expand ─────────────────────────────────────────────────

    private void expand(InMemorySimulator sim, long array, DesignDefinition.ObjectDef od, String path,
            List<Connection> connections) {
        List<Integer> indices = expansionIndices(od, path);
        String format = od.getElementNameFormat() != null ? od.getElementNameFormat() : DEFAULT_ELEMENT_FORMAT;
        boolean scopes = HandleType.GEN_ARRAY.name().equalsIgnoreCase(od.getType());

        int elementCode;
        if (od.getElementType() != null)
            elementCode = HandleType.fromString(od.getElementType()).code();
        else
            elementCode = scopes ? HandleType.MODULE.code() : HandleType.REGISTER.code();

        List<Object> values = od.getValues();
        if (values != null && values.size() != indices.size())
            throw new IllegalArgumentException("Array " + path + " has " + indices.size()
                    + " elements but " + values.size() + " initial values");

        for (int pos = 0; pos < indices.size(); pos++) {
            int index = indices.get(pos);
            long element = sim.addElement(array, index, String.format(format, od.getName(), index), elementCode);
            String elementPath = path + "[" + index + "]";
            if (od.getElementWidth() != null)
                sim.setWidth(element, od.getElementWidth());
            if (values != null && values.get(pos) != null)
                sim.setStoredValue(element, values.get(pos));
            if (od.getElementChildren() != null) {
                for (DesignDefinition.ObjectDef child : od.getElementChildren())
                    createChild(sim, element, elementPath, child, connections);
            }
        }
        log.debug("Expanded {} into {} elements", path, indices.size());
    }

    private static List<Integer> expansionIndices(DesignDefinition.ObjectDef od, String path) {
        if (od.getIndices() != null)
            return od.getIndices();
        if (od.getLeft() == null || od.getRight() == null)
            throw new IllegalArgumentException("Auto-expanded array " + path + " needs a range or indices");
        List<Integer> result = new ArrayList<>();
        PrimitiveIterator.OfInt walk = new Range(od.getLeft(), od.getRight()).walk();
        walk.forEachRemaining((int i) -> result.add(i));
        return result;
    }

    private static int typeCode(DesignDefinition.ObjectDef od) {
        if (od.getTypeCode() != null)
            return od.getTypeCode();
        if (od.getType() == null)
            throw new IllegalArgumentException("Object " + od.getName() + " has no type");
        return HandleType.fromString(od.getType()).code();
    }

    private static String lastSegment(String path) {
        int dot = path.lastIndexOf('.');
        String local = dot < 0 ? path : path.substring(dot + 1);
        int bracket = local.indexOf('[');
        return bracket < 0 ? local : local.substring(0, bracket);
    }

    private record Connection(long owner, String ownerPath, String targetPath, boolean driver) {
    }

    /** The result of loading: a design ready to be wrapped in a context. */
    public record LoadedDesign(String name, InMemorySimulator simulator, List<String> roots) {
    }
}
