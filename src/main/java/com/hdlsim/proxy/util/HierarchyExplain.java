package com.hdlsim.proxy.util;

import com.hdlsim.proxy.handle.NonConstantObject;
import com.hdlsim.proxy.handle.NonHierarchyIndexableObject;
import com.hdlsim.proxy.handle.NonHierarchyObject;
import com.hdlsim.proxy.handle.RegionObject;
import com.hdlsim.proxy.handle.SimHandleBase;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Diagnostic utility for inspecting a design through its proxies.
 *
 * <p>
 * Generates human-readable text for a single object or for a whole subtree.
 * Rendering a tree runs discovery on every scope it visits and reads every
 * value, so it is meant for debugging sessions and error reports, not for use
 * inside a time step that is sensitive to simulator calls.
 */
public final class HierarchyExplain {
    private static final Logger log = LogManager.getLogger(HierarchyExplain.class);

    private HierarchyExplain() {
    }

    /**
     * Dumps the metadata and current value of a single object.
     */
    public static String explainObject(SimHandleBase obj) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Object: ").append(obj.path()).append('\n')
                .append("  Proxy: ").append(obj.getClass().getSimpleName()).append('\n')
                .append("  Native type: ").append(obj.typeName()).append('\n')
                .append("  Length: ").append(obj.length()).append('\n');
        if (obj.definitionName() != null)
            sb.append("  Definition: ").append(obj.definitionName()).append('\n');
        if (obj.definitionFile() != null)
            sb.append("  Defined in: ").append(obj.definitionFile()).append('\n');
        if (obj instanceof NonHierarchyIndexableObject array && array.range() != null)
            sb.append("  Range: ").append(array.range()).append('\n');
        if (obj instanceof NonHierarchyObject value)
            sb.append("  Value: ").append(valueText(value)).append('\n');
        if (obj instanceof NonConstantObject signal) {
            appendPaths(sb, "Drivers", signal.drivers());
            appendPaths(sb, "Loads", signal.loads());
        }
        return sb.toString();
    }

    /**
     * Renders the subtree below a region, one object per line, indented by
     * depth. Array elements appear individually, in the order iteration yields
     * them.
     */
    public static String explainTree(RegionObject<?> root) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append(root.path()).append(" (").append(root.typeName()).append(")\n");
        appendChildren(sb, root, 1);
        return sb.toString();
    }

    private static void appendChildren(StringBuilder sb, RegionObject<?> region, int depth) {
        for (SimHandleBase child : region) {
            sb.append("  ".repeat(depth)).append(child.path()).append(" (").append(child.typeName()).append(')');
            if (child instanceof NonHierarchyObject value && !(child instanceof NonHierarchyIndexableObject))
                sb.append(" = ").append(valueText(value));
            sb.append('\n');
            if (child instanceof RegionObject<?> sub)
                appendChildren(sb, sub, depth + 1);
        }
    }

    private static void appendPaths(StringBuilder sb, String label, List<SimHandleBase> objects) {
        sb.append("  ").append(label).append(" (").append(objects.size()).append("): ");
        for (int i = 0; i < objects.size(); i++) {
            sb.append(objects.get(i).path());
            if (i < objects.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }

    static String valueText(NonHierarchyObject obj) {
        try {
            return String.valueOf(obj.getValue());
        } catch (RuntimeException e) {
            log.debug("Unable to read {}: {}", obj.path(), e.getMessage());
            return "<unreadable: " + e.getMessage() + ">";
        }
    }
}
