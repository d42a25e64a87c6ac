package com.hdlsim.proxy.handle;

import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.api.Range;
import com.hdlsim.proxy.engine.SimulationContext;
import com.hdlsim.proxy.error.IndexOutOfRangeException;
import com.hdlsim.proxy.error.ReadOnlyIndexException;
import com.hdlsim.proxy.error.UnsupportedAssignmentException;
import com.hdlsim.proxy.error.UnsupportedIndexException;
import com.hdlsim.proxy.sim.InMemorySimulator;

import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.Assert.*;

public class HierarchyArrayObjectTest {
    private InMemorySimulator sim;
    private long root;

    @Before
    public void setUp() {
        sim = new InMemorySimulator();
        root = sim.addRoot("top");
    }

    private HierarchyObject top() {
        return SimulationContext.builder(sim).build().root("top");
    }

    private void assertDiscovers(String format) {
        sim.addGenArray(root, "blk", format, 0, 1, 2);
        HierarchyArrayObject blk = top().child("blk");
        assertEquals(3, blk.length());
        assertEquals(List.of(0, 1, 2), blk.indices());
        assertEquals("top.blk[1]", blk.get(1).path());
    }

    @Test
    public void testDoubleUnderscoreNames() {
        assertDiscovers("%s__%d");
    }

    @Test
    public void testParenthesisNames() {
        assertDiscovers("%s(%d)");
    }

    @Test
    public void testBracketNames() {
        assertDiscovers("%s[%d]");
    }

    @Test
    public void testQualifiedNames() {
        sim.setQualifiedNames(true);
        assertDiscovers("%s[%d]");
    }

    @Test
    public void testUnmatchedNamesAreDropped() {
        long blk = sim.addGenArray(root, "blk", "%s[%d]", 0, 1);
        sim.addElement(blk, 5, "other_5", HandleType.MODULE.code());
        HierarchyArrayObject arr = top().child("blk");
        assertEquals(2, arr.length());
        assertEquals(List.of(0, 1), arr.indices());
    }

    @Test
    public void testIndexPatternMustMatchWholeName() {
        assertFalse(IndexNamePatterns.BRACKETS.extractIndex("blk", "xblk[1]").isPresent());
        assertFalse(IndexNamePatterns.BRACKETS.extractIndex("blk", "blk[1]x").isPresent());
        assertEquals(OptionalInt.of(12), IndexNamePatterns.DOUBLE_UNDERSCORE.extractIndex("g.x", "g.x__12"));
        assertFalse(IndexNamePatterns.DOUBLE_UNDERSCORE.extractIndex("g.x", "gax__12").isPresent());
        assertEquals(OptionalInt.of(3), IndexNamePatterns.PARENTHESES.extractIndex("a+b", "a+b(3)"));
        assertFalse(IndexNamePatterns.PARENTHESES.extractIndex("blk", "blk").isPresent());
        assertFalse(IndexNamePatterns.BRACKETS.extractIndex("blk", "blk[]").isPresent());
    }

    @Test
    public void testElementsAreScopes() {
        long blk = sim.addGenArray(root, "blk", "%s[%d]", 0, 1);
        long element = sim.childByIndex(blk, 1);
        sim.addRegister(element, "valid", 1);

        HierarchyArrayObject arr = top().child("blk");
        HierarchyObject lane = arr.element(1);
        ModifiableObject valid = lane.child("valid");
        assertEquals("top.blk[1].valid", valid.path());
        assertSame(lane, arr.get(1));
    }

    @Test
    public void testDeclaredRangeDrivesIndices() {
        long blk = sim.addGenArray(root, "blk", "%s[%d]", 3, 2, 1);
        sim.setRange(blk, new Range(3, 1));
        HierarchyArrayObject arr = top().child("blk");
        assertEquals(List.of(3, 2, 1), arr.indices());
    }

    @Test
    public void testMissingIndex() {
        sim.addGenArray(root, "blk", "%s[%d]", 0);
        HierarchyArrayObject arr = top().child("blk");
        try {
            arr.get(4);
            fail("No element at 4");
        } catch (IndexOutOfRangeException e) {
            assertEquals(4, e.index());
            assertTrue(e.getMessage().contains("no object at index 4"));
        }
    }

    @Test
    public void testNotAssignable() {
        sim.addGenArray(root, "blk", "%s[%d]", 0);
        HierarchyArrayObject arr = top().child("blk");
        try {
            arr.set(0, 1);
            fail("Generate arrays are read-only");
        } catch (ReadOnlyIndexException e) {
            assertTrue(e instanceof UnsupportedAssignmentException);
        }
        try {
            arr.slice(0, 1);
            fail("Slices are not supported");
        } catch (UnsupportedIndexException e) {
            assertTrue(e.getMessage().contains("Slice"));
        }
    }
}
