package com.hdlsim.proxy.io;

import com.hdlsim.proxy.api.HandleType;
import com.hdlsim.proxy.api.NativeSimulator;
import com.hdlsim.proxy.engine.SimulationContext;
import com.hdlsim.proxy.handle.ConstantObject;
import com.hdlsim.proxy.handle.HierarchyArrayObject;
import com.hdlsim.proxy.handle.HierarchyObject;
import com.hdlsim.proxy.handle.IntegerObject;
import com.hdlsim.proxy.handle.ModifiableObject;
import com.hdlsim.proxy.handle.NonHierarchyIndexableObject;
import com.hdlsim.proxy.handle.StringObject;
import com.hdlsim.proxy.sim.InMemorySimulator;
import com.hdlsim.proxy.value.BitVector;

import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.Assert.*;

public class JsonDesignLoaderTest {
    private JsonDesignLoader.LoadedDesign design;
    private HierarchyObject top;

    @Before
    public void setUp() throws IOException {
        design = new JsonDesignLoader().loadResource("designs/soc.json");
        top = SimulationContext.builder(design.simulator()).build().root("top");
    }

    @Test
    public void testDesignMetadata() {
        assertEquals("soc", design.name());
        assertEquals(List.of("top"), design.roots());
        assertEquals("top", top.definitionName());
        assertEquals("rtl/top.sv", top.definitionFile());
        HierarchyObject core = top.child("u_core");
        assertEquals("core", core.definitionName());
    }

    @Test
    public void testInitialValues() {
        assertEquals(new BitVector("0"), top.<ModifiableObject>child("clk").getValue());
        assertEquals(Long.valueOf(0), top.<IntegerObject>child("counter").getValue());
        assertEquals("idle", top.<StringObject>child("label").getValue());
        assertEquals(8L, top.<ConstantObject>child("DATA_WIDTH").getValue());
        assertEquals(new BitVector("10100101"), top.<ConstantObject>child("RESET_VALUE").getValue());
        assertEquals(64, top.getChild("wide").length());
    }

    @Test
    public void testAutoExpandedValueArray() {
        NonHierarchyIndexableObject mem = top.child("mem");
        assertEquals(8, mem.length());
        assertEquals(7, mem.range().left());
        List<Object> values = mem.getValue();
        assertEquals(new BitVector("00000111"), values.get(0));
        assertEquals(new BitVector("00000000"), values.get(7));
        assertEquals("top.mem[7]", mem.get(7).path());
    }

    @Test
    public void testAutoExpandedGenerateArray() {
        HierarchyArrayObject lanes = top.child("lanes");
        assertEquals(List.of(0, 1, 2), lanes.indices());
        HierarchyObject lane = lanes.element(2);
        ModifiableObject payload = lane.child("payload");
        assertEquals("top.lanes[2].payload", payload.path());
        assertEquals(16, payload.length());
    }

    @Test
    public void testDriversAndLoads() {
        HierarchyObject core = top.child("u_core");
        ModifiableObject acc = core.child("acc");
        assertSame(top.getChild("data"), acc.drivers().get(0));
        assertSame(core.getChild("result"), acc.loads().get(0));
    }

    @Test
    public void testParseInline() throws IOException {
        String json = "{\"design\":{\"name\":\"tiny\",\"qualifiedNames\":true,\"roots\":[{\"name\":\"t\","
                + "\"children\":[{\"name\":\"odd\",\"typeCode\":42},"
                + "{\"name\":\"arr\",\"type\":\"NET_ARRAY\",\"left\":0,\"right\":1,\"children\":["
                + "{\"index\":0,\"type\":\"REGISTER\",\"width\":2,\"value\":3},"
                + "{\"index\":1,\"type\":\"REGISTER\",\"width\":2}]}]}]}}";
        JsonDesignLoader.LoadedDesign tiny = new JsonDesignLoader().parse(json);
        InMemorySimulator sim = tiny.simulator();
        long arr = sim.handleAt("t.arr");
        assertNotEquals(NativeSimulator.NULL_HANDLE, arr);
        assertEquals("t.arr.arr[0]", sim.nameOf(sim.childByIndex(arr, 0)));
        assertEquals("11", sim.readBinStr(sim.handleAt("t.arr[0]")));
        assertEquals(42, sim.typeOf(sim.handleAt("t.odd")));

        HierarchyObject t = SimulationContext.builder(sim).build().root("t");
        assertEquals(java.util.Set.of("arr"), t.childNames());
    }

    @Test
    public void testInvalidDefinitions() throws IOException {
        JsonDesignLoader loader = new JsonDesignLoader();
        String[] bad = {
                "{}",
                "{\"design\":{\"name\":\"x\",\"roots\":[]}}",
                "{\"design\":{\"roots\":[{\"name\":\"t\",\"type\":\"NET\"}]}}",
                "{\"design\":{\"roots\":[{\"name\":\"t\",\"children\":[{\"name\":\"n\"}]}]}}",
                "{\"design\":{\"roots\":[{\"name\":\"t\",\"children\":[{\"name\":\"r\",\"type\":\"REGISTER\","
                        + "\"drivers\":[\"t.nope\"]}]}]}}",
                "{\"design\":{\"roots\":[{\"name\":\"t\",\"children\":[{\"name\":\"a\",\"type\":\"NET_ARRAY\","
                        + "\"autoExpand\":true}]}]}}",
        };
        for (String json : bad) {
            try {
                loader.parse(json);
                fail("Should reject " + json);
            } catch (IllegalArgumentException e) {
                assertNotNull(e.getMessage());
            }
        }
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        new JsonDesignLoader().loadResource("designs/none.json");
    }

    @Test
    public void testDefaultTypeIsModuleForRoots() {
        assertEquals(HandleType.MODULE.code(), design.simulator().typeOf(top.handle()));
    }
}
