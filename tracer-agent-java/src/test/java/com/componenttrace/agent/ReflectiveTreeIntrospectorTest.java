package com.componenttrace.agent;

import com.componenttrace.agent.toyhost.Counter;
import com.componenttrace.agent.toyhost.Label;
import com.componenttrace.agent.toyhost.ToyComponent;
import com.componenttrace.agent.toyhost.ToyRenderer;
import com.componenttrace.core.introspect.HostTreeEntry;
import com.componenttrace.core.introspect.HostTreeSnapshot;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReflectiveTreeIntrospectorTest {

    private static final HostBinding BINDING =
        HostBinding.defaults(ToyComponent.class.getName(), ToyRenderer.class.getName());

    @Test
    void readsComponentsIdsAndParents() throws Exception {
        ToyRenderer renderer = new ToyRenderer();
        ToyComponent root = renderer.instantiateComponent(Counter.class.getName());
        ToyComponent child = renderer.instantiateComponent(Label.class.getName());
        int rootId = renderer.attachComponent(root, null);
        int childId = renderer.attachComponent(child, rootId);

        HostTreeSnapshot snapshot = new ReflectiveTreeIntrospector(renderer, BINDING).introspect();

        assertTrue(snapshot.isSupported());
        assertEquals(2, snapshot.size());
        HostTreeEntry rootEntry = snapshot.entries().get(rootId);
        assertSame(root, rootEntry.instance());
        assertNull(rootEntry.parentId());
        assertEquals("Counter", rootEntry.type().shortName());

        HostTreeEntry childEntry = snapshot.entries().get(childId);
        assertSame(child, childEntry.instance());
        assertEquals(rootId, childEntry.parentId());
    }

    @Test
    void emptyRendererGivesEmptySupportedSnapshot() {
        HostTreeSnapshot snapshot = new ReflectiveTreeIntrospector(new ToyRenderer(), BINDING).introspect();
        assertTrue(snapshot.isSupported());
        assertEquals(0, snapshot.size());
    }

    @Test
    void seesComponentsRemovedBetweenPasses() throws Exception {
        ToyRenderer renderer = new ToyRenderer();
        int id = renderer.attachComponent(renderer.instantiateComponent(Counter.class.getName()), null);
        ReflectiveTreeIntrospector introspector = new ReflectiveTreeIntrospector(renderer, BINDING);
        assertEquals(1, introspector.introspect().size());

        renderer.unmount(id);
        assertEquals(0, introspector.introspect().size());
    }

    // --- Unsupported layouts ---

    static class NoMapRenderer {
        final List<Object> components = List.of();
    }

    static class OpaqueState {
        final Object payload = new Object();
    }

    static class OpaqueRenderer {
        private final Map<Integer, OpaqueState> componentStateById = new HashMap<>(Map.of(1, new OpaqueState()));
    }

    @Test
    void rendererWithoutMapIsUnsupported() {
        ReflectiveTreeIntrospector introspector = new ReflectiveTreeIntrospector(new NoMapRenderer(), BINDING);
        assertFalse(introspector.introspect().isSupported());
        assertTrue(introspector.isUnsupported());
    }

    @Test
    void unrecognizedStateTypeIsUnsupportedFromThenOn() {
        ReflectiveTreeIntrospector introspector = new ReflectiveTreeIntrospector(new OpaqueRenderer(), BINDING);
        assertFalse(introspector.introspect().isSupported());
        assertFalse(introspector.introspect().isSupported());
        assertTrue(introspector.isUnsupported());
    }

    // --- Fallbacks ---

    static class Node {
        final int id;
        final Object instance;
        final Integer parent;

        Node(int id, Object instance, Integer parent) {
            this.id = id;
            this.instance = instance;
            this.parent = parent;
        }
    }

    static class RenamedRenderer {
        private final Map<String, Node> registry = new HashMap<>();
    }

    static class LazyRenderer {
        private Map<Integer, Node> componentStateById;
    }

    @Test
    void unallocatedStateMapIsUnsupportedForThatPassOnly() {
        LazyRenderer renderer = new LazyRenderer();
        ReflectiveTreeIntrospector introspector = new ReflectiveTreeIntrospector(renderer, BINDING);

        assertFalse(introspector.introspect().isSupported());
        assertFalse(introspector.isUnsupported());

        renderer.componentStateById = new HashMap<>();
        renderer.componentStateById.put(4, new Node(4, new Object(), null));
        HostTreeSnapshot snapshot = introspector.introspect();
        assertTrue(snapshot.isSupported());
        assertEquals(1, snapshot.size());
    }

    @Test
    void mapFoundByTypeAndIdsReadFromState() {
        RenamedRenderer renderer = new RenamedRenderer();
        Object a = new Object();
        Object b = new Object();
        renderer.registry.put("a", new Node(10, a, null));
        renderer.registry.put("b", new Node(11, b, 10));

        HostTreeSnapshot snapshot = new ReflectiveTreeIntrospector(renderer, BINDING).introspect();

        assertTrue(snapshot.isSupported());
        assertSame(a, snapshot.entries().get(10).instance());
        assertSame(b, snapshot.entries().get(11).instance());
        assertEquals(10, snapshot.entries().get(11).parentId());
    }

    @Test
    void collectedRendererIsUnsupported() {
        ReflectiveTreeIntrospector introspector = new ReflectiveTreeIntrospector(null, BINDING);
        assertFalse(introspector.introspect().isSupported());
        assertTrue(introspector.isDetached());
        assertFalse(new ReflectiveTreeIntrospector(new ToyRenderer(), BINDING).isDetached());
    }
}
