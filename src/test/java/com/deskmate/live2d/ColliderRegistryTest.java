package com.deskmate.live2d;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColliderRegistryTest {

    @Test
    void shapesMatchTheirOwnArea() {
        ColliderRegistry registry = new ColliderRegistry();
        registry.register(Collider.rect("box", 0, 0, 10, 5));
        registry.register(Collider.circle("dot", 20, 20, 2));
        registry.register(Collider.polygon("tri", List.of(
            new double[]{30, 0}, new double[]{40, 0}, new double[]{30, 10})));

        assertEquals(List.of("box"), registry.query(10, 5, null));
        assertEquals(List.of("dot"), registry.query(21, 21, null));
        assertEquals(List.of("tri"), registry.query(32, 2, null));
        assertTrue(registry.query(39, 9, null).isEmpty());
        assertTrue(registry.query(-1, 0, null).isEmpty());
    }

    @Test
    void disabledColliderNeverMatches() {
        ColliderRegistry registry = new ColliderRegistry();
        Collider box = Collider.rect("box", 0, 0, 1, 1);
        box.setEnabled(false);
        registry.register(box);

        assertTrue(registry.query(0.5, 0.5, null).isEmpty());
    }

    @Test
    void polygonWithTooFewPointsNeverMatches() {
        Collider line = Collider.polygon("line", List.of(new double[]{0, 0}, new double[]{1, 1}));
        assertFalse(line.contains(0.5, 0.5, null));
    }

    @Test
    void registeringSameNameReplacesCollider() {
        ColliderRegistry registry = new ColliderRegistry();
        registry.register(Collider.rect("head", 0, 0, 1, 1));
        registry.register(Collider.rect("head", 5, 5, 1, 1));

        assertEquals(1, registry.list().size());
        assertTrue(registry.query(0.5, 0.5, null).isEmpty());
        assertEquals(List.of("head"), registry.query(5.5, 5.5, null));
        assertTrue(registry.remove("head"));
        assertFalse(registry.remove("head"));
    }

    @Test
    void hitAreaAsksTheBackend() {
        CapabilityCache capabilities = new CapabilityCache();
        capabilities.attach(new OperationTable()
            .register("HitTest", 3, args -> "Head".equals(args[0]) && ((Number) args[2]).floatValue() < 0.5f));
        Collider head = Collider.hitArea("head", "Head");
        Collider body = Collider.hitArea("body", "Body");

        assertTrue(head.contains(0.0, 0.2, capabilities));
        assertFalse(head.contains(0.0, 0.8, capabilities));
        assertFalse(body.contains(0.0, 0.2, capabilities));
        assertFalse(head.contains(0.0, 0.2, new CapabilityCache()));
    }

    @Test
    void clickRunsHandlersOfHitCollidersAndIsolatesFailures() {
        ColliderRegistry registry = new ColliderRegistry();
        registry.register(Collider.rect("head", 0, 0, 10, 10));
        registry.register(Collider.rect("tail", 50, 50, 10, 10));
        List<String> calls = new ArrayList<>();
        registry.addClickHandler("head", (name, x, y) -> {
            throw new IllegalStateException("boom");
        });
        registry.addClickHandler("head", (name, x, y) -> calls.add(name + "@" + x + "," + y));
        registry.addClickHandler("tail", (name, x, y) -> calls.add("tail"));

        assertEquals(List.of("head"), registry.dispatchClick(1, 2, null));
        assertEquals(List.of("head@1.0,2.0"), calls);

        assertTrue(registry.dispatchClick(30, 30, null).isEmpty());
        assertEquals(1, calls.size());
    }

    @Test
    void removedHandlerIsNotCalled() {
        ColliderRegistry registry = new ColliderRegistry();
        registry.register(Collider.rect("head", 0, 0, 10, 10));
        List<String> calls = new ArrayList<>();
        ClickHandler handler = (name, x, y) -> calls.add(name);
        registry.addClickHandler("head", handler);

        assertTrue(registry.removeClickHandler("head", handler));
        registry.dispatchClick(1, 1, null);
        assertTrue(calls.isEmpty());
    }

    @Test
    void colliderNeedsName() {
        assertThrows(IllegalArgumentException.class, () -> Collider.rect(" ", 0, 0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> Collider.hitArea("head", ""));
    }
}
