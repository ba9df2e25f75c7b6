package com.deskmate.live2d;

import com.deskmate.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Colliders plus the click handlers bound to them by collider name. Registering a collider
 * under an existing name replaces it. Handlers survive {@link #replaceColliders}.
 */
public class ColliderRegistry {

    private static final String COMPONENT = "Colliders";

    private final List<Collider> colliders = new CopyOnWriteArrayList<>();
    private final List<Binding> handlers = new CopyOnWriteArrayList<>();

    public synchronized void register(Collider collider) {
        if (collider == null) {
            throw new IllegalArgumentException("Collider is required");
        }
        colliders.removeIf(existing -> existing.getName().equals(collider.getName()));
        colliders.add(collider);
    }

    public synchronized boolean remove(String name) {
        return colliders.removeIf(existing -> existing.getName().equals(name));
    }

    public synchronized void clear() {
        colliders.clear();
    }

    public synchronized void replaceColliders(List<Collider> replacement) {
        colliders.clear();
        if (replacement != null) {
            replacement.forEach(this::register);
        }
    }

    public List<Collider> list() {
        return new ArrayList<>(colliders);
    }

    /**
     * Names of the colliders containing the point, in registration order. A collider whose
     * test throws is skipped.
     */
    public List<String> query(double x, double y, CapabilityCache capabilities) {
        List<String> names = new ArrayList<>();
        for (Collider collider : colliders) {
            try {
                if (collider.contains(x, y, capabilities)) {
                    names.add(collider.getName());
                }
            } catch (RuntimeException e) {
                AppLogger.warn(COMPONENT, "Collider '" + collider.getName() + "' failed: " + e.getMessage());
            }
        }
        return names;
    }

    public void addClickHandler(String colliderName, ClickHandler handler) {
        if (colliderName == null || handler == null) {
            throw new IllegalArgumentException("Collider name and handler are required");
        }
        handlers.add(new Binding(colliderName, handler));
    }

    public boolean removeClickHandler(String colliderName, ClickHandler handler) {
        return handlers.removeIf(b -> b.colliderName.equals(colliderName) && b.handler == handler);
    }

    /**
     * Runs every handler bound to a hit collider and returns the hits. One failing handler
     * does not stop the others.
     */
    public List<String> dispatchClick(double x, double y, CapabilityCache capabilities) {
        List<String> hits = query(x, y, capabilities);
        if (hits.isEmpty()) {
            return hits;
        }
        for (Binding binding : handlers) {
            if (!hits.contains(binding.colliderName)) {
                continue;
            }
            try {
                binding.handler.onClick(binding.colliderName, x, y);
            } catch (Exception e) {
                AppLogger.error(COMPONENT, "Click handler for '" + binding.colliderName + "' failed", e);
            }
        }
        return hits;
    }

    private static final class Binding {
        private final String colliderName;
        private final ClickHandler handler;

        private Binding(String colliderName, ClickHandler handler) {
            this.colliderName = colliderName;
            this.handler = handler;
        }
    }
}
