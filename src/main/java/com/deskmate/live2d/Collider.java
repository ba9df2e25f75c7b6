package com.deskmate.live2d;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named clickable region, in the same coordinate space the backend's drag and hit tests use.
 * Disabled colliders never match.
 */
public abstract class Collider {

    private final String name;
    private volatile boolean enabled = true;

    protected Collider(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collider name is required");
        }
        this.name = name.trim();
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public abstract String getType();

    public boolean contains(double x, double y, CapabilityCache capabilities) {
        return enabled && test(x, y, capabilities);
    }

    protected abstract boolean test(double x, double y, CapabilityCache capabilities);

    public static Collider rect(String name, double x, double y, double width, double height) {
        return new Rect(name, x, y, width, height);
    }

    public static Collider circle(String name, double centerX, double centerY, double radius) {
        return new Circle(name, centerX, centerY, radius);
    }

    public static Collider polygon(String name, List<double[]> points) {
        return new Polygon(name, points);
    }

    public static Collider hitArea(String name, String area) {
        return new HitArea(name, area);
    }

    public static class Rect extends Collider {
        private final double x;
        private final double y;
        private final double width;
        private final double height;

        Rect(String name, double x, double y, double width, double height) {
            super(name);
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
        }

        @Override
        public String getType() {
            return "rect";
        }

        @Override
        protected boolean test(double px, double py, CapabilityCache capabilities) {
            return px >= x && px <= x + width && py >= y && py <= y + height;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }

        public double getWidth() {
            return width;
        }

        public double getHeight() {
            return height;
        }
    }

    public static class Circle extends Collider {
        private final double centerX;
        private final double centerY;
        private final double radius;

        Circle(String name, double centerX, double centerY, double radius) {
            super(name);
            this.centerX = centerX;
            this.centerY = centerY;
            this.radius = radius;
        }

        @Override
        public String getType() {
            return "circle";
        }

        @Override
        protected boolean test(double px, double py, CapabilityCache capabilities) {
            double dx = px - centerX;
            double dy = py - centerY;
            return dx * dx + dy * dy <= radius * radius;
        }

        public double getCenterX() {
            return centerX;
        }

        public double getCenterY() {
            return centerY;
        }

        public double getRadius() {
            return radius;
        }
    }

    /**
     * Simple polygon tested by ray casting. Fewer than three points never match.
     */
    public static class Polygon extends Collider {
        private final List<double[]> points;

        Polygon(String name, List<double[]> points) {
            super(name);
            List<double[]> copy = new ArrayList<>();
            if (points != null) {
                for (double[] point : points) {
                    if (point != null && point.length >= 2) {
                        copy.add(new double[]{point[0], point[1]});
                    }
                }
            }
            this.points = Collections.unmodifiableList(copy);
        }

        @Override
        public String getType() {
            return "polygon";
        }

        @Override
        protected boolean test(double px, double py, CapabilityCache capabilities) {
            int n = points.size();
            if (n < 3) {
                return false;
            }
            boolean inside = false;
            for (int i = 0, j = n - 1; i < n; j = i++) {
                double[] a = points.get(i);
                double[] b = points.get(j);
                if ((a[1] > py) != (b[1] > py)
                    && px < (b[0] - a[0]) * (py - a[1]) / (b[1] - a[1]) + a[0]) {
                    inside = !inside;
                }
            }
            return inside;
        }

        public List<double[]> getPoints() {
            return points;
        }
    }

    /**
     * Delegates to the backend's own {@code HitTest(area, x, y)}; no such operation means no hit.
     */
    public static class HitArea extends Collider {
        static final String HIT_TEST = "HitTest";

        private final String area;

        HitArea(String name, String area) {
            super(name);
            if (area == null || area.isBlank()) {
                throw new IllegalArgumentException("Hit area name is required");
            }
            this.area = area;
        }

        @Override
        public String getType() {
            return "hitArea";
        }

        @Override
        protected boolean test(double px, double py, CapabilityCache capabilities) {
            if (capabilities == null) {
                return false;
            }
            return capabilities.operation(HIT_TEST)
                .map(op -> OperationCalls.query(HIT_TEST, op, area, (float) px, (float) py))
                .map(Boolean.TRUE::equals)
                .orElse(false);
        }

        public String getArea() {
            return area;
        }
    }
}
