package com.deskmate.models;

/**
 * Position offset and scale applied to the model on every frame.
 */
public class ModelTransform {
    private final double x;
    private final double y;
    private final double scale;

    public ModelTransform(double x, double y, double scale) {
        this.x = x;
        this.y = y;
        this.scale = scale;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getScale() {
        return scale;
    }
}
