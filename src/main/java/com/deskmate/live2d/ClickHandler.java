package com.deskmate.live2d;

/**
 * Reacts to a click that landed on the named collider.
 */
@FunctionalInterface
public interface ClickHandler {

    void onClick(String collider, double x, double y) throws Exception;
}
