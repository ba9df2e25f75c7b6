package com.deskmate.live2d;

/**
 * One named operation exposed by an animation backend.
 * Implementations throw {@link ArityMismatchException} when the argument list does not fit.
 */
@FunctionalInterface
public interface ModelOperation {

    Object invoke(Object... args) throws Exception;
}
