package com.deskmate.live2d;

/**
 * Raised when a backend operation exists but does not accept the given arguments.
 * This is the only signal the fallback search uses to move on to the next form.
 */
public class ArityMismatchException extends Exception {

    public ArityMismatchException(String operation, int argCount) {
        super("Operation " + operation + " does not accept " + argCount + " argument(s)");
    }
}
