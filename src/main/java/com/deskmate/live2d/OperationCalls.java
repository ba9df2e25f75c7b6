package com.deskmate.live2d;

import com.deskmate.AppLogger;

/**
 * Invokes a backend operation and classifies the result for the fallback search.
 */
final class OperationCalls {

    enum Outcome {
        /** The call went through. */
        INVOKED,
        /** The operation exists but rejected this argument list. */
        ARITY_MISMATCH,
        /** The backend raised while handling the call. */
        FAILED
    }

    private static final String COMPONENT = "AnimationBackend";

    private OperationCalls() {
    }

    static Outcome attempt(String name, ModelOperation operation, Object... args) {
        try {
            operation.invoke(args);
            return Outcome.INVOKED;
        } catch (ArityMismatchException e) {
            return Outcome.ARITY_MISMATCH;
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, name + " failed: " + describe(e));
            return Outcome.FAILED;
        }
    }

    /**
     * Invokes a query operation and returns its result, or null when the call did not go through.
     */
    static Object query(String name, ModelOperation operation, Object... args) {
        try {
            return operation.invoke(args);
        } catch (ArityMismatchException e) {
            return null;
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, name + " failed: " + describe(e));
            return null;
        }
    }

    static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
