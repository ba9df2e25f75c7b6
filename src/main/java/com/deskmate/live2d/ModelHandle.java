package com.deskmate.live2d;

import java.util.Optional;

/**
 * Capability surface of a loaded animation backend. Which operations exist, and with which
 * arities, depends on the backend version and is only known by asking.
 */
public interface ModelHandle {

    /**
     * Look up an operation by its backend name.
     */
    Optional<ModelOperation> lookup(String name);

    default String describe() {
        return getClass().getSimpleName();
    }
}
