package com.deskmate.live2d;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers, for the currently attached backend, which operations exist and which
 * call form last worked for each logical operation. Attaching a backend (or detaching
 * with null) forgets everything, since a reload may expose a different backend version.
 */
public class CapabilityCache {

    private final Map<String, Optional<ModelOperation>> operations = new ConcurrentHashMap<>();
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();
    private volatile ModelHandle handle;

    public synchronized void attach(ModelHandle newHandle) {
        this.handle = newHandle;
        clear();
    }

    public ModelHandle getHandle() {
        return handle;
    }

    public boolean isAttached() {
        return handle != null;
    }

    public Optional<ModelOperation> operation(String name) {
        ModelHandle current = handle;
        if (current == null || name == null) {
            return Optional.empty();
        }
        return operations.computeIfAbsent(name, current::lookup);
    }

    public boolean supports(String name) {
        return operation(name).isPresent();
    }

    public Binding binding(String logicalOperation) {
        return bindings.get(logicalOperation);
    }

    public void remember(String logicalOperation, Binding binding) {
        if (binding != null) {
            bindings.put(logicalOperation, binding);
        }
    }

    public void forget(String logicalOperation) {
        bindings.remove(logicalOperation);
    }

    public synchronized void clear() {
        operations.clear();
        bindings.clear();
    }

    int probedCount() {
        return operations.size();
    }

    /**
     * A backend operation name plus the argument count it accepted.
     */
    public static class Binding {
        private final String operationName;
        private final int arity;
        private final ModelOperation operation;

        public Binding(String operationName, int arity, ModelOperation operation) {
            this.operationName = operationName;
            this.arity = arity;
            this.operation = operation;
        }

        public String getOperationName() {
            return operationName;
        }

        public int getArity() {
            return arity;
        }

        public ModelOperation getOperation() {
            return operation;
        }
    }
}
