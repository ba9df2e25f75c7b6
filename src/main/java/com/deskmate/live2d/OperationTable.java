package com.deskmate.live2d;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A statically known backend surface: named operations registered up front.
 */
public class OperationTable implements ModelHandle {

    private final String name;
    private final Map<String, ModelOperation> operations = new LinkedHashMap<>();

    public OperationTable() {
        this("OperationTable");
    }

    public OperationTable(String name) {
        this.name = name;
    }

    public OperationTable register(String operation, ModelOperation implementation) {
        operations.put(operation, implementation);
        return this;
    }

    /**
     * Registers an operation that only accepts exactly {@code arity} arguments.
     */
    public OperationTable register(String operation, int arity, ModelOperation implementation) {
        return register(operation, args -> {
            if (args.length != arity) {
                throw new ArityMismatchException(operation, args.length);
            }
            return implementation.invoke(args);
        });
    }

    public Set<String> operationNames() {
        return Collections.unmodifiableSet(operations.keySet());
    }

    @Override
    public Optional<ModelOperation> lookup(String operation) {
        return Optional.ofNullable(operations.get(operation));
    }

    @Override
    public String describe() {
        return name + operations.keySet();
    }
}
