package com.deskmate.live2d;

import com.deskmate.AppLogger;
import com.deskmate.live2d.CapabilityCache.Binding;
import com.deskmate.live2d.OperationCalls.Outcome;
import com.deskmate.models.ParameterTarget;

import java.util.List;
import java.util.Optional;

/**
 * Parameter get/set/add against whichever parameter API the backend exposes.
 * <p>
 * Setters are tried most specific first. Each is called as {@code (id, value, blend)} and, on an
 * arity mismatch, as {@code (id, value)}. The first call that is not an arity mismatch wins and is
 * reused for later calls; a backend exception still counts as handled.
 */
public class ParameterOperations {

    static final List<String> SETTER_ORDER = List.of(
        "SetParameterValue",
        "SetParamFloat",
        "SetParamValue",
        "SetParam"
    );
    static final String DICTIONARY_SETTER = "UpdateParameter";
    static final List<String> GETTER_ORDER = List.of(
        "GetParameterValue",
        "GetParamFloat",
        "GetParamValue",
        "GetParam"
    );
    static final String ADD_OPERATION = "AddParameterValue";

    static final String SET_PARAMETER = "set parameter";
    static final String GET_PARAMETER = "get parameter";

    private static final String COMPONENT = "ParameterOperations";

    private final CapabilityCache capabilities;

    public ParameterOperations(CapabilityCache capabilities) {
        this.capabilities = capabilities;
    }

    /**
     * Applies each target; returns true when at least one write went through.
     */
    public boolean apply(List<ParameterTarget> targets, double blend, boolean additive) {
        if (!capabilities.isAttached() || targets == null) {
            return false;
        }
        boolean applied = false;
        for (ParameterTarget target : targets) {
            if (target.getId() == null || target.getId().isBlank()) {
                continue;
            }
            boolean success;
            if (additive) {
                double delta = target.getValue() * blend;
                success = add(target.getId(), delta);
                if (!success) {
                    double base = get(target.getId());
                    success = set(target.getId(), base + delta, 1.0);
                }
            } else {
                success = set(target.getId(), target.getValue(), blend);
            }
            applied = applied || success;
        }
        return applied;
    }

    public boolean set(String id, double value, double blend) {
        Binding cached = capabilities.binding(SET_PARAMETER);
        if (cached != null) {
            Object[] args = cached.getArity() == 3 ? new Object[]{id, value, blend} : new Object[]{id, value};
            if (OperationCalls.attempt(cached.getOperationName(), cached.getOperation(), args) != Outcome.ARITY_MISMATCH) {
                return true;
            }
            capabilities.forget(SET_PARAMETER);
        }

        for (String name : SETTER_ORDER) {
            Optional<ModelOperation> operation = capabilities.operation(name);
            if (operation.isEmpty()) {
                continue;
            }
            if (OperationCalls.attempt(name, operation.get(), id, value, blend) != Outcome.ARITY_MISMATCH) {
                capabilities.remember(SET_PARAMETER, new Binding(name, 3, operation.get()));
                return true;
            }
            if (OperationCalls.attempt(name, operation.get(), id, value) != Outcome.ARITY_MISMATCH) {
                capabilities.remember(SET_PARAMETER, new Binding(name, 2, operation.get()));
                return true;
            }
        }

        Optional<ModelOperation> dictionary = capabilities.operation(DICTIONARY_SETTER);
        if (dictionary.isPresent()
            && OperationCalls.attempt(DICTIONARY_SETTER, dictionary.get(), id, value) != Outcome.ARITY_MISMATCH) {
            capabilities.remember(SET_PARAMETER, new Binding(DICTIONARY_SETTER, 2, dictionary.get()));
            return true;
        }
        AppLogger.warn(COMPONENT, "No parameter setter accepted " + id);
        return false;
    }

    public boolean add(String id, double delta) {
        Optional<ModelOperation> operation = capabilities.operation(ADD_OPERATION);
        return operation.isPresent()
            && OperationCalls.attempt(ADD_OPERATION, operation.get(), id, delta) != Outcome.ARITY_MISMATCH;
    }

    /**
     * Current value of a parameter, or 0.0 when no getter can provide one.
     */
    public double get(String id) {
        Binding cached = capabilities.binding(GET_PARAMETER);
        if (cached != null) {
            try {
                return toDouble(cached.getOperation().invoke(id));
            } catch (ArityMismatchException e) {
                capabilities.forget(GET_PARAMETER);
            } catch (Exception e) {
                AppLogger.warn(COMPONENT, cached.getOperationName() + " failed: " + OperationCalls.describe(e));
                return 0.0;
            }
        }
        for (String name : GETTER_ORDER) {
            Optional<ModelOperation> operation = capabilities.operation(name);
            if (operation.isEmpty()) {
                continue;
            }
            try {
                double value = toDouble(operation.get().invoke(id));
                capabilities.remember(GET_PARAMETER, new Binding(name, 1, operation.get()));
                return value;
            } catch (ArityMismatchException e) {
                continue;
            } catch (Exception e) {
                AppLogger.warn(COMPONENT, name + " failed: " + OperationCalls.describe(e));
                return 0.0;
            }
        }
        return 0.0;
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            return Double.parseDouble(((String) value).trim());
        }
        throw new IllegalStateException("Parameter getter returned " + value);
    }
}
