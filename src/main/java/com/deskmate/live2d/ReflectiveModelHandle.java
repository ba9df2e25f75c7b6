package com.deskmate.live2d;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exposes the public methods of an arbitrary backend object as operations.
 * <p>
 * Overloads are selected by argument count; numeric arguments are converted to the declared
 * parameter type. No overload with a matching count and compatible types is reported as
 * {@link ArityMismatchException}. Exceptions thrown by the backend itself are rethrown unwrapped.
 */
public class ReflectiveModelHandle implements ModelHandle {

    private final Object target;

    public ReflectiveModelHandle(Object target) {
        if (target == null) {
            throw new IllegalArgumentException("Backend object is required");
        }
        this.target = target;
    }

    public Object getTarget() {
        return target;
    }

    @Override
    public Optional<ModelOperation> lookup(String name) {
        List<Method> candidates = new ArrayList<>();
        for (Method method : target.getClass().getMethods()) {
            if (method.getName().equals(name) && method.getDeclaringClass() != Object.class) {
                candidates.add(method);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(args -> dispatch(name, candidates, args));
    }

    private Object dispatch(String name, List<Method> candidates, Object[] args) throws Exception {
        for (Method method : candidates) {
            if (method.getParameterCount() != args.length) {
                continue;
            }
            Object[] converted = convertArguments(args, method.getParameterTypes());
            if (converted == null) {
                continue;
            }
            if (!Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
                method.trySetAccessible();
            }
            try {
                return method.invoke(target, converted);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }
        }
        throw new ArityMismatchException(name, args.length);
    }

    static Object[] convertArguments(Object[] args, Class<?>[] types) {
        Object[] converted = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            Object value = convert(args[i], types[i]);
            if (value == INCOMPATIBLE) {
                return null;
            }
            converted[i] = value;
        }
        return converted;
    }

    private static final Object INCOMPATIBLE = new Object();

    private static Object convert(Object arg, Class<?> type) {
        if (arg == null) {
            return type.isPrimitive() ? INCOMPATIBLE : null;
        }
        if (arg instanceof Number) {
            Number number = (Number) arg;
            if (type == float.class || type == Float.class) return number.floatValue();
            if (type == double.class || type == Double.class) return number.doubleValue();
            if (type == int.class || type == Integer.class) return number.intValue();
            if (type == long.class || type == Long.class) return number.longValue();
            if (type == short.class || type == Short.class) return number.shortValue();
        }
        if (arg instanceof Boolean && type == boolean.class) {
            return arg;
        }
        return type.isInstance(arg) ? arg : INCOMPATIBLE;
    }

    @Override
    public String describe() {
        return "Reflective(" + target.getClass().getName() + ")";
    }
}
