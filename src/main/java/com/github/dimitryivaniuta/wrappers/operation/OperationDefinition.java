package com.github.dimitryivaniuta.wrappers.operation;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Identity of a wrapped operation: owning scope (usually the simple class name) plus name.
 *
 * @param scope owning scope, used to build state keys
 * @param name  operation name
 * @param async whether the operation produces a {@link CompletionStage}
 */
public record OperationDefinition(String scope, String name, boolean async) {

    public OperationDefinition {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static OperationDefinition sync(String scope, String name) {
        return new OperationDefinition(scope, name, false);
    }

    public static OperationDefinition async(String scope, String name) {
        return new OperationDefinition(scope, name, true);
    }

    public static OperationDefinition of(Class<?> targetClass, Method method) {
        return new OperationDefinition(
                targetClass.getSimpleName(),
                method.getName(),
                CompletionStage.class.isAssignableFrom(method.getReturnType()));
    }

    public String key() {
        return scope + "." + name;
    }
}
