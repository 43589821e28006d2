package com.github.dimitryivaniuta.wrappers.lifecycle;

import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Snapshot of one invocation handed to lifecycle hooks. Built fresh per call; the argument list
 * is read-only.
 */
public record EffectContext(String operationName,
                            String scopeName,
                            List<Object> args,
                            Object result,
                            Throwable error) {

    static EffectContext of(OperationDefinition definition, Object[] args) {
        return new EffectContext(definition.name(), definition.scope(), readOnly(args), null, null);
    }

    EffectContext withResult(Object result) {
        return new EffectContext(operationName, scopeName, args, result, null);
    }

    EffectContext withError(Throwable error) {
        return new EffectContext(operationName, scopeName, args, null, error);
    }

    private static List<Object> readOnly(Object[] args) {
        if (args == null) return List.of();
        return Collections.unmodifiableList(Arrays.asList(args.clone()));
    }
}
