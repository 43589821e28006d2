package com.github.dimitryivaniuta.wrappers.proxy;

import com.github.dimitryivaniuta.wrappers.operation.KeyFunction;
import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.Expression;
import org.springframework.expression.spel.standard.SpelExpressionParser;

import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Key function backed by a SpEL expression over the method arguments.
 *
 * <p>Available in the expression: {@code #p0}/{@code #a0}, parameter names (when compiled with
 * {@code -parameters}) and {@code #args}. There is no root object: state built from the key is
 * shared between every bean of the class.
 */
final class SpelKeyFunction implements KeyFunction {

    private static final SpelExpressionParser PARSER = new SpelExpressionParser();
    private static final ParameterNameDiscoverer PARAMETER_NAMES = new DefaultParameterNameDiscoverer();

    private final Expression expression;
    private final Method method;

    SpelKeyFunction(String expression, Method method) {
        this.expression = PARSER.parseExpression(expression);
        this.method = method;
    }

    @Override
    public String apply(Object[] args) {
        MethodBasedEvaluationContext ctx = new MethodBasedEvaluationContext(null, method, args, PARAMETER_NAMES);
        ctx.setVariable("args", args);
        return Objects.toString(expression.getValue(ctx));
    }
}
