package com.github.dimitryivaniuta.wrappers.proxy;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationChain;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import lombok.RequiredArgsConstructor;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.springframework.aop.ProxyMethodInvocation;
import org.springframework.aop.support.AopUtils;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One advice per proxied bean. Builds the wrapper list of each method once, then composes it
 * around the rest of the interceptor chain on every call.
 *
 * <p>Wrappers may call the inner operation several times (retry) or later on another thread
 * (debounce), so each inner call proceeds on a clone of the invocation.
 */
@RequiredArgsConstructor
public class OperationChainInterceptor implements MethodInterceptor {

    private final Object target;
    private final Class<?> targetClass;
    private final WrapperChainFactory chainFactory;

    private final Map<Method, List<OperationWrapper>> chains = new ConcurrentHashMap<>();

    @Override
    public Object invoke(MethodInvocation inv) throws Throwable {
        Method method = AopUtils.getMostSpecificMethod(inv.getMethod(), targetClass);
        List<OperationWrapper> wrappers = chains.computeIfAbsent(method,
                m -> chainFactory.wrappersFor(target, targetClass, m));
        if (wrappers.isEmpty()) return inv.proceed();

        Operation terminal = args -> proceed(inv, args);
        return OperationChain.compose(wrappers, terminal).invoke(inv.getArguments());
    }

    private static Object proceed(MethodInvocation inv, Object[] args) throws Throwable {
        if (inv instanceof ProxyMethodInvocation pmi) {
            return pmi.invocableClone(args).proceed();
        }
        return inv.proceed();
    }
}
