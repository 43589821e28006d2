package com.github.dimitryivaniuta.wrappers.proxy;

import lombok.RequiredArgsConstructor;
import org.springframework.aop.framework.Advised;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;

import static com.github.dimitryivaniuta.wrappers.proxy.OperationWrappersSupport.hasAnyWrapperAnnotation;

/**
 * Creates a runtime proxy (ProxyFactory) for beans that use operation-wrapper annotations.
 *
 * <p>This is NOT @Aspect-based AOP. It is a custom proxy wiring via BeanPostProcessor with a
 * single {@link OperationChainInterceptor} per bean; the wrapper order lives in
 * {@link WrapperChainFactory}.
 */
@RequiredArgsConstructor
public final class OperationWrappersBeanPostProcessor implements BeanPostProcessor {

    private final OperationWrappersProperties props;

    // resolved lazily: post-processors are created before ordinary beans
    private final ObjectProvider<WrapperChainFactory> chainFactory;

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
        if (!props.isEnabled()) return bean;

        Class<?> targetClass = ClassUtils.getUserClass(AopUtils.getTargetClass(bean));
        if (isExcluded(targetClass)) return bean;
        if (!needsProxy(targetClass)) return bean;

        // If already proxied (e.g., @Transactional), add advice to existing proxy
        if (bean instanceof Advised advised) {
            Object target = AopProxyUtils.getSingletonTarget(bean);
            advised.addAdvice(0, new OperationChainInterceptor(
                    target != null ? target : bean, targetClass, chainFactory.getObject()));
            return bean;
        }

        ProxyFactory pf = new ProxyFactory(bean);
        // allow class-based proxying for beans without interfaces
        pf.setProxyTargetClass(true);
        pf.addAdvice(new OperationChainInterceptor(bean, targetClass, chainFactory.getObject()));

        return pf.getProxy();
    }

    private boolean needsProxy(Class<?> targetClass) {
        if (hasAnyWrapperAnnotation(targetClass)) return true;
        for (Method m : targetClass.getMethods()) {
            if (hasAnyWrapperAnnotation(m)) return true;
        }
        return false;
    }

    private boolean isExcluded(Class<?> targetClass) {
        String name = targetClass.getName();

        if (name.startsWith("org.springframework.") || name.startsWith("jakarta.") || name.startsWith("java.") || name.startsWith("kotlin.")) {
            return true;
        }

        if (props.getExcludePackages() == null || props.getExcludePackages().isEmpty()) return false;

        for (String p : props.getExcludePackages()) {
            if (p == null || p.isBlank()) continue;
            String prefix = p.endsWith(".") ? p : p + ".";
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}
