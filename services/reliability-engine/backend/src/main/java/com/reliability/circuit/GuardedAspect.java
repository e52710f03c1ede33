package com.reliability.circuit;

import com.reliability.logging.LogEvent;
import com.reliability.logging.TraceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Arrays;

@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class GuardedAspect {

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @Around("@annotation(guarded)")
    public Object guard(ProceedingJoinPoint joinPoint, Guarded guarded) throws Throwable {

        CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker(
                guarded.name(),
                CircuitBreakerConfig.ofDefaults()
        );

        try {
            return breaker.callChecked(() -> proceed(joinPoint));

        } catch (CircuitOpenException e) {
            if (guarded.fallbackMethod().isEmpty()) {
                throw e;
            }

            log.warn(
                    "event={} circuit={} method={} trace_id={}",
                    LogEvent.FALLBACK,
                    guarded.name(),
                    joinPoint.getSignature().getName(),
                    MDC.get(TraceContext.TRACE_ID_KEY)
            );

            return invokeFallback(joinPoint, guarded.fallbackMethod(), e);
        }
    }

    private static Object proceed(ProceedingJoinPoint joinPoint) throws Exception {
        try {
            return joinPoint.proceed();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new UndeclaredThrowableException(t);
        }
    }

    private static Object invokeFallback(
            ProceedingJoinPoint joinPoint,
            String fallbackName,
            CircuitOpenException cause
    ) throws Throwable {

        Object target = joinPoint.getTarget();
        Class<?>[] paramTypes = ((MethodSignature) joinPoint.getSignature()).getParameterTypes();

        // 1) 원래 파라미터 + CircuitOpenException
        Class<?>[] extendedTypes = Arrays.copyOf(paramTypes, paramTypes.length + 1);
        extendedTypes[paramTypes.length] = CircuitOpenException.class;
        Method fallback = ReflectionUtils.findMethod(target.getClass(), fallbackName, extendedTypes);
        Object[] args;

        if (fallback != null) {
            Object[] original = joinPoint.getArgs();
            args = Arrays.copyOf(original, original.length + 1);
            args[original.length] = cause;
        } else {
            // 2) CircuitOpenException 단독
            fallback = ReflectionUtils.findMethod(target.getClass(), fallbackName, CircuitOpenException.class);
            args = new Object[]{cause};
        }

        if (fallback == null) {
            throw new IllegalStateException(
                    "fallback method not found: " + target.getClass().getSimpleName() + "#" + fallbackName
            );
        }

        ReflectionUtils.makeAccessible(fallback);
        try {
            return fallback.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }
}
