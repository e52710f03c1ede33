package com.reliability.circuit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Spring bean 메서드를 이름이 지정된 CircuitBreaker로 보호
 *
 * <pre>
 * &#64;Guarded(name = "database", fallbackMethod = "emptyUsers")
 * public List&lt;User&gt; findUsers() { ... }
 *
 * private List&lt;User&gt; emptyUsers(CircuitOpenException e) { ... }
 * </pre>
 *
 * fallback 메서드는 원래 파라미터 + CircuitOpenException, 또는 CircuitOpenException 하나만 받는다.
 * fallback은 OPEN 거부 시에만 호출되고, 메서드 자체 예외는 그대로 전파된다.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Guarded {

    /** registry에 등록된 breaker 이름 (없으면 기본 설정으로 생성) */
    String name();

    String fallbackMethod() default "";
}
