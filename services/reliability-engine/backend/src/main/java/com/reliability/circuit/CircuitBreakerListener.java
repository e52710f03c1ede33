package com.reliability.circuit;

/**
 * CircuitBreaker 이벤트 수신용 (메트릭 바인딩 등)
 * - breaker lock 내부에서 호출되므로 breaker 메서드를 다시 호출하면 안 된다
 */
public interface CircuitBreakerListener {

    default void onStateTransition(CircuitBreaker breaker, CircuitState from, CircuitState to) {
    }

    default void onCallRejected(CircuitBreaker breaker) {
    }
}
