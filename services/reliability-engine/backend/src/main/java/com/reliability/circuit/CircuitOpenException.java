package com.reliability.circuit;

import lombok.Getter;

/**
 * Circuit OPEN 상태에서 호출이 거부될 때 발생
 *
 * - 보호 대상 operation은 실행되지 않음
 * - operation 자체의 실패와 구분하여 fallback 처리 대상으로 사용
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String circuitName;

    public CircuitOpenException(String circuitName) {
        super("circuit breaker '" + circuitName + "' is OPEN");
        this.circuitName = circuitName;
    }
}
