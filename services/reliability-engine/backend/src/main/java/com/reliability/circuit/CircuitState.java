package com.reliability.circuit;

public enum CircuitState {
    CLOSED,     // 정상 호출
    OPEN,       // 즉시 차단 (fail fast)
    HALF_OPEN   // 복구 확인용 trial 1건만 허용
}
