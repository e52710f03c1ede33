package com.reliability.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ErrorResponse {

    /**
     * 에러 코드 (시스템/비즈니스 식별용)
     * 예: CIRCUIT_OPEN, CIRCUIT_NOT_FOUND
     */
    private String code;

    /**
     * 사용자 또는 UI에 노출되는 메시지
     */
    private String message;

    /**
     * 장애 문의 시 로그 추적용 (없으면 null)
     */
    private String traceId;
}
