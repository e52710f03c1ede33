package com.reliability.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 웹 계층 비즈니스 예외
 * - code : 시스템 식별용 (예: CIRCUIT_NOT_FOUND)
 */
@Getter
public class ApiException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    public ApiException(String code, String message, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }
}
