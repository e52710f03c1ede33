package com.reliability.dto;

import com.reliability.logging.TraceContext;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 모든 API 공통 응답 envelope
 * { httpCode, data, error }
 */
@Getter
@AllArgsConstructor
public class DefaultResponse<T> {

    private int httpCode;
    private T data;
    private ErrorResponse error;

    public static <T> DefaultResponse<T> ok(T data) {
        return new DefaultResponse<>(HttpStatus.OK.value(), data, null);
    }

    public static DefaultResponse<Void> failure(HttpStatus status, String code, String message) {
        return new DefaultResponse<>(
                status.value(),
                null,
                new ErrorResponse(code, message, TraceContext.current())
        );
    }
}
