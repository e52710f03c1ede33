package com.reliability.exception;

import com.reliability.circuit.CircuitOpenException;
import com.reliability.dto.DefaultResponse;
import com.reliability.logging.LogEvent;
import com.reliability.logging.TraceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(basePackages = "com.reliability.controller")
public class GlobalExceptionHandler {

    /**
     * fallback 없이 컨트롤러까지 올라온 CircuitOpenException 처리
     *
     * - 서버 내부 오류(500)가 아닌, 보호 상태(503)로 응답
     */
    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<DefaultResponse<Void>> handleCircuitOpen(CircuitOpenException e) {

        log.warn(
                "event={} circuit={} trace_id={}",
                LogEvent.CIRCUIT_OPEN,
                e.getCircuitName(),
                TraceContext.current()
        );

        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(DefaultResponse.failure(
                        HttpStatus.SERVICE_UNAVAILABLE,
                        LogEvent.CIRCUIT_OPEN,
                        e.getMessage()
                ));
    }

    /**
     * 비즈니스 예외 처리
     * - ERROR가 아닌 WARN 수준으로 기록
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<DefaultResponse<Void>> handleApiException(ApiException e) {

        log.warn(
                "event={} code={} trace_id={}",
                LogEvent.BUSINESS_EXCEPTION,
                e.getCode(),
                TraceContext.current()
        );

        return ResponseEntity
                .status(e.getStatus())
                .body(DefaultResponse.failure(
                        e.getStatus(),
                        e.getCode(),
                        e.getMessage()
                ));
    }

    /**
     * 예상하지 못한 예외 처리
     * - 반드시 로그를 남겨 "로그 없는 장애"를 방지
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<DefaultResponse<Void>> handleException(Exception e) {
        log.error(
                "event={} trace_id={}",
                LogEvent.UNHANDLED_EXCEPTION,
                TraceContext.current(),
                e
        );

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(DefaultResponse.failure(
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        "INTERNAL_SERVER_ERROR",
                        "internal server error"
                ));
    }

}
