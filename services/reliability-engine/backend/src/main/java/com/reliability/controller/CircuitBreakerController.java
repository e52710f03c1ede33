package com.reliability.controller;

import com.reliability.circuit.CircuitBreakerRegistry;
import com.reliability.circuit.CircuitBreakerSnapshot;
import com.reliability.dto.CircuitBreakerStatusResponse;
import com.reliability.dto.CircuitBreakerSummary;
import com.reliability.dto.DefaultResponse;
import com.reliability.exception.ApiException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/circuit-breakers")
@RequiredArgsConstructor
public class CircuitBreakerController {

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    /**
     * 전체 breaker 상태 조회
     * - 상태 변경 없음 (OPEN 유지 시간이 지나도 다음 호출 전까지 OPEN으로 보고)
     */
    @GetMapping
    public ResponseEntity<DefaultResponse<CircuitBreakerStatusResponse>> circuitBreakers() {

        Map<String, CircuitBreakerSnapshot> snapshots = circuitBreakerRegistry.snapshotAll();
        List<String> open = circuitBreakerRegistry.listOpen();
        List<String> critical = circuitBreakerRegistry.listCritical();

        CircuitBreakerStatusResponse response = new CircuitBreakerStatusResponse(
                snapshots,
                open,
                critical,
                new CircuitBreakerSummary(snapshots.size(), open.size(), critical.size(), open, critical)
        );

        return ResponseEntity.ok(DefaultResponse.ok(response));
    }

    @GetMapping("/{name}")
    public ResponseEntity<DefaultResponse<CircuitBreakerSnapshot>> circuitBreaker(@PathVariable("name") String name) {

        CircuitBreakerSnapshot snapshot = circuitBreakerRegistry.find(name)
                .orElseThrow(() -> new ApiException(
                        "CIRCUIT_NOT_FOUND",
                        "circuit breaker not registered: " + name,
                        HttpStatus.NOT_FOUND
                ))
                .getState();

        return ResponseEntity.ok(DefaultResponse.ok(snapshot));
    }
}
