package com.reliability.dto;

import com.reliability.circuit.CircuitBreakerSnapshot;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@AllArgsConstructor
public class CircuitBreakerStatusResponse {

    private Map<String, CircuitBreakerSnapshot> circuitBreakers;
    private List<String> openCircuits;
    private List<String> criticalCircuits;
    private CircuitBreakerSummary summary;
}
