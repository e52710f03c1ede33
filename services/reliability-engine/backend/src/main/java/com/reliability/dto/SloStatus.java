package com.reliability.dto;

public enum SloStatus {
    PASS,
    FAIL
}
