package com.reliability.observability;

import java.time.Instant;

/**
 * (scope, hour) 단위 bucket 키
 * - hour는 UTC 기준 정시로 절삭된 시각
 */
public record BucketKey(String scope, Instant hour) {}
