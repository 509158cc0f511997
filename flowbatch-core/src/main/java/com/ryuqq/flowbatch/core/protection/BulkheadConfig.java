package com.ryuqq.flowbatch.core.protection;

/**
 * Bulkhead 설정.
 *
 * @param maxConcurrentCalls 동시에 실행될 수 있는 라인 수 (1 이상)
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public record BulkheadConfig(int maxConcurrentCalls) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException maxConcurrentCalls가 1 미만인 경우
     */
    public BulkheadConfig {
        if (maxConcurrentCalls <= 0) {
            throw new IllegalArgumentException("maxConcurrentCalls must be positive (current: " + maxConcurrentCalls + ")");
        }
    }
}
