package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.core.protection.Bulkhead;
import com.ryuqq.flowbatch.core.protection.BulkheadConfig;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Semaphore 기반 Bulkhead 구현체.
 *
 * <p>permit 수는 {@link BulkheadConfig#maxConcurrentCalls()}로 고정되며 공정(FIFO) 모드로 동작합니다.
 * 현재 동시 실행 수와 최대 관측값을 함께 추적합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class SemaphoreBulkhead implements Bulkhead {

    private final BulkheadConfig config;
    private final Semaphore permits;
    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param config Bulkhead 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SemaphoreBulkhead(BulkheadConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.permits = new Semaphore(config.maxConcurrentCalls(), true);
    }

    @Override
    public boolean tryAcquire(int lineIndex) {
        if (!permits.tryAcquire()) {
            return false;
        }
        onAcquired();
        return true;
    }

    @Override
    public void release(int lineIndex) {
        int remaining = current.decrementAndGet();
        if (remaining < 0) {
            current.incrementAndGet();
            throw new IllegalStateException("release without acquire (line " + lineIndex + ")");
        }
        permits.release();
    }

    @Override
    public int getPeakConcurrency() {
        return peak.get();
    }

    private void onAcquired() {
        int now = current.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
    }

    @Override
    public String toString() {
        return "SemaphoreBulkhead{max=" + config.maxConcurrentCalls()
            + ", current=" + current.get() + ", peak=" + peak.get() + "}";
    }
}
