package com.ryuqq.flowbatch.core.protection;

/**
 * 라인 실행 동시성 제한 (Bulkhead 패턴).
 *
 * <p>라인은 permit을 획득한 뒤에만 실행이 시작되고, 결과가 기록된 뒤 permit을 반납합니다.
 * 따라서 어느 순간에도 실행 중인 라인 수는 {@link BulkheadConfig#maxConcurrentCalls()}를
 * 넘지 않습니다. 상한은 run 도중 변경되지 않습니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * 즉시 permit 획득 시도.
     *
     * @param lineIndex 라인 index (진단용)
     * @return 획득 성공 여부
     */
    boolean tryAcquire(int lineIndex);

    /**
     * permit 반납.
     *
     * @param lineIndex 라인 index (진단용)
     * @throws IllegalStateException 획득하지 않은 permit을 반납하는 경우
     */
    void release(int lineIndex);

    /**
     * run 시작 후 관측된 최대 동시 실행 수.
     *
     * @return 최대 동시 실행 수
     */
    int getPeakConcurrency();
}
