package com.ryuqq.flowbatch.core.executor;

/**
 * Executor가 배치를 위임받는 방식.
 *
 * <p>Lifecycle은 run 시작 시 이 값을 한 번만 확인하여 분기합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public enum ExecutionMode {

    /**
     * 라인 단위 위임.
     *
     * <p>오케스트레이터의 Line Scheduler가 동시성 상한 안에서 라인마다
     * {@link FlowExecutor#executeLine}을 호출합니다.</p>
     */
    PER_LINE,

    /**
     * 배치 전체 위임.
     *
     * <p>Executor가 자체 동시성과 영속화를 관리하며, 오케스트레이터는
     * {@link FlowExecutor#executeBatch}를 한 번만 호출합니다.</p>
     */
    WHOLE_BATCH
}
