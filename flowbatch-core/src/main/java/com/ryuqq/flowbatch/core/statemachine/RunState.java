package com.ryuqq.flowbatch.core.statemachine;

import com.ryuqq.flowbatch.core.model.ExecutionStatus;

/**
 * Batch Run의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NOT_STARTED
 *    │
 *    ▼ (run 호출)
 * RUNNING
 *    │
 *    ├─► COMPLETED (정상 종료)
 *    ├─► FAILED (오류 전파)
 *    └─► CANCELED (취소)
 *
 * 금지된 전이:
 * - 종료 상태 → 어떤 상태든 ❌
 * - RUNNING → NOT_STARTED ❌
 * - NOT_STARTED → 종료 상태 ❌ (반드시 RUNNING을 거침)
 * </pre>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public enum RunState {

    /**
     * 아직 run이 시작되지 않음.
     */
    NOT_STARTED,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 정상 종료.
     */
    COMPLETED,

    /**
     * 오류로 종료.
     */
    FAILED,

    /**
     * 취소로 종료.
     */
    CANCELED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    /**
     * BatchResult 상태에 대응하는 종료 상태.
     *
     * @param status BatchResult 상태
     * @return 대응하는 RunState
     * @throws IllegalArgumentException status가 null인 경우
     */
    public static RunState fromResultStatus(ExecutionStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
            case CANCELED -> CANCELED;
        };
    }
}
