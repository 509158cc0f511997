package com.ryuqq.flowbatch.core.model;

/**
 * 라인 실행 및 배치 실행의 최종 상태.
 *
 * <p>{@link LineResult}와 {@link BatchResult}가 동일한 상태 집합을 공유합니다.</p>
 *
 * <ul>
 *   <li>COMPLETED: 정상 완료 (라인의 경우 output이 채워짐)</li>
 *   <li>FAILED: 실패 (라인 단위 실패 또는 인프라 장애)</li>
 *   <li>CANCELED: 취소 요청으로 중단됨</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public enum ExecutionStatus {

    /**
     * 정상 완료.
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELED;

    /**
     * 성공 상태인지 확인.
     *
     * @return COMPLETED인 경우 true
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
