package com.ryuqq.flowbatch.core.error;

/**
 * 오류가 발생한 영역.
 *
 * <p>운영자가 어느 구성 요소를 살펴봐야 하는지 알려주는 분류입니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public enum ErrorTarget {

    /**
     * 배치 오케스트레이션 자체.
     */
    BATCH,

    /**
     * Flow 정의 및 구조 검증.
     */
    FLOW,

    /**
     * 입력 데이터 해석 및 타입 변환.
     */
    INPUT,

    /**
     * 라인 실행 백엔드.
     */
    EXECUTOR,

    /**
     * 집계 노드 실행.
     */
    AGGREGATION
}
