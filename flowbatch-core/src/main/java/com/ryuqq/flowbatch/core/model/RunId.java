package com.ryuqq.flowbatch.core.model;

import java.util.UUID;

/**
 * Batch Run의 전역 고유 식별자.
 *
 * <p>RunId는 한 번의 배치 실행(run)을 식별하며, Executor 호출 시마다 함께 전달되어
 * 백엔드가 라인 실행과 집계 실행을 동일한 run으로 묶을 수 있게 합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class RunId {

    private final String value;

    private RunId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RunId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("RunId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * RunId 생성.
     *
     * @param value RunId 값
     * @return RunId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RunId of(String value) {
        return new RunId(value);
    }

    /**
     * UUID 기반 RunId 생성.
     *
     * @return 새로운 RunId
     */
    public static RunId generate() {
        return new RunId(UUID.randomUUID().toString());
    }

    /**
     * 값이 있으면 그 값으로, 없으면 새 UUID로 RunId 생성.
     *
     * @param valueOrNull 호출자가 지정한 RunId 값 (null 또는 빈 문자열 허용)
     * @return RunId 인스턴스
     */
    public static RunId ofNullable(String valueOrNull) {
        if (valueOrNull == null || valueOrNull.isBlank()) {
            return generate();
        }
        return new RunId(valueOrNull);
    }

    /**
     * RunId 값 조회.
     *
     * @return RunId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return value.equals(runId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RunId{" + value + '}';
    }
}
