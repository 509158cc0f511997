package com.ryuqq.flowbatch.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 한 라인의 실행 결과.
 *
 * <p>실제로 실행된 라인마다 정확히 한 번 생성되며, 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>output은 COMPLETED가 아니면 항상 비어 있음</li>
 *   <li>FAILED 결과는 반드시 error를 가짐</li>
 *   <li>aggregationInputs는 실패한 라인이라도 실패 전까지 계산된 값을 담을 수 있음</li>
 *   <li>endTime은 startTime 이후</li>
 * </ul>
 *
 * @param index 라인 위치 (0 이상)
 * @param status 라인 상태
 * @param output 라인 출력 (COMPLETED일 때만 값이 있음)
 * @param aggregationInputs 집계 노드가 참조하는 값
 * @param error 실패 원인 (FAILED가 아니면 null 가능)
 * @param startTime 실행 시작 시각
 * @param endTime 실행 종료 시각
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public record LineResult(
    int index,
    ExecutionStatus status,
    Map<String, Object> output,
    Map<String, Object> aggregationInputs,
    ErrorInfo error,
    Instant startTime,
    Instant endTime
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public LineResult {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("startTime and endTime cannot be null");
        }
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime cannot be before startTime (line " + index + ")");
        }
        if (status == ExecutionStatus.FAILED && error == null) {
            throw new IllegalArgumentException("error cannot be null for FAILED line " + index);
        }
        output = status == ExecutionStatus.COMPLETED ? immutableCopy(output) : Collections.emptyMap();
        aggregationInputs = immutableCopy(aggregationInputs);
    }

    /**
     * 성공 결과 생성.
     *
     * @param index 라인 위치
     * @param output 라인 출력
     * @param aggregationInputs 집계 입력 값
     * @param startTime 시작 시각
     * @param endTime 종료 시각
     * @return COMPLETED 상태의 LineResult
     */
    public static LineResult completed(int index, Map<String, Object> output, Map<String, Object> aggregationInputs,
                                       Instant startTime, Instant endTime) {
        return new LineResult(index, ExecutionStatus.COMPLETED, output, aggregationInputs, null, startTime, endTime);
    }

    /**
     * 실패 결과 생성.
     *
     * @param index 라인 위치
     * @param error 실패 원인
     * @param aggregationInputs 실패 전까지 계산된 집계 입력 값 (null 허용)
     * @param startTime 시작 시각
     * @param endTime 종료 시각
     * @return FAILED 상태의 LineResult
     */
    public static LineResult failed(int index, ErrorInfo error, Map<String, Object> aggregationInputs,
                                    Instant startTime, Instant endTime) {
        return new LineResult(index, ExecutionStatus.FAILED, null, aggregationInputs, error, startTime, endTime);
    }

    /**
     * 취소 결과 생성.
     *
     * @param index 라인 위치
     * @param startTime 시작 시각
     * @param endTime 종료 시각
     * @return CANCELED 상태의 LineResult
     */
    public static LineResult canceled(int index, Instant startTime, Instant endTime) {
        return new LineResult(index, ExecutionStatus.CANCELED, null, null, null, startTime, endTime);
    }

    /**
     * 성공 여부.
     *
     * @return COMPLETED인 경우 true
     */
    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }

    /**
     * 라인 실행 소요 시간.
     *
     * @return startTime ~ endTime
     */
    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    private static Map<String, Object> immutableCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
