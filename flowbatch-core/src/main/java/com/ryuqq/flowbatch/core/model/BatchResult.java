package com.ryuqq.flowbatch.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 배치 실행의 최종 요약 (불변).
 *
 * <p>run 하나당 마지막에 정확히 한 번 생성됩니다. 정상 종료, 취소 모두
 * 같은 팩토리를 통해 만들어집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>lineResults는 완료 순서와 무관하게 index 오름차순</li>
 *   <li>동일 index의 LineResult는 하나만 존재</li>
 *   <li>endTime은 startTime 이후</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchResult result = engine.run(request);
 * if (result.getStatus() == ExecutionStatus.CANCELED) {
 *     log.warn("partial result: {} / {} lines", result.getCompletedLines(), result.getTotalLines());
 * }
 * </pre>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class BatchResult {

    private final Instant startTime;
    private final Instant endTime;
    private final ExecutionStatus status;
    private final List<LineResult> lineResults;
    private final AggregationResult aggregationResult;

    private BatchResult(Instant startTime, Instant endTime, ExecutionStatus status,
                        List<LineResult> lineResults, AggregationResult aggregationResult) {
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("startTime and endTime cannot be null");
        }
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime cannot be before startTime");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (lineResults == null) {
            throw new IllegalArgumentException("lineResults cannot be null");
        }
        this.startTime = startTime;
        this.endTime = endTime;
        this.status = status;
        this.lineResults = sortedByIndex(lineResults);
        this.aggregationResult = aggregationResult == null ? AggregationResult.empty() : aggregationResult;
    }

    /**
     * 정상 완료된 배치 결과 생성.
     *
     * @param startTime run 시작 시각
     * @param endTime run 종료 시각
     * @param lineResults 라인 결과 (순서 무관)
     * @param aggregationResult 집계 결과 (null이면 빈 결과)
     * @return COMPLETED 상태의 BatchResult
     * @throws IllegalArgumentException 필수 값이 null이거나 index가 중복된 경우
     */
    public static BatchResult create(Instant startTime, Instant endTime,
                                     List<LineResult> lineResults, AggregationResult aggregationResult) {
        return new BatchResult(startTime, endTime, ExecutionStatus.COMPLETED, lineResults, aggregationResult);
    }

    /**
     * 상태를 지정하여 배치 결과 생성.
     *
     * @param startTime run 시작 시각
     * @param endTime run 종료 시각
     * @param lineResults 라인 결과 (순서 무관)
     * @param aggregationResult 집계 결과 (null이면 빈 결과)
     * @param status run 전체 상태
     * @return BatchResult
     * @throws IllegalArgumentException 필수 값이 null이거나 index가 중복된 경우
     */
    public static BatchResult create(Instant startTime, Instant endTime, List<LineResult> lineResults,
                                     AggregationResult aggregationResult, ExecutionStatus status) {
        return new BatchResult(startTime, endTime, status, lineResults, aggregationResult);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    /**
     * 라인 결과 조회.
     *
     * @return index 오름차순으로 정렬된 불변 리스트
     */
    public List<LineResult> getLineResults() {
        return lineResults;
    }

    public AggregationResult getAggregationResult() {
        return aggregationResult;
    }

    /**
     * run 소요 시간.
     *
     * @return startTime ~ endTime
     */
    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    /**
     * 결과가 기록된 라인 수.
     *
     * <p>취소된 run에서는 입력 라인 수보다 작을 수 있습니다.</p>
     *
     * @return 라인 결과 개수
     */
    public int getTotalLines() {
        return lineResults.size();
    }

    public int getCompletedLines() {
        return countByStatus(ExecutionStatus.COMPLETED);
    }

    public int getFailedLines() {
        return countByStatus(ExecutionStatus.FAILED);
    }

    /**
     * 실패한 라인의 index → 원인 매핑.
     *
     * @return index 오름차순 매핑
     */
    public Map<Integer, ErrorInfo> getLineErrors() {
        Map<Integer, ErrorInfo> errors = new LinkedHashMap<>();
        for (LineResult lineResult : lineResults) {
            if (lineResult.status() == ExecutionStatus.FAILED) {
                errors.put(lineResult.index(), lineResult.error());
            }
        }
        return Collections.unmodifiableMap(errors);
    }

    private int countByStatus(ExecutionStatus target) {
        int count = 0;
        for (LineResult lineResult : lineResults) {
            if (lineResult.status() == target) {
                count++;
            }
        }
        return count;
    }

    private static List<LineResult> sortedByIndex(List<LineResult> source) {
        List<LineResult> sorted = new ArrayList<>(source);
        sorted.sort(Comparator.comparingInt(LineResult::index));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).index() == sorted.get(i - 1).index()) {
                throw new IllegalArgumentException("duplicate line index: " + sorted.get(i).index());
            }
        }
        return Collections.unmodifiableList(sorted);
    }

    @Override
    public String toString() {
        return "BatchResult{status=" + status
            + ", lines=" + lineResults.size()
            + ", completed=" + getCompletedLines()
            + ", failed=" + getFailedLines()
            + ", duration=" + getDuration() + "}";
    }
}
