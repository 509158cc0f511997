package com.ryuqq.flowbatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 집계 노드 실행 결과.
 *
 * <p>집계 실패는 노드 단위로 기록되며 배치 전체를 실패시키지 않습니다.
 * 집계 호출 자체가 예외를 던진 경우는 이 객체가 아니라 예외로 전파됩니다.</p>
 *
 * @param output 집계 노드 이름 → 출력
 * @param metrics 노드 수준 메트릭 (예: 토큰 수, 점수)
 * @param nodeErrors 실패한 집계 노드 이름 → 실패 원인
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public record AggregationResult(
    Map<String, Object> output,
    Map<String, Object> metrics,
    Map<String, ErrorInfo> nodeErrors
) {

    private static final AggregationResult EMPTY =
        new AggregationResult(Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap());

    /**
     * Compact Constructor.
     *
     * <p>null 맵은 빈 맵으로 정규화합니다.</p>
     */
    public AggregationResult {
        output = copyOf(output);
        metrics = copyOf(metrics);
        nodeErrors = copyOf(nodeErrors);
    }

    /**
     * 빈 집계 결과.
     *
     * @return 출력, 메트릭, 오류가 모두 비어 있는 결과
     */
    public static AggregationResult empty() {
        return EMPTY;
    }

    /**
     * 실패한 집계 노드가 있는지 확인.
     *
     * @return nodeErrors가 비어 있지 않으면 true
     */
    public boolean hasNodeErrors() {
        return !nodeErrors.isEmpty();
    }

    private static <V> Map<String, V> copyOf(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
