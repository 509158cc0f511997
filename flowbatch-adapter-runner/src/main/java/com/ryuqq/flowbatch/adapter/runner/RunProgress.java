package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.core.model.AggregationResult;
import com.ryuqq.flowbatch.core.model.LineResult;

import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * run 하나의 기록된 결과 저장소.
 *
 * <p>쓰기는 run 본문 스레드(스케줄러 제어 스레드)만 수행하고, 취소 시에는
 * {@link CancellationSupervisor}가 다른 스레드에서 스냅샷을 읽습니다.
 * 이미 기록된 결과는 덮어쓸 수 없습니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class RunProgress {

    private final ConcurrentSkipListMap<Integer, LineResult> recorded = new ConcurrentSkipListMap<>();
    private volatile AggregationResult aggregationResult = AggregationResult.empty();

    /**
     * 라인 결과 기록.
     *
     * @param result 라인 결과
     * @throws IllegalArgumentException result가 null인 경우
     * @throws IllegalStateException 같은 index가 이미 기록된 경우
     */
    public void record(LineResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (recorded.putIfAbsent(result.index(), result) != null) {
            throw new IllegalStateException("line " + result.index() + " has already been recorded");
        }
    }

    /**
     * 기록된 결과의 스냅샷.
     *
     * @return index 오름차순 결과 목록
     */
    public List<LineResult> snapshot() {
        return List.copyOf(recorded.values());
    }

    public int recordedCount() {
        return recorded.size();
    }

    public AggregationResult getAggregationResult() {
        return aggregationResult;
    }

    public void setAggregationResult(AggregationResult aggregationResult) {
        this.aggregationResult = aggregationResult == null ? AggregationResult.empty() : aggregationResult;
    }
}
