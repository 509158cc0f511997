package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.core.executor.FlowExecutor;
import com.ryuqq.flowbatch.core.model.AggregationResult;
import com.ryuqq.flowbatch.core.model.ErrorInfo;
import com.ryuqq.flowbatch.core.model.LineInput;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.core.model.RunId;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 executor.
 *
 * <p>라인마다 지정한 시간만큼 대기하고, 동시 실행 수와 시작된 라인을 기록합니다.
 * failingLines에 있는 라인은 FAILED로, blockingLines에 있는 라인은 인터럽트될 때까지 대기합니다.</p>
 */
class RecordingFlowExecutor implements FlowExecutor {

    final AtomicInteger current = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();
    final AtomicInteger releaseCount = new AtomicInteger();
    final Set<Integer> started = ConcurrentHashMap.newKeySet();
    final CountDownLatch firstLineStarted = new CountDownLatch(1);

    private final long delayMs;
    private final Set<Integer> failingLines;
    private final Set<Integer> blockingLines;

    RecordingFlowExecutor(long delayMs) {
        this(delayMs, Set.of(), Set.of());
    }

    RecordingFlowExecutor(long delayMs, Set<Integer> failingLines, Set<Integer> blockingLines) {
        this.delayMs = delayMs;
        this.failingLines = failingLines;
        this.blockingLines = blockingLines;
    }

    @Override
    public LineResult executeLine(LineInput input, RunId runId) throws InterruptedException {
        Instant start = Instant.now();
        started.add(input.index());
        peak.accumulateAndGet(current.incrementAndGet(), Math::max);
        firstLineStarted.countDown();
        try {
            if (blockingLines.contains(input.index())) {
                new CountDownLatch(1).await();
            }
            Thread.sleep(delayMs);
            if (failingLines.contains(input.index())) {
                return LineResult.failed(input.index(), ErrorInfo.of("ValueError", "bad line " + input.index()),
                    null, start, Instant.now());
            }
            return LineResult.completed(input.index(), Map.of("answer", "a" + input.index()),
                Map.of("${echo.output}", input.index()), start, Instant.now());
        } finally {
            current.decrementAndGet();
        }
    }

    @Override
    public AggregationResult executeAggregation(Map<String, List<Object>> inputs,
                                                Map<String, List<Object>> aggregationInputs, RunId runId) {
        return new AggregationResult(Map.of("count", inputs.values().stream().findFirst().map(List::size).orElse(0)),
            Map.of(), Map.of());
    }

    @Override
    public void release() {
        releaseCount.incrementAndGet();
    }
}
