package com.ryuqq.flowbatch.testkit;

import com.ryuqq.flowbatch.core.executor.ExecutionMode;
import com.ryuqq.flowbatch.core.executor.FlowExecutor;
import com.ryuqq.flowbatch.core.model.AggregationResult;
import com.ryuqq.flowbatch.core.model.ErrorInfo;
import com.ryuqq.flowbatch.core.model.FlowDefinition;
import com.ryuqq.flowbatch.core.model.LineInput;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.core.model.RunId;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntToLongFunction;

/**
 * Contract Test용 스크립트 executor.
 *
 * <p>라인별 동작(지연, 실패, 무한 대기)을 미리 정해 두고 실행 중 관측값을 기록합니다.</p>
 *
 * <p><strong>기록하는 값:</strong></p>
 * <ul>
 *   <li>동시 실행 라인 수의 최댓값 (peak)</li>
 *   <li>시작된 라인 index</li>
 *   <li>집계 호출 인자</li>
 *   <li>release 호출 횟수</li>
 *   <li>release 시점에 아직 실행 중이던 라인 수</li>
 * </ul>
 *
 * <p>라인 출력은 {@code answer = "A:" + question}이고, flow의 모든 집계 입력 속성에 같은 값을 담습니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class ScriptedFlowExecutor implements FlowExecutor {

    /**
     * 집계 호출 한 번의 인자.
     *
     * @param inputs 입력 컬럼
     * @param aggregationInputs 집계 입력 컬럼
     */
    public record AggregationCall(Map<String, List<Object>> inputs, Map<String, List<Object>> aggregationInputs) {
    }

    private final List<String> aggregationProperties;
    private final IntToLongFunction delayMs;
    private final Set<Integer> failingLines;
    private final Set<Integer> blockingLines;
    private final ExecutionMode executionMode;
    private final boolean concurrentLines;
    private final long interruptLatencyMs;

    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private final AtomicInteger releaseCount = new AtomicInteger();
    private final AtomicInteger activeLinesAtRelease = new AtomicInteger(-1);
    private final Set<Integer> started = new HashSet<>();
    private final List<AggregationCall> aggregationCalls = new CopyOnWriteArrayList<>();

    private ScriptedFlowExecutor(Builder builder) {
        this.aggregationProperties = builder.flow.getAggregationInputProperties();
        this.delayMs = builder.delayMs;
        this.failingLines = Set.copyOf(builder.failingLines);
        this.blockingLines = Set.copyOf(builder.blockingLines);
        this.executionMode = builder.executionMode;
        this.concurrentLines = builder.concurrentLines;
        this.interruptLatencyMs = builder.interruptLatencyMs;
    }

    public static Builder builder(FlowDefinition flow) {
        return new Builder(flow);
    }

    @Override
    public LineResult executeLine(LineInput input, RunId runId) throws InterruptedException {
        Instant start = Instant.now();
        int index = input.index();
        markStarted(index);
        peak.accumulateAndGet(current.incrementAndGet(), Math::max);
        try {
            try {
                if (blockingLines.contains(index)) {
                    new CountDownLatch(1).await();
                }
                long delay = delayMs.applyAsLong(index);
                if (delay > 0) {
                    Thread.sleep(delay);
                }
            } catch (InterruptedException e) {
                lingerAfterInterrupt();
                throw e;
            }
            if (failingLines.contains(index)) {
                return LineResult.failed(index, ErrorInfo.of("ValueError", "scripted failure at line " + index),
                    null, start, Instant.now());
            }
            String answer = "A:" + input.values().getOrDefault("question", index);
            Map<String, Object> aggregationInputs = new LinkedHashMap<>();
            for (String property : aggregationProperties) {
                aggregationInputs.put(property, answer);
            }
            return LineResult.completed(index, Map.of("answer", answer), aggregationInputs, start, Instant.now());
        } finally {
            current.decrementAndGet();
        }
    }

    @Override
    public ExecutionMode executionMode() {
        return executionMode;
    }

    @Override
    public boolean supportsConcurrentLines() {
        return concurrentLines;
    }

    @Override
    public List<LineResult> executeBatch(List<LineInput> inputs, Path outputDir, RunId runId) throws InterruptedException {
        List<LineResult> results = new ArrayList<>(inputs.size());
        for (LineInput input : inputs) {
            results.add(executeLine(input, runId));
        }
        return results;
    }

    @Override
    public AggregationResult executeAggregation(Map<String, List<Object>> inputs,
                                                Map<String, List<Object>> aggregationInputs, RunId runId) {
        aggregationCalls.add(new AggregationCall(inputs, aggregationInputs));
        int lines = inputs.values().stream().findFirst().map(List::size).orElse(0);
        return new AggregationResult(Map.of("lines", lines), Map.of(), Map.of());
    }

    @Override
    public void release() {
        activeLinesAtRelease.compareAndSet(-1, current.get());
        releaseCount.incrementAndGet();
    }

    /**
     * 라인이 시작될 때까지 대기.
     *
     * @param index 라인 index
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 시간 안에 시작되었으면 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean awaitStarted(int index, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        synchronized (started) {
            while (!started.contains(index)) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                started.wait(remainingMs);
            }
            return true;
        }
    }

    public int getPeakConcurrency() {
        return peak.get();
    }

    public int getReleaseCount() {
        return releaseCount.get();
    }

    /**
     * 첫 release 호출 시점에 실행 중이던 라인 수.
     *
     * @return 라인 수 (release가 호출되지 않았으면 -1)
     */
    public int getActiveLinesAtRelease() {
        return activeLinesAtRelease.get();
    }

    public int getStartedCount() {
        synchronized (started) {
            return started.size();
        }
    }

    public List<AggregationCall> getAggregationCalls() {
        return List.copyOf(aggregationCalls);
    }

    // 인터럽트에 바로 반응하지 않는 라인 흉내. 추가 인터럽트가 와도 지연을 채운 뒤 돌아감
    private void lingerAfterInterrupt() {
        if (interruptLatencyMs <= 0) {
            return;
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(interruptLatencyMs);
        long remainingNanos;
        while ((remainingNanos = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remainingNanos);
            } catch (InterruptedException ignored) {
                // 지연이 끝날 때까지 계속 대기
            }
        }
    }

    private void markStarted(int index) {
        synchronized (started) {
            started.add(index);
            started.notifyAll();
        }
    }

    /**
     * ScriptedFlowExecutor 빌더.
     */
    public static final class Builder {

        private final FlowDefinition flow;
        private IntToLongFunction delayMs = index -> 0L;
        private final Set<Integer> failingLines = new HashSet<>();
        private final Set<Integer> blockingLines = new HashSet<>();
        private ExecutionMode executionMode = ExecutionMode.PER_LINE;
        private boolean concurrentLines = true;
        private long interruptLatencyMs;

        private Builder(FlowDefinition flow) {
            if (flow == null) {
                throw new IllegalArgumentException("flow cannot be null");
            }
            this.flow = flow;
        }

        public Builder delayMs(long delayMs) {
            return delayMs(index -> delayMs);
        }

        /**
         * 라인별 지연 시간.
         *
         * @param delayMs index → 지연 시간 (밀리초)
         * @return this
         */
        public Builder delayMs(IntToLongFunction delayMs) {
            if (delayMs == null) {
                throw new IllegalArgumentException("delayMs cannot be null");
            }
            this.delayMs = delayMs;
            return this;
        }

        public Builder failOn(Integer... indexes) {
            failingLines.addAll(List.of(indexes));
            return this;
        }

        /**
         * 인터럽트될 때까지 돌아오지 않는 라인 지정.
         */
        public Builder blockOn(Integer... indexes) {
            blockingLines.addAll(List.of(indexes));
            return this;
        }

        /**
         * 인터럽트를 받은 라인이 실제로 돌아오기까지 걸리는 시간.
         *
         * @param interruptLatencyMs 지연 시간 (밀리초)
         * @return this
         */
        public Builder interruptLatencyMs(long interruptLatencyMs) {
            if (interruptLatencyMs < 0) {
                throw new IllegalArgumentException("interruptLatencyMs must not be negative (current: " + interruptLatencyMs + ")");
            }
            this.interruptLatencyMs = interruptLatencyMs;
            return this;
        }

        public Builder wholeBatch() {
            this.executionMode = ExecutionMode.WHOLE_BATCH;
            return this;
        }

        public Builder sequentialOnly() {
            this.concurrentLines = false;
            return this;
        }

        public ScriptedFlowExecutor build() {
            return new ScriptedFlowExecutor(this);
        }
    }
}
