package com.ryuqq.flowbatch.adapter.inmemory.executor;

import com.ryuqq.flowbatch.core.executor.FlowExecutor;
import com.ryuqq.flowbatch.core.model.AggregationResult;
import com.ryuqq.flowbatch.core.model.ErrorInfo;
import com.ryuqq.flowbatch.core.model.FlowDefinition;
import com.ryuqq.flowbatch.core.model.LineInput;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.core.model.RunId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java 함수로 flow를 실행하는 in-process 백엔드.
 *
 * <p>라인 함수가 던진 예외는 라인 실패(FAILED)로, 집계 함수가 던진 예외는
 * 모든 집계 노드의 노드 오류로 기록합니다. 예외를 밖으로 던지는 경우는
 * release 이후 호출과 인터럽트뿐입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FunctionFlowExecutor executor = FunctionFlowExecutor.builder(flow)
 *     .line((inputs, runId) -&gt; LineOutput.of(Map.of("answer", answer(inputs))))
 *     .aggregation((inputs, aggregationInputs) -&gt; Map.of("accuracy", accuracy(aggregationInputs)))
 *     .build();
 * </pre>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class FunctionFlowExecutor implements FlowExecutor {

    private static final Logger log = LoggerFactory.getLogger(FunctionFlowExecutor.class);

    /**
     * 라인 하나를 계산하는 함수.
     */
    @FunctionalInterface
    public interface LineFunction {

        LineOutput apply(Map<String, Object> inputs, RunId runId) throws Exception;
    }

    /**
     * 성공 라인들의 컬럼으로 집계 출력을 계산하는 함수.
     */
    @FunctionalInterface
    public interface AggregationFunction {

        Map<String, Object> apply(Map<String, List<Object>> inputs, Map<String, List<Object>> aggregationInputs) throws Exception;
    }

    /**
     * 라인 함수의 결과.
     *
     * @param output 라인 출력
     * @param aggregationInputs 집계 입력 속성 → 값
     */
    public record LineOutput(Map<String, Object> output, Map<String, Object> aggregationInputs) {

        public LineOutput {
            output = output == null ? Map.of() : output;
            aggregationInputs = aggregationInputs == null ? Map.of() : aggregationInputs;
        }

        public static LineOutput of(Map<String, Object> output) {
            return new LineOutput(output, Map.of());
        }
    }

    private final FlowDefinition flow;
    private final LineFunction lineFunction;
    private final AggregationFunction aggregationFunction;
    private final boolean concurrentLines;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private FunctionFlowExecutor(Builder builder) {
        this.flow = builder.flow;
        this.lineFunction = builder.lineFunction;
        this.aggregationFunction = builder.aggregationFunction;
        this.concurrentLines = builder.concurrentLines;
    }

    /**
     * Builder 생성.
     *
     * @param flow 실행할 flow 정의
     * @return Builder
     * @throws IllegalArgumentException flow가 null인 경우
     */
    public static Builder builder(FlowDefinition flow) {
        if (flow == null) {
            throw new IllegalArgumentException("flow cannot be null");
        }
        return new Builder(flow);
    }

    @Override
    public LineResult executeLine(LineInput input, RunId runId) throws InterruptedException {
        ensureNotReleased();
        Instant startTime = Instant.now();
        try {
            LineOutput result = lineFunction.apply(input.values(), runId);
            if (result == null) {
                result = LineOutput.of(Map.of());
            }
            return LineResult.completed(input.index(), result.output(), result.aggregationInputs(), startTime, Instant.now());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.debug("Line {} of run {} failed: {}", input.index(), runId, e.toString());
            return LineResult.failed(input.index(), ErrorInfo.from(e), null, startTime, Instant.now());
        }
    }

    @Override
    public boolean supportsConcurrentLines() {
        return concurrentLines;
    }

    @Override
    public AggregationResult executeAggregation(Map<String, List<Object>> inputs,
                                                Map<String, List<Object>> aggregationInputs,
                                                RunId runId) throws InterruptedException {
        ensureNotReleased();
        if (aggregationFunction == null) {
            return AggregationResult.empty();
        }
        long started = System.nanoTime();
        try {
            Map<String, Object> output = aggregationFunction.apply(inputs, aggregationInputs);
            Map<String, Object> metrics = Map.of("duration_ms", (System.nanoTime() - started) / 1_000_000);
            return new AggregationResult(output, metrics, Map.of());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            Map<String, ErrorInfo> nodeErrors = new LinkedHashMap<>();
            for (String node : flow.getAggregationNodeNames()) {
                nodeErrors.put(node, ErrorInfo.from(e));
            }
            return new AggregationResult(Map.of(), Map.of(), nodeErrors);
        }
    }

    /**
     * 리소스 해제 (멱등).
     */
    @Override
    public void release() {
        if (released.compareAndSet(false, true)) {
            log.debug("FunctionFlowExecutor for flow '{}' released", flow.getName());
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    private void ensureNotReleased() {
        if (released.get()) {
            throw new IllegalStateException("executor for flow '" + flow.getName() + "' has already been released");
        }
    }

    /**
     * FunctionFlowExecutor Builder.
     */
    public static final class Builder {

        private final FlowDefinition flow;
        private LineFunction lineFunction;
        private AggregationFunction aggregationFunction;
        private boolean concurrentLines = true;

        private Builder(FlowDefinition flow) {
            this.flow = flow;
        }

        public Builder line(LineFunction lineFunction) {
            this.lineFunction = lineFunction;
            return this;
        }

        public Builder aggregation(AggregationFunction aggregationFunction) {
            this.aggregationFunction = aggregationFunction;
            return this;
        }

        /**
         * 라인 함수가 스레드 안전하지 않으면 false (동시성 상한이 1이 됨).
         */
        public Builder concurrentLines(boolean concurrentLines) {
            this.concurrentLines = concurrentLines;
            return this;
        }

        /**
         * FunctionFlowExecutor 생성.
         *
         * @return FunctionFlowExecutor
         * @throws IllegalArgumentException 라인 함수가 없는 경우
         */
        public FunctionFlowExecutor build() {
            if (lineFunction == null) {
                throw new IllegalArgumentException("lineFunction cannot be null");
            }
            return new FunctionFlowExecutor(this);
        }
    }
}
