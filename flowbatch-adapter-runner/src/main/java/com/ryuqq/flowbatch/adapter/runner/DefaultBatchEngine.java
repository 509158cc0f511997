package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.application.engine.BatchEngine;
import com.ryuqq.flowbatch.application.engine.BatchRunRequest;
import com.ryuqq.flowbatch.core.cancel.CancellationToken;
import com.ryuqq.flowbatch.core.error.ErrorTarget;
import com.ryuqq.flowbatch.core.error.FlowBatchException;
import com.ryuqq.flowbatch.core.error.InputResolutionException;
import com.ryuqq.flowbatch.core.error.LineFailureException;
import com.ryuqq.flowbatch.core.error.UnexpectedBatchException;
import com.ryuqq.flowbatch.core.executor.ExecutionMode;
import com.ryuqq.flowbatch.core.executor.FlowExecutor;
import com.ryuqq.flowbatch.core.model.AggregationResult;
import com.ryuqq.flowbatch.core.model.BatchResult;
import com.ryuqq.flowbatch.core.model.ErrorInfo;
import com.ryuqq.flowbatch.core.model.ExecutionStatus;
import com.ryuqq.flowbatch.core.model.FlowDefinition;
import com.ryuqq.flowbatch.core.model.LineInput;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.core.model.RunId;
import com.ryuqq.flowbatch.core.spi.ExecutorFactory;
import com.ryuqq.flowbatch.core.spi.InputResolver;
import com.ryuqq.flowbatch.core.spi.OutputWriter;
import com.ryuqq.flowbatch.core.statemachine.RunState;
import com.ryuqq.flowbatch.core.statemachine.RunStateTransition;
import com.ryuqq.flowbatch.core.validation.FlowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * BatchEngine 기본 구현체 (run lifecycle 소유).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(request)
 *   ↓
 * 1. 상태 전이 NOT_STARTED → RUNNING (엔진은 한 번만 실행)
 * 2. flow 검증 → ExecutorFactory로 executor 획득
 * 3. InputResolver로 입력 해석 → 라인마다 기본값 적용
 * 4. CancellationSupervisor 아래에서 본문 실행:
 *    a. PER_LINE → LineScheduler / WHOLE_BATCH → executor.executeBatch
 *    b. 라인 실패 정책 (raiseOnLineFailure=true → LineFailureException, false → 에러 로그)
 *    c. AggregationCoordinator
 *    d. COMPLETED 라인 출력 저장 (line_number 포함)
 *    e. BatchResult 생성
 * 5. 상태 전이 RUNNING → COMPLETED / FAILED / CANCELED
 * 6. finally: worker pool 종료, executor.release()
 * </pre>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>{@link FlowBatchException}: 그대로 전파</li>
 *   <li>그 외 RuntimeException: {@link UnexpectedBatchException}(BATCH)으로 감싸 전파</li>
 *   <li>취소: 예외가 아닌 CANCELED 결과</li>
 *   <li>release() 실패: 경고 로그만 남기고 run 결과를 가리지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchEngine engine = new DefaultBatchEngine(flow, registry, new JsonLinesInputResolver(), new JsonLinesOutputWriter(),
 *     new BatchEngineConfig().withConcurrency(8));
 * BatchResult result = engine.run(Map.of("data", inputDir), Map.of("question", "${data.question}"), outputDir);
 * </pre>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class DefaultBatchEngine implements BatchEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultBatchEngine.class);

    private final FlowDefinition flow;
    private final ExecutorFactory executorFactory;
    private final InputResolver inputResolver;
    private final OutputWriter outputWriter;
    private final BatchEngineConfig config;
    private final CancellationToken cancellationToken;
    private final AggregationCoordinator aggregationCoordinator = new AggregationCoordinator();
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.NOT_STARTED);

    /**
     * 생성자 (기본 설정).
     *
     * @param flow flow 정의
     * @param executorFactory executor 팩토리
     * @param inputResolver 입력 해석기
     * @param outputWriter 출력 저장기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultBatchEngine(FlowDefinition flow, ExecutorFactory executorFactory,
                              InputResolver inputResolver, OutputWriter outputWriter) {
        this(flow, executorFactory, inputResolver, outputWriter, new BatchEngineConfig());
    }

    /**
     * 생성자 (커스텀 설정).
     */
    public DefaultBatchEngine(FlowDefinition flow, ExecutorFactory executorFactory,
                              InputResolver inputResolver, OutputWriter outputWriter, BatchEngineConfig config) {
        this(flow, executorFactory, inputResolver, outputWriter, config, new CancellationToken());
    }

    /**
     * 생성자 (외부 취소 토큰 주입).
     *
     * @param flow flow 정의
     * @param executorFactory executor 팩토리
     * @param inputResolver 입력 해석기
     * @param outputWriter 출력 저장기
     * @param config 엔진 설정
     * @param cancellationToken run 취소 신호
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultBatchEngine(FlowDefinition flow, ExecutorFactory executorFactory, InputResolver inputResolver,
                              OutputWriter outputWriter, BatchEngineConfig config, CancellationToken cancellationToken) {
        if (flow == null) {
            throw new IllegalArgumentException("flow cannot be null");
        }
        if (executorFactory == null) {
            throw new IllegalArgumentException("executorFactory cannot be null");
        }
        if (inputResolver == null) {
            throw new IllegalArgumentException("inputResolver cannot be null");
        }
        if (outputWriter == null) {
            throw new IllegalArgumentException("outputWriter cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        this.flow = flow;
        this.executorFactory = executorFactory;
        this.inputResolver = inputResolver;
        this.outputWriter = outputWriter;
        this.config = config;
        this.cancellationToken = cancellationToken;
    }

    @Override
    public BatchResult run(BatchRunRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        RunId runId = RunId.ofNullable(request.runId());
        startRun();

        Instant startTime = Instant.now();
        log.info("Batch run {} started (flow={}, executorKind={})", runId, flow.getName(), flow.getExecutorKind());

        FlowExecutor executor = null;
        ExecutorService linePool = null;
        try {
            FlowValidator.ensureValidForBatch(flow);
            executor = createExecutor();
            List<LineInput> lineInputs = resolveLineInputs(request, runId);

            BatchResult result;
            if (cancellationToken.isCancellationRequested()) {
                log.warn("Batch run {} was canceled before any line started", runId);
                result = BatchResult.create(startTime, Instant.now(), List.of(), AggregationResult.empty(),
                    ExecutionStatus.CANCELED);
            } else {
                if (executor.executionMode() == ExecutionMode.PER_LINE) {
                    int poolSize = config.effectiveConcurrency(lineInputs.size(), executor.supportsConcurrentLines());
                    linePool = Executors.newFixedThreadPool(poolSize, new NamedThreadFactory("flowbatch-line-" + runId.getValue()));
                }
                RunProgress progress = new RunProgress();
                FlowExecutor runExecutor = executor;
                ExecutorService pool = linePool;
                result = new CancellationSupervisor(cancellationToken, progress, config.abortGracePeriodMs())
                    .supervise(runId, startTime,
                        () -> executeBody(request, runId, startTime, runExecutor, lineInputs, progress, pool), pool);
            }

            finish(RunState.fromResultStatus(result.getStatus()));
            log.info("Batch run {} finished: {}", runId, result);
            return result;

        } catch (FlowBatchException e) {
            finish(RunState.FAILED);
            log.error("Batch run {} failed [{}]: {}", runId, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            finish(RunState.FAILED);
            log.error("Batch run {} failed unexpectedly", runId, e);
            throw new UnexpectedBatchException(ErrorTarget.BATCH, "executing the batch run", e);
        } finally {
            if (linePool != null) {
                linePool.shutdownNow();
            }
            release(executor, runId);
        }
    }

    @Override
    public void cancel() {
        if (cancellationToken.cancel()) {
            log.warn("Cancel requested for batch run (state={})", state.get());
        }
    }

    /**
     * 현재 run 상태.
     *
     * @return RunState
     */
    public RunState getState() {
        return state.get();
    }

    private BatchResult executeBody(BatchRunRequest request, RunId runId, Instant startTime, FlowExecutor executor,
                                    List<LineInput> lineInputs, RunProgress progress, ExecutorService linePool)
        throws InterruptedException {

        List<LineResult> lineResults;
        if (executor.executionMode() == ExecutionMode.WHOLE_BATCH) {
            lineResults = executeWholeBatch(executor, lineInputs, request.outputDir(), runId, progress);
        } else {
            lineResults = new LineScheduler(executor, linePool, config, cancellationToken, progress).execute(lineInputs, runId);
        }

        applyLineFailurePolicy(request, runId, lineResults);

        AggregationResult aggregationResult = aggregationCoordinator.aggregate(flow, executor, lineInputs, lineResults, runId);
        progress.setAggregationResult(aggregationResult);

        persistOutputs(request.outputDir(), lineResults);
        return BatchResult.create(startTime, Instant.now(), lineResults, aggregationResult);
    }

    private List<LineResult> executeWholeBatch(FlowExecutor executor, List<LineInput> lineInputs, Path outputDir,
                                               RunId runId, RunProgress progress) throws InterruptedException {
        log.info("Run {} delegating {} lines to {} as a whole batch", runId, lineInputs.size(),
            executor.getClass().getSimpleName());
        List<LineResult> results = executor.executeBatch(lineInputs, outputDir, runId);
        if (results == null) {
            throw new IllegalStateException("executor returned no results for whole-batch execution");
        }
        for (LineResult result : results) {
            progress.record(result);
        }
        return progress.snapshot();
    }

    private void applyLineFailurePolicy(BatchRunRequest request, RunId runId, List<LineResult> lineResults) {
        Map<Integer, ErrorInfo> failures = new LinkedHashMap<>();
        for (LineResult result : lineResults) {
            if (result.status() == ExecutionStatus.FAILED) {
                failures.put(result.index(), result.error());
            }
        }
        if (failures.isEmpty()) {
            return;
        }
        if (request.raiseOnLineFailure()) {
            throw new LineFailureException(failures, lineResults.size());
        }
        log.error("Batch run {} finished lines with failures: {}", runId,
            LineFailureException.summarize(failures, lineResults.size()));
    }

    private void persistOutputs(Path outputDir, List<LineResult> lineResults) {
        List<Map<String, Object>> outputs = new ArrayList<>();
        for (LineResult result : lineResults) {
            if (!result.isCompleted()) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(OutputWriter.LINE_NUMBER_KEY, result.index());
            row.putAll(result.output());
            outputs.add(row);
        }
        outputWriter.persist(outputDir, outputs);
    }

    private FlowExecutor createExecutor() {
        FlowExecutor executor = executorFactory.create(flow);
        if (executor == null) {
            throw new IllegalStateException("executor factory returned no executor for kind '" + flow.getExecutorKind() + "'");
        }
        return executor;
    }

    private List<LineInput> resolveLineInputs(BatchRunRequest request, RunId runId) {
        List<Map<String, Object>> rows = inputResolver.resolve(request.inputDirs(), request.inputsMapping(),
            request.maxLinesCount());
        if (rows == null) {
            throw new InputResolutionException("Input resolver returned no rows for run " + runId.getValue());
        }
        if (rows.isEmpty()) {
            log.warn("Batch run {} resolved no input lines", runId);
        }
        List<LineInput> lineInputs = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            lineInputs.add(LineInput.of(i, FlowValidator.applyDefaults(flow, rows.get(i))));
        }
        return lineInputs;
    }

    private void startRun() {
        RunState current = state.get();
        RunStateTransition.validate(current, RunState.RUNNING);
        if (!state.compareAndSet(current, RunState.RUNNING)) {
            throw new IllegalStateException("BatchEngine is already running (state: " + state.get() + ")");
        }
    }

    private void finish(RunState terminal) {
        state.set(RunStateTransition.transition(state.get(), terminal));
    }

    private void release(FlowExecutor executor, RunId runId) {
        if (executor == null) {
            return;
        }
        try {
            executor.release();
        } catch (RuntimeException e) {
            log.warn("Failed to release executor for batch run {}", runId, e);
        }
    }
}
