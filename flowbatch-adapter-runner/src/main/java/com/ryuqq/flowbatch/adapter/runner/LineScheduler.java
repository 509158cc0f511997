package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.core.cancel.CancellationToken;
import com.ryuqq.flowbatch.core.executor.FlowExecutor;
import com.ryuqq.flowbatch.core.model.ErrorInfo;
import com.ryuqq.flowbatch.core.model.LineInput;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.core.model.RunId;
import com.ryuqq.flowbatch.core.protection.Bulkhead;
import com.ryuqq.flowbatch.core.protection.BulkheadConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * 라인 단위 fan-out 스케줄러.
 *
 * <p>호출 스레드가 제어 스레드가 되어 라인을 worker pool에 제출하고 완료 이벤트를 수집합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(inputs)
 *   ↓
 * 1. index 순서로 Bulkhead permit 획득 → 획득한 라인만 제출 (최대 C개 실행 중)
 * 2. events.take() → 완료된 순서대로 하나씩 수집
 *    - 라인 결과: RunProgress 기록 → permit 반납 → 진행률 로그 → 1로 돌아가 빈 자리 채움
 *    - 취소 이벤트: 실행 중인 라인 인터럽트 → RunCanceledException
 * 3. 모든 라인 기록 후 index 오름차순 결과 반환
 * </pre>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>permit 획득이 제출보다 먼저 일어나므로 실행 중인 라인 수는 상한을 넘지 않음</li>
 *   <li>취소 요청 후에는 새 라인을 제출하지 않음</li>
 *   <li>executeLine이 던진 예외는 해당 라인의 FAILED 결과가 되고 다른 라인은 계속 실행</li>
 *   <li>RunProgress에 쓰는 스레드는 제어 스레드 하나뿐</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class LineScheduler {

    private static final Logger log = LoggerFactory.getLogger(LineScheduler.class);

    private final FlowExecutor executor;
    private final ExecutorService linePool;
    private final BatchEngineConfig config;
    private final CancellationToken cancellationToken;
    private final RunProgress progress;

    private volatile Bulkhead bulkhead;

    /**
     * 생성자.
     *
     * @param executor 라인 실행 백엔드
     * @param linePool 라인을 실행할 worker pool (상한 이상의 스레드를 가져야 함)
     * @param config 엔진 설정
     * @param cancellationToken run 취소 신호
     * @param progress 결과 기록 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LineScheduler(FlowExecutor executor, ExecutorService linePool, BatchEngineConfig config,
                         CancellationToken cancellationToken, RunProgress progress) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (linePool == null) {
            throw new IllegalArgumentException("linePool cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        this.executor = executor;
        this.linePool = linePool;
        this.config = config;
        this.cancellationToken = cancellationToken;
        this.progress = progress;
    }

    /**
     * 모든 라인 실행.
     *
     * @param inputs 라인 입력 (index 0..N-1)
     * @param runId Run ID
     * @return index 오름차순 라인 결과 (N개)
     * @throws InterruptedException 제어 스레드가 인터럽트된 경우
     * @throws RunCanceledException 취소 신호를 받은 경우
     */
    public List<LineResult> execute(List<LineInput> inputs, RunId runId) throws InterruptedException {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        if (inputs.isEmpty()) {
            return List.of();
        }

        int ceiling = config.effectiveConcurrency(inputs.size(), executor.supportsConcurrentLines());
        Bulkhead gate = new SemaphoreBulkhead(new BulkheadConfig(ceiling));
        this.bulkhead = gate;

        BlockingQueue<Event> events = new LinkedBlockingQueue<>();
        Runnable cancelListener = () -> events.offer(Event.CANCEL);
        cancellationToken.onCancel(cancelListener);

        Map<Integer, Future<?>> inFlight = new HashMap<>();
        ProgressLogger progressLogger = new ProgressLogger(inputs.size(), config.progressLogIntervalLines(), Instant.now());
        log.info("Run {} executing {} lines with concurrency {}", runId, inputs.size(), ceiling);

        int next = 0;
        int finished = 0;
        try {
            while (finished < inputs.size()) {
                while (next < inputs.size() && !cancellationToken.isCancellationRequested() && gate.tryAcquire(next)) {
                    LineInput input = inputs.get(next);
                    inFlight.put(input.index(), linePool.submit(() -> runLine(input, runId, events)));
                    next++;
                }

                Event event = events.take();
                if (event.isCancel()) {
                    throw new RunCanceledException(String.format(
                        "Run %s canceled after %d of %d lines (%d in flight)", runId, finished, inputs.size(), inFlight.size()));
                }

                LineResult result = event.result();
                progress.record(result);
                inFlight.remove(result.index());
                gate.release(result.index());
                finished++;
                progressLogger.lineFinished(finished);
            }
            return progress.snapshot();
        } finally {
            cancellationToken.removeListener(cancelListener);
            // 정상 종료 시에는 비어 있음
            for (Future<?> future : inFlight.values()) {
                future.cancel(true);
            }
        }
    }

    /**
     * 마지막 execute 호출에서 관측된 최대 동시 실행 수.
     *
     * @return 최대 동시 실행 수 (실행 전이면 0)
     */
    public int getPeakConcurrency() {
        Bulkhead current = bulkhead;
        return current == null ? 0 : current.getPeakConcurrency();
    }

    private void runLine(LineInput input, RunId runId, BlockingQueue<Event> events) {
        Instant startTime = Instant.now();
        LineResult result = null;
        try {
            result = verified(input, executor.executeLine(input, runId), startTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = LineResult.canceled(input.index(), startTime, Instant.now());
        } catch (Exception | Error e) {
            log.warn("Line {} of run {} raised {}, recording it as failed", input.index(), runId, e.toString());
            result = LineResult.failed(input.index(), ErrorInfo.from(e), null, startTime, Instant.now());
        } finally {
            if (result == null) {
                result = LineResult.failed(input.index(),
                    ErrorInfo.of("Error", "line execution terminated abnormally"), null, startTime, Instant.now());
            }
            events.offer(new Event(result));
        }
    }

    private static LineResult verified(LineInput input, LineResult result, Instant startTime) {
        if (result == null) {
            return LineResult.failed(input.index(),
                ErrorInfo.of("IllegalStateException", "executor returned no result for line " + input.index()),
                null, startTime, Instant.now());
        }
        if (result.index() != input.index()) {
            return LineResult.failed(input.index(),
                ErrorInfo.of("IllegalStateException",
                    "executor returned result for line " + result.index() + " while executing line " + input.index()),
                null, startTime, Instant.now());
        }
        return result;
    }

    /**
     * 제어 스레드로 전달되는 이벤트. result가 null이면 취소.
     */
    private record Event(LineResult result) {

        static final Event CANCEL = new Event(null);

        boolean isCancel() {
            return result == null;
        }
    }
}
