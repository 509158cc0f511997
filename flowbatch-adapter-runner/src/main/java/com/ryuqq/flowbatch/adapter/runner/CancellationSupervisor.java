package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.core.cancel.CancellationToken;
import com.ryuqq.flowbatch.core.error.ErrorTarget;
import com.ryuqq.flowbatch.core.error.UnexpectedBatchException;
import com.ryuqq.flowbatch.core.model.BatchResult;
import com.ryuqq.flowbatch.core.model.ExecutionStatus;
import com.ryuqq.flowbatch.core.model.RunId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * run 본문 감독자.
 *
 * <p>run 본문을 별도 스레드에서 실행하고, "본문 종료"와 "취소 신호" 중 먼저 오는 쪽을
 * 폴링 없이 기다립니다.</p>
 *
 * <p><strong>취소 처리:</strong></p>
 * <pre>
 * 1. 본문 스레드와 worker pool 인터럽트 (새 라인 제출 중단, 실행 중인 라인 중단 요청)
 * 2. abortGracePeriodMs 안에서 스레드 종료 대기
 * 3. 기한 안에 멈추지 않은 작업은 경고 로그 후 버림
 * 4. 지금까지 기록된 결과로 CANCELED BatchResult 생성
 * </pre>
 *
 * <p>본문이 취소 전에 끝났으면 본문 결과를 그대로 반환하고, 본문의 예외는 그대로 다시 던집니다.
 * 대기 중인 호출 스레드가 인터럽트되면 취소로 처리한 뒤 인터럽트 상태를 복원합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class CancellationSupervisor {

    private static final Logger log = LoggerFactory.getLogger(CancellationSupervisor.class);

    private final CancellationToken cancellationToken;
    private final RunProgress progress;
    private final long abortGracePeriodMs;

    /**
     * 생성자.
     *
     * @param cancellationToken run 취소 신호
     * @param progress 기록된 결과 저장소
     * @param abortGracePeriodMs 취소 후 작업 종료를 기다리는 최대 시간 (밀리초)
     * @throws IllegalArgumentException 의존성이 null이거나 유예 시간이 음수인 경우
     */
    public CancellationSupervisor(CancellationToken cancellationToken, RunProgress progress, long abortGracePeriodMs) {
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        if (abortGracePeriodMs < 0) {
            throw new IllegalArgumentException("abortGracePeriodMs must not be negative (current: " + abortGracePeriodMs + ")");
        }
        this.cancellationToken = cancellationToken;
        this.progress = progress;
        this.abortGracePeriodMs = abortGracePeriodMs;
    }

    /**
     * run 본문을 감독하며 실행.
     *
     * @param runId Run ID
     * @param startTime run 시작 시각 (CANCELED 결과에 사용)
     * @param body run 본문
     * @param linePool 본문이 라인 실행에 쓰는 worker pool (없으면 null)
     * @return 본문 결과 또는 CANCELED 결과
     * @throws RuntimeException 본문이 던진 예외 (checked 예외는 UnexpectedBatchException으로 감쌈)
     */
    public BatchResult supervise(RunId runId, Instant startTime, Callable<BatchResult> body, ExecutorService linePool) {
        if (runId == null || startTime == null || body == null) {
            throw new IllegalArgumentException("runId, startTime and body cannot be null");
        }

        CountDownLatch finishedOrCanceled = new CountDownLatch(1);
        Runnable cancelListener = finishedOrCanceled::countDown;
        ExecutorService runner = Executors.newSingleThreadExecutor(new NamedThreadFactory("flowbatch-run-" + runId.getValue()));
        boolean callerInterrupted = false;

        try {
            Future<BatchResult> task = runner.submit(() -> {
                try {
                    return body.call();
                } finally {
                    finishedOrCanceled.countDown();
                }
            });
            cancellationToken.onCancel(cancelListener);

            try {
                finishedOrCanceled.await();
            } catch (InterruptedException e) {
                callerInterrupted = true;
                log.warn("Thread waiting for run {} was interrupted, canceling the run", runId);
                cancellationToken.cancel();
            }

            // cancel(true)가 실패하면 본문이 이미 끝난 것이므로 본문 결과를 따름
            if (cancellationToken.isCancellationRequested() && task.cancel(true)) {
                return abortAndReport(runId, startTime, runner, linePool);
            }
            return awaitBody(runId, startTime, task, runner, linePool);
        } finally {
            cancellationToken.removeListener(cancelListener);
            runner.shutdownNow();
            if (callerInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private BatchResult awaitBody(RunId runId, Instant startTime, Future<BatchResult> task,
                                  ExecutorService runner, ExecutorService linePool) {
        try {
            return task.get();
        } catch (CancellationException e) {
            return abortAndReport(runId, startTime, runner, linePool);
        } catch (InterruptedException e) {
            cancellationToken.cancel();
            task.cancel(true);
            try {
                return abortAndReport(runId, startTime, runner, linePool);
            } finally {
                Thread.currentThread().interrupt();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RunCanceledException) {
                log.warn(cause.getMessage());
                return abortAndReport(runId, startTime, runner, linePool);
            }
            if (cause instanceof InterruptedException && cancellationToken.isCancellationRequested()) {
                return abortAndReport(runId, startTime, runner, linePool);
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new UnexpectedBatchException(ErrorTarget.BATCH, "executing the batch run", cause);
        }
    }

    // 모든 CANCELED 종료는 in-flight 라인이 멈출 때까지 유예 시간만큼 기다린 뒤 결과를 만듦
    private BatchResult abortAndReport(RunId runId, Instant startTime, ExecutorService runner, ExecutorService linePool) {
        abort(runId, runner, linePool);
        return canceledResult(runId, startTime);
    }

    private void abort(RunId runId, ExecutorService runner, ExecutorService linePool) {
        log.warn("Run {} cancel requested, aborting in-flight work (grace period {}ms)", runId, abortGracePeriodMs);
        runner.shutdownNow();
        if (linePool != null) {
            linePool.shutdownNow();
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(abortGracePeriodMs);
        boolean stopped;
        try {
            stopped = runner.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS)
                && (linePool == null || linePool.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopped = false;
        }
        if (!stopped) {
            log.warn("Run {} still has work running {}ms after cancel, abandoning it", runId, abortGracePeriodMs);
        }
    }

    private BatchResult canceledResult(RunId runId, Instant startTime) {
        BatchResult result = BatchResult.create(startTime, Instant.now(), progress.snapshot(),
            progress.getAggregationResult(), ExecutionStatus.CANCELED);
        log.warn("Run {} canceled with {} recorded lines", runId, result.getTotalLines());
        return result;
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }
}
