package com.ryuqq.flowbatch.testkit.contract;

import com.ryuqq.flowbatch.adapter.runner.BatchEngineConfig;
import com.ryuqq.flowbatch.adapter.runner.DefaultBatchEngine;
import com.ryuqq.flowbatch.core.model.BatchResult;
import com.ryuqq.flowbatch.core.model.ExecutionStatus;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.core.statemachine.RunState;
import com.ryuqq.flowbatch.testkit.AbstractBatchContractTest;
import com.ryuqq.flowbatch.testkit.ScriptedFlowExecutor;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 실행 중 취소.
 *
 * <p>취소는 오류가 아니라 CANCELED 결과입니다. 취소 전에 끝난 라인은 결과에 남고,
 * 결과 라인 수는 입력 라인 수를 넘지 않으며, executor는 한 번만 release됩니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractBatchContractTest {

    private static final BatchEngineConfig CONFIG = new BatchEngineConfig()
        .withConcurrency(2)
        .withAbortGracePeriodMs(2000);

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void 실행_중_취소하면_부분_결과로_CANCELED를_돌려준다() throws Exception {
        // given: line 3은 인터럽트될 때까지 돌아오지 않는다
        writeQuestions(10);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow())
            .delayMs(5)
            .blockOn(3)
            .build();
        DefaultBatchEngine engine = newEngine(qaFlow(), executor, CONFIG);

        CompletableFuture<Void> canceller = CompletableFuture.runAsync(() -> {
            try {
                if (executor.awaitStarted(3, 5000)) {
                    engine.cancel();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // when
        BatchResult result = engine.run(request());
        canceller.join();

        // then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.CANCELED);
        assertThat(engine.getState()).isEqualTo(RunState.CANCELED);
        assertThat(result.getLineResults()).hasSizeLessThanOrEqualTo(10);
        assertThat(result.getLineResults()).extracting(LineResult::index).isSorted().doesNotHaveDuplicates();
        // concurrency 2에서 line 3이 시작되었다면 앞선 라인 중 둘은 이미 기록되었다
        assertThat(result.getLineResults())
            .filteredOn(LineResult::isCompleted)
            .hasSizeGreaterThanOrEqualTo(2);
        assertThat(result.getEndTime()).isAfterOrEqualTo(result.getStartTime());
        assertReleasedOnce(executor);
    }

    @RepeatedTest(5)
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void 인터럽트에_늦게_반응하는_라인도_release_전에_모두_멈춘다() throws Exception {
        // given: 모든 라인이 인터럽트 후 200ms가 지나야 돌아온다
        writeQuestions(6);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow())
            .blockOn(0, 1, 2, 3, 4, 5)
            .interruptLatencyMs(200)
            .build();
        DefaultBatchEngine engine = newEngine(qaFlow(), executor, new BatchEngineConfig()
            .withConcurrency(2)
            .withAbortGracePeriodMs(3000));

        CompletableFuture<Void> canceller = CompletableFuture.runAsync(() -> {
            try {
                if (executor.awaitStarted(0, 5000) && executor.awaitStarted(1, 5000)) {
                    engine.cancel();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // when
        BatchResult result = engine.run(request());
        canceller.join();

        // then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.CANCELED);
        assertThat(executor.getActiveLinesAtRelease()).isZero();
        assertReleasedOnce(executor);
    }

    @Test
    void 시작_전에_취소하면_라인_없이_CANCELED다() throws Exception {
        // given
        writeQuestions(4);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).build();
        DefaultBatchEngine engine = newEngine(qaFlow(), executor);
        engine.cancel();

        // when
        BatchResult result = engine.run(request());

        // then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.CANCELED);
        assertThat(result.getLineResults()).isEmpty();
        assertThat(executor.getStartedCount()).isZero();
        assertReleasedOnce(executor);
    }

    @Test
    void cancel은_여러_번_호출해도_안전하다() throws Exception {
        writeQuestions(2);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).build();
        DefaultBatchEngine engine = newEngine(qaFlow(), executor);

        engine.cancel();
        engine.cancel();
        BatchResult result = engine.run(request());
        engine.cancel();

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.CANCELED);
        assertReleasedOnce(executor);
    }
}
