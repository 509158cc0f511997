package com.ryuqq.flowbatch.testkit.contract;

import com.ryuqq.flowbatch.adapter.runner.BatchEngineConfig;
import com.ryuqq.flowbatch.core.model.BatchResult;
import com.ryuqq.flowbatch.testkit.AbstractBatchContractTest;
import com.ryuqq.flowbatch.testkit.ScriptedFlowExecutor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 동시 실행 상한.
 *
 * <p>동시에 실행 중인 라인 수는 설정한 concurrency를 넘지 않아야 하며,
 * 동시 실행을 지원하지 않는 executor는 한 번에 한 라인만 받습니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class ConcurrencyCeilingContractTest extends AbstractBatchContractTest {

    @Test
    void 동시_실행_라인_수는_concurrency를_넘지_않는다() throws Exception {
        // given
        writeQuestions(12);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).delayMs(20).build();

        // when
        BatchResult result = newEngine(qaFlow(), executor, new BatchEngineConfig().withConcurrency(3)).run(request());

        // then
        assertSortedLineResults(result, 12);
        assertThat(executor.getStartedCount()).isEqualTo(12);
        assertThat(executor.getPeakConcurrency()).isBetween(1, 3);
    }

    @Test
    void concurrency가_1이면_순차_실행한다() throws Exception {
        writeQuestions(5);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).delayMs(10).build();

        newEngine(qaFlow(), executor, new BatchEngineConfig().withConcurrency(1)).run(request());

        assertThat(executor.getPeakConcurrency()).isEqualTo(1);
    }

    @Test
    void 동시_실행을_지원하지_않는_executor는_한_라인씩_받는다() throws Exception {
        writeQuestions(6);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow())
            .delayMs(10)
            .sequentialOnly()
            .build();

        BatchResult result = newEngine(qaFlow(), executor, new BatchEngineConfig().withConcurrency(8)).run(request());

        assertSortedLineResults(result, 6);
        assertThat(executor.getPeakConcurrency()).isEqualTo(1);
    }
}
