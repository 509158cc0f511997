package com.ryuqq.flowbatch.testkit.contract;

import com.ryuqq.flowbatch.adapter.runner.BatchEngineConfig;
import com.ryuqq.flowbatch.core.model.BatchResult;
import com.ryuqq.flowbatch.core.model.ExecutionStatus;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.testkit.AbstractBatchContractTest;
import com.ryuqq.flowbatch.testkit.ScriptedFlowExecutor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 라인 결과 순서와 출력 파일.
 *
 * <p><strong>시나리오:</strong></p>
 * <ul>
 *   <li>완료 순서와 무관하게 결과는 index 오름차순</li>
 *   <li>output.jsonl은 COMPLETED 라인마다 한 줄 (line_number + 출력 필드)</li>
 *   <li>입력 0건, WHOLE_BATCH 모드, maxLinesCount 제한</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class LineOrderingContractTest extends AbstractBatchContractTest {

    @Test
    void 늦게_시작한_라인이_먼저_끝나도_결과는_index_순서다() throws Exception {
        // given: 앞 라인일수록 오래 걸린다
        writeQuestions(8);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow())
            .delayMs(index -> (8 - index) * 15L)
            .build();

        // when
        BatchResult result = newEngine(qaFlow(), executor, new BatchEngineConfig().withConcurrency(4)).run(request());

        // then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertSortedLineResults(result, 8);
        assertThat(result.getLineResults()).allMatch(LineResult::isCompleted);
        assertThat(result.getLineResults().get(5).output()).containsEntry("answer", "A:q5");
        assertThat(executor.getAggregationCalls()).isEmpty();
        assertReleasedOnce(executor);
    }

    @Test
    void 출력_파일은_완료_라인마다_한_줄이다() throws Exception {
        // given
        writeQuestions(4);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow())
            .delayMs(index -> index % 2 == 0 ? 30L : 0L)
            .build();

        // when
        newEngine(qaFlow(), executor).run(request());

        // then
        List<Map<String, Object>> records = readPersistedOutputs();
        assertThat(records).hasSize(4);
        for (int i = 0; i < records.size(); i++) {
            assertThat(records.get(i))
                .containsEntry("line_number", i)
                .containsEntry("answer", "A:q" + i);
            assertThat(records.get(i).keySet()).first().isEqualTo("line_number");
        }
    }

    @Test
    void 입력이_없으면_빈_결과로_완료된다() throws Exception {
        writeQuestions(0);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).build();

        BatchResult result = newEngine(qaFlow(), executor).run(request());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(result.getLineResults()).isEmpty();
        assertThat(readPersistedOutputs()).isEmpty();
        assertReleasedOnce(executor);
    }

    @Test
    void WHOLE_BATCH_executor도_같은_결과_형태를_만든다() throws Exception {
        writeQuestions(5);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).wholeBatch().build();

        BatchResult result = newEngine(qaFlow(), executor).run(request());

        assertSortedLineResults(result, 5);
        assertThat(readPersistedOutputs()).extracting(record -> record.get("line_number"))
            .containsExactly(0, 1, 2, 3, 4);
        assertThat(executor.getPeakConcurrency()).isEqualTo(1);
        assertReleasedOnce(executor);
    }

    @Test
    void maxLinesCount만큼만_실행한다() throws Exception {
        writeQuestions(10);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).build();

        BatchResult result = newEngine(qaFlow(), executor).run(request().withMaxLinesCount(3));

        assertSortedLineResults(result, 3);
        assertThat(executor.getStartedCount()).isEqualTo(3);
    }
}
