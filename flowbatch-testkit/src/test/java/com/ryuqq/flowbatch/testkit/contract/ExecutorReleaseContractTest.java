package com.ryuqq.flowbatch.testkit.contract;

import com.ryuqq.flowbatch.adapter.runner.DefaultBatchEngine;
import com.ryuqq.flowbatch.application.engine.BatchRunRequest;
import com.ryuqq.flowbatch.core.error.FlowValidationException;
import com.ryuqq.flowbatch.core.error.InputResolutionException;
import com.ryuqq.flowbatch.core.error.LineFailureException;
import com.ryuqq.flowbatch.core.model.FlowDefinition;
import com.ryuqq.flowbatch.core.model.InputDefinition;
import com.ryuqq.flowbatch.core.model.NodeDefinition;
import com.ryuqq.flowbatch.core.model.ValueType;
import com.ryuqq.flowbatch.core.statemachine.RunState;
import com.ryuqq.flowbatch.testkit.AbstractBatchContractTest;
import com.ryuqq.flowbatch.testkit.ScriptedFlowExecutor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test: executor release.
 *
 * <p>executor를 만든 run은 결과와 무관하게 release를 정확히 한 번 호출해야 합니다.
 * 정상 완료, 라인 실패로 인한 예외, 입력 해석 실패, 취소 모두 같습니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class ExecutorReleaseContractTest extends AbstractBatchContractTest {

    @Test
    void 정상_완료_run은_한_번_release한다() throws Exception {
        writeQuestions(3);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).build();

        newEngine(qaFlow(), executor).run(request());

        assertReleasedOnce(executor);
    }

    @Test
    void 입력_해석이_실패해도_한_번_release한다() throws Exception {
        // given: 없는 컬럼을 참조하는 매핑
        writeQuestions(3);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).build();
        DefaultBatchEngine engine = newEngine(qaFlow(), executor);
        BatchRunRequest request = BatchRunRequest.of(Map.of("data", dataDir),
            Map.of("question", "${data.prompt}"), outputDir);

        // when & then
        assertThatThrownBy(() -> engine.run(request))
            .isInstanceOf(InputResolutionException.class)
            .hasMessageContaining("prompt");
        assertThat(engine.getState()).isEqualTo(RunState.FAILED);
        assertThat(executor.getStartedCount()).isZero();
        assertReleasedOnce(executor);
    }

    @Test
    void 라인_실패로_예외가_나도_한_번_release한다() throws Exception {
        writeQuestions(3);
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(qaFlow()).failOn(0).build();
        DefaultBatchEngine engine = newEngine(qaFlow(), executor);

        assertThatThrownBy(() -> engine.run(request().withRaiseOnLineFailure(true)))
            .isInstanceOf(LineFailureException.class);

        assertReleasedOnce(executor);
    }

    @Test
    void 유효하지_않은_flow는_executor를_만들지_않는다() throws Exception {
        // given: 선언되지 않은 입력을 참조
        writeQuestions(1);
        FlowDefinition invalid = FlowDefinition.of("broken", EXECUTOR_KIND,
            List.of(InputDefinition.of("question", ValueType.STRING)),
            List.of(NodeDefinition.line("answer", Map.of("text", "${inputs.prompt}"))));
        ScriptedFlowExecutor executor = ScriptedFlowExecutor.builder(invalid).build();
        DefaultBatchEngine engine = newEngine(invalid, executor);

        // when & then
        assertThatThrownBy(() -> engine.run(request()))
            .isInstanceOf(FlowValidationException.class);
        assertThat(executor.getReleaseCount()).isZero();
    }
}
