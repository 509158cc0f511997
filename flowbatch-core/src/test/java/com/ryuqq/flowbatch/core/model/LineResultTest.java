package com.ryuqq.flowbatch.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LineResult 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class LineResultTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = START.plusMillis(250);

    @Test
    void completed_결과는_output과_집계입력을_보관한다() {
        // given
        Map<String, Object> output = Map.of("answer", "42");
        Map<String, Object> aggregationInputs = Map.of("${grade.output}", 1);

        // when
        LineResult result = LineResult.completed(3, output, aggregationInputs, START, END);

        // then
        assertThat(result.isCompleted()).isTrue();
        assertThat(result.output()).containsEntry("answer", "42");
        assertThat(result.aggregationInputs()).containsEntry("${grade.output}", 1);
        assertThat(result.error()).isNull();
        assertThat(result.duration().toMillis()).isEqualTo(250);
    }

    @Test
    void failed_결과는_output이_비어있고_집계입력은_유지된다() {
        // given
        Map<String, Object> partial = Map.of("${grade.output}", 0);

        // when
        LineResult result = LineResult.failed(1, ErrorInfo.of("ToolError", "boom"), partial, START, END);

        // then
        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.output()).isEmpty();
        assertThat(result.aggregationInputs()).containsEntry("${grade.output}", 0);
        assertThat(result.error().typeAndMessage()).isEqualTo("(ToolError) boom");
    }

    @Test
    void 생성후_원본맵을_변경해도_결과는_변하지_않는다() {
        // given
        Map<String, Object> output = new HashMap<>();
        output.put("answer", "a");
        LineResult result = LineResult.completed(0, output, null, START, END);

        // when
        output.put("answer", "b");

        // then
        assertThat(result.output()).containsEntry("answer", "a");
        assertThatThrownBy(() -> result.output().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void failed_결과에_error가_없으면_예외() {
        assertThatThrownBy(() -> new LineResult(0, ExecutionStatus.FAILED, null, null, null, START, END))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("error cannot be null");
    }

    @Test
    void 종료시각이_시작시각보다_이르면_예외() {
        assertThatThrownBy(() -> LineResult.canceled(0, END, START))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("endTime cannot be before startTime");
    }

    @Test
    void 음수_index는_허용되지_않는다() {
        assertThatThrownBy(() -> LineResult.canceled(-1, START, END))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index must be non-negative");
    }
}
