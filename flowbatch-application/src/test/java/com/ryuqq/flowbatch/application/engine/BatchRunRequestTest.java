package com.ryuqq.flowbatch.application.engine;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchRunRequest 유닛 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class BatchRunRequestTest {

    private static final Path OUTPUT = Path.of("/tmp/out");

    @Test
    void of_기본옵션으로_생성() {
        // when
        BatchRunRequest request = BatchRunRequest.of(Map.of("data", Path.of("/tmp/in")), Map.of("q", "${data.q}"), OUTPUT);

        // then
        assertThat(request.runId()).isNull();
        assertThat(request.maxLinesCount()).isNull();
        assertThat(request.raiseOnLineFailure()).isFalse();
    }

    @Test
    void with_메서드는_해당_값만_바꾼_새_인스턴스를_만든다() {
        // given
        BatchRunRequest base = BatchRunRequest.of(Map.of(), Map.of(), OUTPUT);

        // when
        BatchRunRequest changed = base.withRunId("run-1").withMaxLinesCount(10).withRaiseOnLineFailure(true);

        // then
        assertThat(changed.runId()).isEqualTo("run-1");
        assertThat(changed.maxLinesCount()).isEqualTo(10);
        assertThat(changed.raiseOnLineFailure()).isTrue();
        assertThat(base.runId()).isNull();
    }

    @Test
    void 입력맵은_방어적으로_복사된다() {
        // given
        Map<String, String> mapping = new HashMap<>();
        mapping.put("q", "${data.q}");
        BatchRunRequest request = BatchRunRequest.of(Map.of(), mapping, OUTPUT);

        // when
        mapping.put("extra", "x");

        // then
        assertThat(request.inputsMapping()).containsOnlyKeys("q");
    }

    @Test
    void maxLinesCount가_양수가_아니면_예외() {
        assertThatThrownBy(() -> BatchRunRequest.of(Map.of(), Map.of(), OUTPUT).withMaxLinesCount(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxLinesCount must be positive");
    }

    @Test
    void outputDir_null이면_예외() {
        assertThatThrownBy(() -> BatchRunRequest.of(Map.of(), Map.of(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("outputDir cannot be null");
    }
}
