package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.core.model.LineResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RunProgress 유닛 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class RunProgressTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void snapshot은_기록_순서와_무관하게_index_오름차순() {
        // given
        RunProgress progress = new RunProgress();

        // when
        progress.record(LineResult.completed(2, Map.of(), Map.of(), NOW, NOW));
        progress.record(LineResult.completed(0, Map.of(), Map.of(), NOW, NOW));
        progress.record(LineResult.canceled(1, NOW, NOW));

        // then
        assertThat(progress.snapshot()).extracting(LineResult::index).containsExactly(0, 1, 2);
        assertThat(progress.recordedCount()).isEqualTo(3);
    }

    @Test
    void 같은_index를_두_번_기록하면_예외() {
        RunProgress progress = new RunProgress();
        progress.record(LineResult.canceled(0, NOW, NOW));

        assertThatThrownBy(() -> progress.record(LineResult.canceled(0, NOW, NOW)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already been recorded");
    }

    @Test
    void aggregationResult_null은_빈_결과로_저장() {
        RunProgress progress = new RunProgress();

        progress.setAggregationResult(null);

        assertThat(progress.getAggregationResult().output()).isEmpty();
    }
}
