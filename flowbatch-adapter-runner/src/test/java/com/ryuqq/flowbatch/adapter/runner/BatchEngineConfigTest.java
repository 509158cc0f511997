package com.ryuqq.flowbatch.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchEngineConfig 유닛 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class BatchEngineConfigTest {

    @Test
    void 기본_설정값() {
        BatchEngineConfig config = new BatchEngineConfig();

        assertThat(config.concurrency()).isEqualTo(16);
        assertThat(config.abortGracePeriodMs()).isEqualTo(5000);
        assertThat(config.progressLogIntervalLines()).isEqualTo(10);
    }

    @Test
    void concurrency가_0이면_예외() {
        assertThatThrownBy(() -> new BatchEngineConfig().withConcurrency(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency must be positive");
    }

    @Test
    void abortGracePeriodMs가_음수이면_예외() {
        assertThatThrownBy(() -> new BatchEngineConfig().withAbortGracePeriodMs(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("abortGracePeriodMs must not be negative");
    }

    @Test
    void effectiveConcurrency는_라인_수와_executor_특성을_반영한다() {
        BatchEngineConfig config = new BatchEngineConfig().withConcurrency(8);

        assertThat(config.effectiveConcurrency(100, true)).isEqualTo(8);
        assertThat(config.effectiveConcurrency(3, true)).isEqualTo(3);
        assertThat(config.effectiveConcurrency(0, true)).isEqualTo(1);
        assertThat(config.effectiveConcurrency(100, false)).isEqualTo(1);
    }
}
