package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.core.protection.BulkheadConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SemaphoreBulkhead 유닛 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class SemaphoreBulkheadTest {

    @Test
    void tryAcquire_상한까지만_성공() {
        // given
        SemaphoreBulkhead bulkhead = new SemaphoreBulkhead(new BulkheadConfig(2));

        // when & then
        assertThat(bulkhead.tryAcquire(0)).isTrue();
        assertThat(bulkhead.tryAcquire(1)).isTrue();
        assertThat(bulkhead.tryAcquire(2)).isFalse();
        assertThat(bulkhead.getPeakConcurrency()).isEqualTo(2);
    }

    @Test
    void release_후_다시_획득_가능하고_peak는_유지된다() {
        // given
        SemaphoreBulkhead bulkhead = new SemaphoreBulkhead(new BulkheadConfig(2));
        bulkhead.tryAcquire(0);
        bulkhead.tryAcquire(1);

        // when
        bulkhead.release(0);
        bulkhead.release(1);
        boolean reacquired = bulkhead.tryAcquire(2);

        // then
        assertThat(reacquired).isTrue();
        assertThat(bulkhead.getPeakConcurrency()).isEqualTo(2);
    }

    @Test
    void 획득하지_않은_permit_반납은_예외() {
        SemaphoreBulkhead bulkhead = new SemaphoreBulkhead(new BulkheadConfig(1));

        assertThatThrownBy(() -> bulkhead.release(0))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("release without acquire");
        assertThat(bulkhead.tryAcquire(1)).isTrue();
        assertThat(bulkhead.tryAcquire(2)).isFalse();
    }
}
