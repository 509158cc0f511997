package com.ryuqq.flowbatch.core.cancel;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CancellationToken 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class CancellationTokenTest {

    @Test
    void cancel_은_멱등이다() {
        // given
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        // when
        boolean first = token.cancel();
        boolean second = token.cancel();

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(token.isCancellationRequested()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void 이미_취소된_토큰에_등록하면_즉시_호출된다() {
        // given
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        // when
        token.onCancel(calls::incrementAndGet);

        // then
        assertThat(calls).hasValue(1);
    }

    @Test
    void 해제한_리스너는_호출되지_않는다() {
        // given
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        Runnable listener = calls::incrementAndGet;
        token.onCancel(listener);

        // when
        token.removeListener(listener);
        token.cancel();

        // then
        assertThat(calls).hasValue(0);
    }

    @Test
    void 여러_스레드에서_동시에_취소해도_리스너는_한번만_호출된다() throws Exception {
        // given
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        // when
        for (int i = 0; i < 8; i++) {
            pool.submit(() -> {
                start.await();
                return token.cancel();
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(calls).hasValue(1);
    }
}
