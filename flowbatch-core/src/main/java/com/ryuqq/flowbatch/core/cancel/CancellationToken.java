package com.ryuqq.flowbatch.core.cancel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run 범위의 취소 신호.
 *
 * <p>전역 플래그 대신 run마다 하나씩 만들어 스케줄러와 감독자에게 전달합니다.
 * 어느 스레드에서든 {@link #cancel()}을 호출할 수 있으며 멱등입니다.</p>
 *
 * <p><strong>알림 방식:</strong></p>
 * <ul>
 *   <li>{@link #onCancel(Runnable)}로 등록한 리스너는 취소 시 한 번씩 호출됩니다.</li>
 *   <li>이미 취소된 토큰에 등록하면 리스너가 즉시 호출됩니다.</li>
 *   <li>리스너는 cancel()을 호출한 스레드에서 실행되므로 짧게 끝나야 합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CancellationToken token = new CancellationToken();
 * token.onCancel(() -&gt; events.offer(SchedulerEvent.cancel()));
 *
 * // 다른 스레드 (운영자 요청)
 * token.cancel();
 * </pre>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final AtomicBoolean canceled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * 취소 요청.
     *
     * @return 이번 호출로 처음 취소된 경우 true, 이미 취소된 경우 false
     */
    public boolean cancel() {
        if (!canceled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    /**
     * 취소 요청 여부.
     *
     * @return 취소되었으면 true
     */
    public boolean isCancellationRequested() {
        return canceled.get();
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>등록과 취소가 경합해도 리스너는 최소 한 번 호출됩니다.
     * 경합 시 두 번 호출될 수 있으므로 리스너는 멱등이어야 합니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        if (canceled.get()) {
            listener.run();
        }
    }

    /**
     * 리스너 해제.
     *
     * @param listener 등록했던 리스너
     */
    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    @Override
    public String toString() {
        return "CancellationToken{canceled=" + canceled.get() + "}";
    }
}
