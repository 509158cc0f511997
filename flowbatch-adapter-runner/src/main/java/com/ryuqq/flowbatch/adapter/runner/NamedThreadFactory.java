package com.ryuqq.flowbatch.adapter.runner;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * run 단위 daemon 스레드 생성기.
 *
 * <p>스레드 이름은 {@code prefix-N} 형식입니다. 취소 후 버려진 스레드가 JVM 종료를 막지 않도록 daemon으로 만듭니다.</p>
 */
final class NamedThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    NamedThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
