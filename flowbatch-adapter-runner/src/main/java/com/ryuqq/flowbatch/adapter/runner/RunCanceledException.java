package com.ryuqq.flowbatch.adapter.runner;

/**
 * run 본문이 취소 신호를 받아 중단되었음을 알리는 내부 신호.
 *
 * <p>{@link CancellationSupervisor} 밖으로 나가지 않으며, CANCELED 결과로 변환됩니다.</p>
 */
final class RunCanceledException extends RuntimeException {

    RunCanceledException(String message) {
        super(message, null, false, false);
    }
}
