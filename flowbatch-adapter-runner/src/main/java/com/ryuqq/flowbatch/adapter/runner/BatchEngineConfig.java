package com.ryuqq.flowbatch.adapter.runner;

/**
 * DefaultBatchEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 실행할 수 있는 최대 라인 수 (기본 16)</li>
 *   <li>abortGracePeriodMs: 취소 후 실행 중인 라인이 멈추기를 기다리는 최대 시간 (기본 5000ms)</li>
 *   <li>progressLogIntervalLines: 진행률 로그를 남기는 라인 간격 (기본 10, 마지막 라인은 항상 기록)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>I/O 위주 백엔드(원격 호출): concurrency 증가 (16 → 64)</li>
 *   <li>CPU 위주 백엔드: concurrency를 코어 수 근처로</li>
 *   <li>인터럽트에 늦게 반응하는 백엔드: abortGracePeriodMs 증가</li>
 * </ul>
 *
 * <p>실제 상한은 {@code min(concurrency, 라인 수)}이며, executor가
 * {@code supportsConcurrentLines() == false}이면 1입니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 * @param concurrency 최대 동시 라인 수 (1 이상)
 * @param abortGracePeriodMs 취소 유예 시간 (밀리초, 0 이상)
 * @param progressLogIntervalLines 진행률 로그 간격 (1 이상)
 */
public record BatchEngineConfig(
    int concurrency,
    long abortGracePeriodMs,
    int progressLogIntervalLines
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=16, abortGracePeriodMs=5000ms, progressLogIntervalLines=10</p>
     */
    public BatchEngineConfig() {
        this(16, 5000, 10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchEngineConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (abortGracePeriodMs < 0) {
            throw new IllegalArgumentException(
                "abortGracePeriodMs must not be negative (current: " + abortGracePeriodMs + ")"
            );
        }
        if (progressLogIntervalLines <= 0) {
            throw new IllegalArgumentException(
                "progressLogIntervalLines must be positive (current: " + progressLogIntervalLines + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public BatchEngineConfig withConcurrency(int concurrency) {
        return new BatchEngineConfig(concurrency, abortGracePeriodMs, progressLogIntervalLines);
    }

    /**
     * abortGracePeriodMs만 변경한 새 인스턴스 생성.
     */
    public BatchEngineConfig withAbortGracePeriodMs(long abortGracePeriodMs) {
        return new BatchEngineConfig(concurrency, abortGracePeriodMs, progressLogIntervalLines);
    }

    /**
     * progressLogIntervalLines만 변경한 새 인스턴스 생성.
     */
    public BatchEngineConfig withProgressLogIntervalLines(int progressLogIntervalLines) {
        return new BatchEngineConfig(concurrency, abortGracePeriodMs, progressLogIntervalLines);
    }

    /**
     * executor 특성을 반영한 실제 동시성 상한.
     *
     * @param lineCount 전체 라인 수
     * @param concurrentLinesSupported executor의 동시 실행 지원 여부
     * @return 1 이상 concurrency 이하의 상한
     */
    public int effectiveConcurrency(int lineCount, boolean concurrentLinesSupported) {
        if (!concurrentLinesSupported) {
            return 1;
        }
        return Math.max(1, Math.min(concurrency, lineCount));
    }
}
