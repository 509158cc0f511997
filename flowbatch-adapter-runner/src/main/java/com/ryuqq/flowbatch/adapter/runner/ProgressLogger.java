package com.ryuqq.flowbatch.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * 라인 진행률 로그.
 *
 * <p>간격마다, 그리고 마지막 라인에서 완료 수와 평균 소요 시간, 남은 라인의 예상 시간을 기록합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
final class ProgressLogger {

    private static final Logger log = LoggerFactory.getLogger(ProgressLogger.class);

    private final int totalLines;
    private final int interval;
    private final Instant startTime;

    ProgressLogger(int totalLines, int interval, Instant startTime) {
        this.totalLines = totalLines;
        this.interval = interval;
        this.startTime = startTime;
    }

    /**
     * 라인 하나가 기록된 뒤 호출.
     *
     * @param finishedLines 지금까지 기록된 라인 수
     * @return 로그를 남긴 경우 true
     */
    boolean lineFinished(int finishedLines) {
        if (finishedLines <= 0 || (finishedLines % interval != 0 && finishedLines != totalLines)) {
            return false;
        }
        double elapsedSeconds = Duration.between(startTime, Instant.now()).toMillis() / 1000.0;
        double average = elapsedSeconds / finishedLines;
        double remaining = average * (totalLines - finishedLines);
        log.info("Finished {} / {} lines.", finishedLines, totalLines);
        log.info("Average execution time for completed lines: {} seconds. Estimated time for incomplete lines: {} seconds.",
            String.format("%.2f", average), String.format("%.2f", remaining));
        return true;
    }
}
