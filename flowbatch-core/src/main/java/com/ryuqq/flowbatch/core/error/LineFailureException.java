package com.ryuqq.flowbatch.core.error;

import com.ryuqq.flowbatch.core.model.ErrorInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * fail-fast 모드에서 하나 이상의 라인이 실패한 경우.
 *
 * <p>모든 라인이 끝난 뒤 한 번만 발생하며, 실패한 모든 index와 첫 번째 실패 원인을
 * 메시지에 포함합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public class LineFailureException extends FlowBatchException {

    private final Map<Integer, ErrorInfo> failures;
    private final int totalLines;

    /**
     * 생성자.
     *
     * @param failures 실패한 index → 원인 (index 오름차순, 비어 있으면 안 됨)
     * @param totalLines 전체 라인 수
     * @throws IllegalArgumentException failures가 비어 있는 경우
     */
    public LineFailureException(Map<Integer, ErrorInfo> failures, int totalLines) {
        super("BATCH-001", ErrorTarget.BATCH, summarize(failures, totalLines));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.totalLines = totalLines;
    }

    public Map<Integer, ErrorInfo> getFailures() {
        return failures;
    }

    public int getTotalLines() {
        return totalLines;
    }

    /**
     * 라인 실패 요약 문자열 생성.
     *
     * <p>실패를 예외로 올리지 않는 모드에서도 같은 형식으로 로그를 남기기 위해 공개합니다.</p>
     *
     * @param failures 실패한 index → 원인 (index 오름차순)
     * @param totalLines 전체 라인 수
     * @return "k/N flow run failed, indexes: [..], exception of index i: msg"
     * @throws IllegalArgumentException failures가 비어 있는 경우
     */
    public static String summarize(Map<Integer, ErrorInfo> failures, int totalLines) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        Map.Entry<Integer, ErrorInfo> first = failures.entrySet().iterator().next();
        String indexes = failures.keySet().stream().map(String::valueOf).collect(Collectors.joining(","));
        return String.format("%d/%d flow run failed, indexes: [%s], exception of index %d: %s",
            failures.size(), totalLines, indexes, first.getKey(), first.getValue().message());
    }
}
