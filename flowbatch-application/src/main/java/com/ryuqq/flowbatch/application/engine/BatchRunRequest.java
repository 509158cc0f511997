package com.ryuqq.flowbatch.application.engine;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 배치 실행 요청 (불변 record).
 *
 * @param inputDirs 이름 → 입력 디렉토리
 * @param inputsMapping flow 입력 이름 → 참조 표현식({@code ${data.col}}) 또는 리터럴
 * @param outputDir 출력 디렉토리
 * @param runId Run ID (null 허용, null이면 UUID 생성)
 * @param maxLinesCount 최대 라인 수 (null 허용, null이면 제한 없음)
 * @param raiseOnLineFailure 라인 실패 시 run 전체를 실패시킬지 여부
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public record BatchRunRequest(
    Map<String, Path> inputDirs,
    Map<String, String> inputsMapping,
    Path outputDir,
    String runId,
    Integer maxLinesCount,
    boolean raiseOnLineFailure
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchRunRequest {
        if (inputDirs == null) {
            throw new IllegalArgumentException("inputDirs cannot be null");
        }
        if (inputsMapping == null) {
            throw new IllegalArgumentException("inputsMapping cannot be null");
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir cannot be null");
        }
        if (maxLinesCount != null && maxLinesCount <= 0) {
            throw new IllegalArgumentException("maxLinesCount must be positive (current: " + maxLinesCount + ")");
        }
        inputDirs = Collections.unmodifiableMap(new LinkedHashMap<>(inputDirs));
        inputsMapping = Collections.unmodifiableMap(new LinkedHashMap<>(inputsMapping));
    }

    /**
     * 기본 옵션 요청 생성 (runId 자동 생성, 라인 수 제한 없음, 라인 실패 허용).
     */
    public static BatchRunRequest of(Map<String, Path> inputDirs, Map<String, String> inputsMapping, Path outputDir) {
        return new BatchRunRequest(inputDirs, inputsMapping, outputDir, null, null, false);
    }

    /**
     * runId만 변경한 새 인스턴스 생성.
     */
    public BatchRunRequest withRunId(String runId) {
        return new BatchRunRequest(inputDirs, inputsMapping, outputDir, runId, maxLinesCount, raiseOnLineFailure);
    }

    /**
     * maxLinesCount만 변경한 새 인스턴스 생성.
     */
    public BatchRunRequest withMaxLinesCount(Integer maxLinesCount) {
        return new BatchRunRequest(inputDirs, inputsMapping, outputDir, runId, maxLinesCount, raiseOnLineFailure);
    }

    /**
     * raiseOnLineFailure만 변경한 새 인스턴스 생성.
     */
    public BatchRunRequest withRaiseOnLineFailure(boolean raiseOnLineFailure) {
        return new BatchRunRequest(inputDirs, inputsMapping, outputDir, runId, maxLinesCount, raiseOnLineFailure);
    }
}
