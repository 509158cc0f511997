package com.ryuqq.flowbatch.application.engine;

import com.ryuqq.flowbatch.core.model.BatchResult;

import java.nio.file.Path;
import java.util.Map;

/**
 * Flow 배치 실행 진입점.
 *
 * <p>입력 레코드마다 flow를 한 번씩 실행하고, 성공한 라인만으로 집계를 수행한 뒤
 * 하나의 {@link BatchResult}를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchRunRequest request = BatchRunRequest.of(Map.of("data", inputDir), Map.of("question", "${data.question}"), outputDir)
 *     .withMaxLinesCount(100)
 *     .withRaiseOnLineFailure(false);
 *
 * BatchResult result = engine.run(request);
 *
 * // 다른 스레드에서 취소
 * engine.cancel();
 * </pre>
 *
 * <p><strong>결과 규칙:</strong></p>
 * <ul>
 *   <li>라인 실패는 예외가 아니라 FAILED 라인으로 기록 (raiseOnLineFailure=true인 경우 제외)</li>
 *   <li>취소는 예외가 아니라 CANCELED 상태의 BatchResult</li>
 *   <li>그 외 오류는 run 전체에 대해 정확히 하나의 예외로 전파</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public interface BatchEngine {

    /**
     * 배치 실행.
     *
     * @param request 실행 요청
     * @return 배치 결과
     * @throws IllegalArgumentException request가 null인 경우
     * @throws IllegalStateException 이미 실행된 엔진인 경우
     * @throws com.ryuqq.flowbatch.core.error.FlowBatchException 분류된 도메인 오류 또는 예상하지 못한 오류
     */
    BatchResult run(BatchRunRequest request);

    /**
     * 배치 실행 (기본 옵션).
     *
     * @param inputDirs 이름 → 입력 디렉토리
     * @param inputsMapping flow 입력 이름 → 참조 표현식 또는 리터럴
     * @param outputDir 출력 디렉토리
     * @return 배치 결과
     */
    default BatchResult run(Map<String, Path> inputDirs, Map<String, String> inputsMapping, Path outputDir) {
        return run(BatchRunRequest.of(inputDirs, inputsMapping, outputDir));
    }

    /**
     * 배치 실행 (모든 옵션).
     *
     * @param inputDirs 이름 → 입력 디렉토리
     * @param inputsMapping flow 입력 이름 → 참조 표현식 또는 리터럴
     * @param outputDir 출력 디렉토리
     * @param runId Run ID (null이면 UUID 생성)
     * @param maxLinesCount 최대 라인 수 (null이면 제한 없음)
     * @param raiseOnLineFailure 라인 실패 시 run 전체를 실패시킬지 여부
     * @return 배치 결과
     */
    default BatchResult run(Map<String, Path> inputDirs, Map<String, String> inputsMapping, Path outputDir,
                            String runId, Integer maxLinesCount, boolean raiseOnLineFailure) {
        return run(new BatchRunRequest(inputDirs, inputsMapping, outputDir, runId, maxLinesCount, raiseOnLineFailure));
    }

    /**
     * 실행 중인 run 취소.
     *
     * <p>어느 스레드에서든 언제든 호출할 수 있으며 멱등입니다.
     * run 시작 전에 호출하면 run은 라인을 실행하지 않고 CANCELED로 끝납니다.</p>
     */
    void cancel();
}
