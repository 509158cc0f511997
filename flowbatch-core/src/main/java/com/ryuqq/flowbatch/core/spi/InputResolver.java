package com.ryuqq.flowbatch.core.spi;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 입력 해석 SPI.
 *
 * <p>입력 디렉토리와 입력 매핑으로부터 라인별 입력 행을 만듭니다.
 * 최대 라인 수 제한(truncation)도 이 구현체의 책임입니다.</p>
 *
 * <p><strong>입력 매핑 예시:</strong></p>
 * <pre>
 * inputDirs     = {"data": /tmp/input}
 * inputsMapping = {"question": "${data.question}", "lang": "en"}
 * </pre>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public interface InputResolver {

    /**
     * 라인 입력 행 생성.
     *
     * @param inputDirs 이름 → 입력 디렉토리
     * @param inputsMapping flow 입력 이름 → 참조 표현식 또는 리터럴
     * @param maxLinesCount 최대 라인 수 (null이면 제한 없음)
     * @return 라인 순서대로의 입력 행
     * @throws com.ryuqq.flowbatch.core.error.InputResolutionException 입력을 만들 수 없는 경우
     */
    List<Map<String, Object>> resolve(Map<String, Path> inputDirs, Map<String, String> inputsMapping, Integer maxLinesCount);
}
