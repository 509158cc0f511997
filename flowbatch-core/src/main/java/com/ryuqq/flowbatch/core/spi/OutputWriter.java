package com.ryuqq.flowbatch.core.spi;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 출력 영속화 SPI.
 *
 * <p>성공한 라인의 출력(라인 번호 포함)을 run의 출력 집합으로 저장합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public interface OutputWriter {

    /**
     * 출력 파일 이름.
     */
    String OUTPUT_FILE_NAME = "output.jsonl";

    /**
     * 라인 번호 키.
     */
    String LINE_NUMBER_KEY = "line_number";

    /**
     * 출력 저장.
     *
     * @param outputDir 출력 디렉토리
     * @param outputs 라인 번호와 출력 필드를 담은 레코드 (index 오름차순)
     * @throws java.io.UncheckedIOException 저장에 실패한 경우
     */
    void persist(Path outputDir, List<Map<String, Object>> outputs);
}
