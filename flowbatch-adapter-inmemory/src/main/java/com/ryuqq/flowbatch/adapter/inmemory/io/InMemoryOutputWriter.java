package com.ryuqq.flowbatch.adapter.inmemory.io;

import com.ryuqq.flowbatch.core.spi.OutputWriter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 출력 디렉토리별로 저장된 출력을 메모리에 보관하는 OutputWriter (테스트/임베디드용).
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class InMemoryOutputWriter implements OutputWriter {

    private final Map<Path, List<Map<String, Object>>> persisted = new ConcurrentHashMap<>();

    @Override
    public void persist(Path outputDir, List<Map<String, Object>> outputs) {
        if (outputDir == null || outputs == null) {
            throw new IllegalArgumentException("outputDir and outputs cannot be null");
        }
        List<Map<String, Object>> copies = new ArrayList<>(outputs.size());
        for (Map<String, Object> output : outputs) {
            copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(output)));
        }
        persisted.put(outputDir.resolve(OUTPUT_FILE_NAME), Collections.unmodifiableList(copies));
    }

    /**
     * 저장된 출력 조회.
     *
     * @param outputDir 출력 디렉토리
     * @return 저장된 출력 (없으면 빈 목록)
     */
    public List<Map<String, Object>> getPersisted(Path outputDir) {
        return persisted.getOrDefault(outputDir.resolve(OUTPUT_FILE_NAME), List.of());
    }

    public boolean hasPersisted(Path outputDir) {
        return persisted.containsKey(outputDir.resolve(OUTPUT_FILE_NAME));
    }
}
