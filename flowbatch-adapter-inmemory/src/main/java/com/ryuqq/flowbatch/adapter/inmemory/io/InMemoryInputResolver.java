package com.ryuqq.flowbatch.adapter.inmemory.io;

import com.ryuqq.flowbatch.core.error.InputResolutionException;
import com.ryuqq.flowbatch.core.input.InputMapping;
import com.ryuqq.flowbatch.core.spi.InputResolver;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 메모리에 등록된 데이터셋을 읽는 InputResolver (테스트/임베디드용).
 *
 * <p>inputDirs의 키(입력 이름)로 등록된 데이터셋을 찾으며 경로는 사용하지 않습니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class InMemoryInputResolver implements InputResolver {

    private final Map<String, List<Map<String, Object>>> datasets = new ConcurrentHashMap<>();

    /**
     * 데이터셋 등록.
     *
     * @param inputName 입력 이름 (예: data)
     * @param rows 행 목록
     * @return this
     */
    public InMemoryInputResolver withDataset(String inputName, List<Map<String, Object>> rows) {
        if (inputName == null || rows == null) {
            throw new IllegalArgumentException("inputName and rows cannot be null");
        }
        datasets.put(inputName, List.copyOf(rows));
        return this;
    }

    @Override
    public List<Map<String, Object>> resolve(Map<String, Path> inputDirs, Map<String, String> inputsMapping,
                                             Integer maxLinesCount) {
        Map<String, List<Map<String, Object>>> selected = new LinkedHashMap<>();
        for (String inputName : inputDirs.keySet()) {
            List<Map<String, Object>> rows = datasets.get(inputName);
            if (rows == null) {
                throw new InputResolutionException("No dataset registered for input '" + inputName + "'");
            }
            selected.put(inputName, rows);
        }
        return InputMapping.apply(selected, inputsMapping, maxLinesCount);
    }
}
