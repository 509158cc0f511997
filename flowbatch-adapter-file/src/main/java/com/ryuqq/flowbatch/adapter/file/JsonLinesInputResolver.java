package com.ryuqq.flowbatch.adapter.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.flowbatch.core.error.InputResolutionException;
import com.ryuqq.flowbatch.core.input.InputMapping;
import com.ryuqq.flowbatch.core.spi.InputResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * JSON Lines 파일 기반 InputResolver.
 *
 * <p>입력 이름마다 디렉토리(또는 파일 하나)를 받아 {@code *.jsonl} 파일을 파일 이름 순으로 읽고,
 * 각 줄의 JSON 객체를 한 행으로 사용합니다. 빈 줄은 건너뜁니다.
 * 행을 읽은 뒤 {@link InputMapping} 규칙으로 라인 입력을 만듭니다.</p>
 *
 * <p><strong>디렉토리 구조 예시:</strong></p>
 * <pre>
 * data/
 *   part-000.jsonl   {"question": "...", "answer": "..."}
 *   part-001.jsonl
 * </pre>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class JsonLinesInputResolver implements InputResolver {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesInputResolver.class);
    private static final String JSONL_SUFFIX = ".jsonl";
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonLinesInputResolver() {
        this(new ObjectMapper());
    }

    /**
     * 생성자 (ObjectMapper 주입).
     *
     * @param objectMapper JSON 파서
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public JsonLinesInputResolver(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Map<String, Object>> resolve(Map<String, Path> inputDirs, Map<String, String> inputsMapping,
                                             Integer maxLinesCount) {
        if (inputDirs == null) {
            throw new IllegalArgumentException("inputDirs cannot be null");
        }
        Map<String, List<Map<String, Object>>> datasets = new LinkedHashMap<>();
        for (Map.Entry<String, Path> entry : inputDirs.entrySet()) {
            List<Map<String, Object>> rows = readDataset(entry.getKey(), entry.getValue());
            log.info("Loaded {} rows for input '{}' from {}", rows.size(), entry.getKey(), entry.getValue());
            datasets.put(entry.getKey(), rows);
        }
        return InputMapping.apply(datasets, inputsMapping, maxLinesCount);
    }

    private List<Map<String, Object>> readDataset(String inputName, Path location) {
        if (location == null || !Files.exists(location)) {
            throw new InputResolutionException("Input '" + inputName + "' path does not exist: " + location);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Path file : jsonLinesFiles(inputName, location)) {
            readFile(inputName, file, rows);
        }
        return rows;
    }

    private static List<Path> jsonLinesFiles(String inputName, Path location) {
        if (Files.isRegularFile(location)) {
            return List.of(location);
        }
        try (Stream<Path> entries = Files.list(location)) {
            List<Path> files = entries
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(JSONL_SUFFIX))
                .sorted()
                .toList();
            if (files.isEmpty()) {
                throw new InputResolutionException("Input '" + inputName + "' directory has no " + JSONL_SUFFIX + " files: " + location);
            }
            return files;
        } catch (IOException e) {
            throw new InputResolutionException("Failed to list input '" + inputName + "' directory " + location, e);
        }
    }

    private void readFile(String inputName, Path file, List<Map<String, Object>> rows) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    rows.add(objectMapper.readValue(line, ROW_TYPE));
                } catch (JsonProcessingException e) {
                    throw new InputResolutionException(String.format(
                        "Input '%s' file %s line %d is not a JSON object: %s",
                        inputName, file.getFileName(), lineNumber, e.getOriginalMessage()), e);
                }
            }
        } catch (IOException e) {
            throw new InputResolutionException("Failed to read input '" + inputName + "' file " + file, e);
        }
    }
}
