package com.ryuqq.flowbatch.adapter.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.flowbatch.core.spi.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 출력 디렉토리에 {@code output.jsonl}을 쓰는 OutputWriter.
 *
 * <p>출력 하나가 한 줄의 JSON 객체입니다. 디렉토리가 없으면 만들고, 기존 파일은 덮어씁니다.
 * 출력이 없어도 빈 파일을 만듭니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class JsonLinesOutputWriter implements OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesOutputWriter.class);

    private final ObjectMapper objectMapper;

    public JsonLinesOutputWriter() {
        this(new ObjectMapper());
    }

    public JsonLinesOutputWriter(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 출력 저장.
     *
     * @throws UncheckedIOException 파일을 쓸 수 없거나 값을 JSON으로 직렬화할 수 없는 경우
     */
    @Override
    public void persist(Path outputDir, List<Map<String, Object>> outputs) {
        if (outputDir == null || outputs == null) {
            throw new IllegalArgumentException("outputDir and outputs cannot be null");
        }
        Path file = outputDir.resolve(OUTPUT_FILE_NAME);
        try {
            Files.createDirectories(outputDir);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (Map<String, Object> output : outputs) {
                    writer.write(objectMapper.writeValueAsString(output));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write outputs to " + file, e);
        }
        log.info("Persisted {} outputs to {}", outputs.size(), file);
    }
}
