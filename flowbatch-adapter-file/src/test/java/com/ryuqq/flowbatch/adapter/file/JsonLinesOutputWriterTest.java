package com.ryuqq.flowbatch.adapter.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JsonLinesOutputWriter 유닛 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class JsonLinesOutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void persist_출력마다_한_줄의_JSON을_쓴다() throws IOException {
        // given
        Path outputDir = tempDir.resolve("outputs/run-1");
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("line_number", 0);
        first.put("answer", "yes");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("line_number", 2);
        second.put("answer", null);

        // when
        new JsonLinesOutputWriter().persist(outputDir, List.of(first, second));

        // then
        List<String> lines = Files.readAllLines(outputDir.resolve("output.jsonl"));
        assertThat(lines).containsExactly(
            "{\"line_number\":0,\"answer\":\"yes\"}",
            "{\"line_number\":2,\"answer\":null}");
        assertThat(new ObjectMapper().readTree(lines.get(1)).get("line_number").asInt()).isEqualTo(2);
    }

    @Test
    void persist_출력이_없어도_빈_파일을_만든다() throws IOException {
        new JsonLinesOutputWriter().persist(tempDir, List.of());

        assertThat(Files.readAllLines(tempDir.resolve("output.jsonl"))).isEmpty();
    }
}
