package com.ryuqq.flowbatch.adapter.inmemory.io;

import com.ryuqq.flowbatch.core.error.InputResolutionException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryInputResolver / InMemoryOutputWriter 유닛 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class InMemoryInputResolverTest {

    @Test
    void resolve_등록된_데이터셋에_매핑을_적용한다() {
        // given
        InMemoryInputResolver resolver = new InMemoryInputResolver()
            .withDataset("data", List.of(Map.of("x", 1), Map.of("x", 2), Map.of("x", 3)));

        // when
        List<Map<String, Object>> lines = resolver.resolve(Map.of("data", Path.of("ignored")), Map.of("value", "${data.x}"), 2);

        // then
        assertThat(lines).extracting(line -> line.get("value")).containsExactly(1, 2);
    }

    @Test
    void resolve_등록되지_않은_입력은_예외() {
        InMemoryInputResolver resolver = new InMemoryInputResolver();

        assertThatThrownBy(() -> resolver.resolve(Map.of("data", Path.of("x")), Map.of(), null))
            .isInstanceOf(InputResolutionException.class)
            .hasMessageContaining("No dataset registered for input 'data'");
    }

    @Test
    void outputWriter_출력_디렉토리별로_보관한다() {
        // given
        InMemoryOutputWriter writer = new InMemoryOutputWriter();
        Path outputDir = Path.of("/out/run-1");

        // when
        writer.persist(outputDir, List.of(Map.of("line_number", 0, "answer", "a")));

        // then
        assertThat(writer.hasPersisted(outputDir)).isTrue();
        assertThat(writer.getPersisted(outputDir)).hasSize(1);
        assertThat(writer.getPersisted(Path.of("/out/other"))).isEmpty();
    }
}
