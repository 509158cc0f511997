package com.ryuqq.flowbatch.core.input;

import com.ryuqq.flowbatch.core.error.InputResolutionException;
import com.ryuqq.flowbatch.core.model.NodeDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 입력 데이터셋과 매핑으로 라인 입력 생성.
 *
 * <p>{@link com.ryuqq.flowbatch.core.spi.InputResolver} 구현체들이 공유하는 매핑 규칙입니다.</p>
 *
 * <p><strong>매핑 규칙:</strong></p>
 * <ul>
 *   <li>{@code ${data.question}}: 데이터셋 data의 i번째 행의 question 컬럼</li>
 *   <li>그 외 문자열: 모든 라인에 같은 리터럴 값</li>
 *   <li>매핑이 비어 있고 데이터셋이 하나뿐이면 그 데이터셋의 행을 그대로 사용</li>
 * </ul>
 *
 * <p><strong>라인 수:</strong></p>
 * <ul>
 *   <li>매핑이 참조하는 데이터셋의 행 수 (참조가 없으면 모든 데이터셋의 행 수)</li>
 *   <li>대상 데이터셋들의 행 수가 다르면 {@link InputResolutionException}</li>
 *   <li>maxLinesCount가 있으면 앞에서부터 그 수만큼만 사용</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class InputMapping {

    // Utility class - prevent instantiation
    private InputMapping() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 매핑 적용.
     *
     * @param datasets 입력 이름 → 행 목록
     * @param inputsMapping flow 입력 이름 → 참조 표현식 또는 리터럴
     * @param maxLinesCount 최대 라인 수 (null이면 제한 없음)
     * @return 라인별 입력 (0번 라인부터)
     * @throws InputResolutionException 참조 대상이 없거나 행 수가 맞지 않는 경우
     */
    public static List<Map<String, Object>> apply(Map<String, List<Map<String, Object>>> datasets,
                                                  Map<String, String> inputsMapping,
                                                  Integer maxLinesCount) {
        if (datasets == null) {
            throw new IllegalArgumentException("datasets cannot be null");
        }
        Map<String, String> mapping = inputsMapping == null ? Collections.emptyMap() : inputsMapping;

        if (mapping.isEmpty()) {
            if (datasets.size() > 1) {
                throw new InputResolutionException(
                    "Inputs mapping is required when more than one input is given: " + datasets.keySet());
            }
            List<Map<String, Object>> rows = datasets.isEmpty() ? List.of() : datasets.values().iterator().next();
            return truncate(copyRows(rows), maxLinesCount);
        }

        Set<String> referenced = new LinkedHashSet<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            NodeDefinition.parseReference(entry.getValue()).ifPresent(reference -> {
                if (!datasets.containsKey(reference.target())) {
                    throw new InputResolutionException(String.format(
                        "Mapping of input '%s' references '%s', but no input named '%s' was given. Available inputs: %s",
                        entry.getKey(), reference.expression(), reference.target(), datasets.keySet()));
                }
                referenced.add(reference.target());
            });
        }

        int lineCount = lineCount(datasets, referenced.isEmpty() ? datasets.keySet() : referenced);
        if (maxLinesCount != null) {
            lineCount = Math.min(lineCount, maxLinesCount);
        }

        List<Map<String, Object>> lines = new ArrayList<>(lineCount);
        for (int i = 0; i < lineCount; i++) {
            Map<String, Object> line = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : mapping.entrySet()) {
                line.put(entry.getKey(), resolveValue(datasets, entry.getKey(), entry.getValue(), i));
            }
            lines.add(line);
        }
        return lines;
    }

    private static Object resolveValue(Map<String, List<Map<String, Object>>> datasets, String inputName,
                                       String expression, int lineIndex) {
        return NodeDefinition.parseReference(expression)
            .map(reference -> {
                Map<String, Object> row = datasets.get(reference.target()).get(lineIndex);
                if (row == null || !row.containsKey(reference.section())) {
                    throw new InputResolutionException(String.format(
                        "Couldn't find column '%s' in input '%s' at line %d (mapping of input '%s')",
                        reference.section(), reference.target(), lineIndex, inputName));
                }
                return row.get(reference.section());
            })
            .orElse(expression);
    }

    private static int lineCount(Map<String, List<Map<String, Object>>> datasets, Set<String> names) {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (String name : names) {
            List<Map<String, Object>> rows = datasets.get(name);
            sizes.put(name, rows == null ? 0 : rows.size());
        }
        if (new LinkedHashSet<>(sizes.values()).size() > 1) {
            throw new InputResolutionException("Inputs have different line counts: " + sizes);
        }
        return sizes.isEmpty() ? 0 : sizes.values().iterator().next();
    }

    private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copies.add(new LinkedHashMap<>(row));
        }
        return copies;
    }

    private static List<Map<String, Object>> truncate(List<Map<String, Object>> rows, Integer maxLinesCount) {
        if (maxLinesCount == null || rows.size() <= maxLinesCount) {
            return rows;
        }
        return new ArrayList<>(rows.subList(0, maxLinesCount));
    }
}
