package com.ryuqq.flowbatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flow 그래프의 노드 하나.
 *
 * <p>노드 입력 값은 리터럴이거나 참조 표현식입니다.</p>
 * <ul>
 *   <li>{@code ${inputs.question}}: flow 입력 참조</li>
 *   <li>{@code ${summarize.output}}: 다른 노드의 출력 참조</li>
 * </ul>
 *
 * <p>aggregation=true인 노드는 모든 라인 실행이 끝난 뒤 한 번만, 성공한 라인의
 * 컬럼 데이터를 입력으로 실행됩니다.</p>
 *
 * @param name 노드 이름
 * @param aggregation 집계 노드 여부
 * @param inputs 노드 입력 이름 → 값 또는 참조 표현식
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public record NodeDefinition(
    String name,
    boolean aggregation,
    Map<String, String> inputs
) {

    private static final Pattern REFERENCE = Pattern.compile("^\\$\\{([A-Za-z0-9_\\-]+)\\.([A-Za-z0-9_.\\-]+)}$");

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 비어 있는 경우
     */
    public NodeDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        inputs = inputs == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    /**
     * 일반(라인) 노드 생성.
     */
    public static NodeDefinition line(String name, Map<String, String> inputs) {
        return new NodeDefinition(name, false, inputs);
    }

    /**
     * 집계 노드 생성.
     */
    public static NodeDefinition aggregation(String name, Map<String, String> inputs) {
        return new NodeDefinition(name, true, inputs);
    }

    /**
     * 참조 표현식 파싱.
     *
     * @param expression 노드 입력 값
     * @return 참조인 경우 (대상, 섹션), 리터럴이면 empty
     */
    public static Optional<Reference> parseReference(String expression) {
        if (expression == null) {
            return Optional.empty();
        }
        Matcher matcher = REFERENCE.matcher(expression.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Reference(matcher.group(1), matcher.group(2)));
    }

    /**
     * 참조 표현식 {@code ${target.section}}.
     *
     * @param target 참조 대상 (inputs 또는 노드 이름)
     * @param section 대상 내 경로 (예: output)
     */
    public record Reference(String target, String section) {

        /**
         * 원래 표현식 형태로 복원.
         *
         * @return {@code ${target.section}}
         */
        public String expression() {
            return "${" + target + "." + section + "}";
        }
    }
}
