package com.ryuqq.flowbatch.core.validation;

import com.ryuqq.flowbatch.core.error.FlowValidationException;
import com.ryuqq.flowbatch.core.error.InputTypeException;
import com.ryuqq.flowbatch.core.model.FlowDefinition;
import com.ryuqq.flowbatch.core.model.InputDefinition;
import com.ryuqq.flowbatch.core.model.NodeDefinition;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flow 구조 검증 및 라인 입력 정규화.
 *
 * <p><strong>배치 실행 전제 조건:</strong></p>
 * <ul>
 *   <li>선언된 입력이 하나 이상 존재</li>
 *   <li>노드 이름 중복 없음</li>
 *   <li>참조 표현식의 대상이 존재 ({@code inputs}의 입력 또는 다른 노드)</li>
 *   <li>일반 노드는 집계 노드를 참조할 수 없음 (집계는 모든 라인이 끝난 뒤 실행)</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class FlowValidator {

    private static final String INPUTS_TARGET = "inputs";

    // Utility class - prevent instantiation
    private FlowValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 배치 실행 가능 여부 검증.
     *
     * @param flow flow 정의
     * @throws IllegalArgumentException flow가 null인 경우
     * @throws FlowValidationException 구조가 배치 실행에 적합하지 않은 경우
     */
    public static void ensureValidForBatch(FlowDefinition flow) {
        if (flow == null) {
            throw new IllegalArgumentException("flow cannot be null");
        }
        if (flow.getInputs().isEmpty()) {
            throw new FlowValidationException(
                "Flow '" + flow.getName() + "' declares no inputs and cannot be executed in batch mode");
        }

        Set<String> nodeNames = new HashSet<>();
        for (NodeDefinition node : flow.getNodes()) {
            if (!nodeNames.add(node.name())) {
                throw new FlowValidationException("Duplicate node name '" + node.name() + "' in flow '" + flow.getName() + "'");
            }
        }

        Set<String> aggregationNodes = flow.getAggregationNodeNames();
        for (NodeDefinition node : flow.getNodes()) {
            for (Map.Entry<String, String> entry : node.inputs().entrySet()) {
                NodeDefinition.parseReference(entry.getValue()).ifPresent(reference -> {
                    if (INPUTS_TARGET.equals(reference.target())) {
                        if (!flow.getInputs().containsKey(reference.section())) {
                            throw new FlowValidationException(String.format(
                                "Node '%s' input '%s' references undeclared flow input '%s'",
                                node.name(), entry.getKey(), reference.section()));
                        }
                        return;
                    }
                    if (!nodeNames.contains(reference.target())) {
                        throw new FlowValidationException(String.format(
                            "Node '%s' input '%s' references unknown node '%s'",
                            node.name(), entry.getKey(), reference.target()));
                    }
                    if (!node.aggregation() && aggregationNodes.contains(reference.target())) {
                        throw new FlowValidationException(String.format(
                            "Line node '%s' cannot reference aggregation node '%s'",
                            node.name(), reference.target()));
                    }
                });
            }
        }
    }

    /**
     * 선언된 기본값 적용.
     *
     * <p>값이 없거나 null인 입력에 기본값을 채웁니다. 원본은 변경하지 않습니다.</p>
     *
     * @param flow flow 정의
     * @param lineInputs 라인 입력
     * @return 기본값이 적용된 새 맵
     */
    public static Map<String, Object> applyDefaults(FlowDefinition flow, Map<String, Object> lineInputs) {
        Map<String, Object> resolved = new LinkedHashMap<>(lineInputs);
        for (InputDefinition input : flow.getInputs().values()) {
            if (input.hasDefault() && resolved.get(input.name()) == null) {
                resolved.put(input.name(), input.defaultValue());
            }
        }
        return resolved;
    }

    /**
     * 선언된 타입으로 라인 입력 변환.
     *
     * <p>선언되지 않은 키는 그대로 유지하고, 선언되었지만 값이 없는 입력은 건너뜁니다.</p>
     *
     * @param flow flow 정의
     * @param lineInputs 라인 입력
     * @return 타입이 변환된 새 맵
     * @throws InputTypeException 변환할 수 없는 값이 있는 경우
     */
    public static Map<String, Object> ensureInputTypes(FlowDefinition flow, Map<String, Object> lineInputs) {
        Map<String, Object> coerced = new LinkedHashMap<>(lineInputs);
        for (InputDefinition input : flow.getInputs().values()) {
            if (!coerced.containsKey(input.name())) {
                continue;
            }
            Object value = coerced.get(input.name());
            try {
                coerced.put(input.name(), input.type().coerce(value));
            } catch (IllegalArgumentException e) {
                throw new InputTypeException(input.name(), input.type(), value, e);
            }
        }
        return coerced;
    }
}
