package com.ryuqq.flowbatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 선언적 flow 정의 (불변).
 *
 * <p>run마다 한 번 로드되어 Lifecycle이 소유하며, 다른 컴포넌트에는 읽기 전용으로 전달됩니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>name: flow 이름</li>
 *   <li>executorKind: 실행 백엔드 종류 (ExecutorFactory 조회 키)</li>
 *   <li>inputs: 선언 순서를 유지하는 입력 정의</li>
 *   <li>nodes: 노드 목록 (일부는 집계 노드)</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class FlowDefinition {

    private final String name;
    private final String executorKind;
    private final Map<String, InputDefinition> inputs;
    private final List<NodeDefinition> nodes;

    private FlowDefinition(String name, String executorKind, List<InputDefinition> inputs, List<NodeDefinition> nodes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (executorKind == null || executorKind.isBlank()) {
            throw new IllegalArgumentException("executorKind cannot be null or blank");
        }
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        if (nodes == null) {
            throw new IllegalArgumentException("nodes cannot be null");
        }
        Map<String, InputDefinition> byName = new LinkedHashMap<>();
        for (InputDefinition input : inputs) {
            if (byName.put(input.name(), input) != null) {
                throw new IllegalArgumentException("duplicate input name: " + input.name());
            }
        }
        this.name = name;
        this.executorKind = executorKind;
        this.inputs = Collections.unmodifiableMap(byName);
        this.nodes = List.copyOf(nodes);
    }

    /**
     * FlowDefinition 생성.
     *
     * @param name flow 이름
     * @param executorKind 실행 백엔드 종류
     * @param inputs 입력 정의 (선언 순서 유지)
     * @param nodes 노드 정의
     * @return FlowDefinition
     * @throws IllegalArgumentException 필수 값이 없거나 입력 이름이 중복된 경우
     */
    public static FlowDefinition of(String name, String executorKind,
                                    List<InputDefinition> inputs, List<NodeDefinition> nodes) {
        return new FlowDefinition(name, executorKind, inputs, nodes);
    }

    public String getName() {
        return name;
    }

    public String getExecutorKind() {
        return executorKind;
    }

    /**
     * 입력 정의 조회.
     *
     * @return 입력 이름 → 정의 (선언 순서)
     */
    public Map<String, InputDefinition> getInputs() {
        return inputs;
    }

    public List<String> getInputNames() {
        return List.copyOf(inputs.keySet());
    }

    public List<NodeDefinition> getNodes() {
        return nodes;
    }

    public Optional<NodeDefinition> findNode(String nodeName) {
        return nodes.stream().filter(node -> node.name().equals(nodeName)).findFirst();
    }

    /**
     * 집계 노드 이름 조회.
     *
     * @return 선언 순서의 집계 노드 이름
     */
    public Set<String> getAggregationNodeNames() {
        Set<String> names = new LinkedHashSet<>();
        for (NodeDefinition node : nodes) {
            if (node.aggregation()) {
                names.add(node.name());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    public boolean hasAggregationNodes() {
        return nodes.stream().anyMatch(NodeDefinition::aggregation);
    }

    /**
     * 집계 입력 속성 조회.
     *
     * <p>집계 노드가 일반 노드를 참조하는 표현식({@code ${node.output}})의 목록입니다.
     * 각 라인의 {@link LineResult#aggregationInputs()}는 이 표현식을 키로 값을 담습니다.</p>
     *
     * @return 선언 순서, 중복 없는 참조 표현식 목록
     */
    public List<String> getAggregationInputProperties() {
        Set<String> lineNodeNames = new LinkedHashSet<>();
        for (NodeDefinition node : nodes) {
            if (!node.aggregation()) {
                lineNodeNames.add(node.name());
            }
        }
        Set<String> properties = new LinkedHashSet<>();
        for (NodeDefinition node : nodes) {
            if (!node.aggregation()) {
                continue;
            }
            for (String value : node.inputs().values()) {
                NodeDefinition.parseReference(value)
                    .filter(reference -> lineNodeNames.contains(reference.target()))
                    .ifPresent(reference -> properties.add(reference.expression()));
            }
        }
        return List.copyOf(properties);
    }

    @Override
    public String toString() {
        return "FlowDefinition{name=" + name + ", executorKind=" + executorKind
            + ", inputs=" + inputs.keySet() + ", nodes=" + nodes.size() + "}";
    }
}
