package com.ryuqq.flowbatch.adapter.inmemory.executor;

import com.ryuqq.flowbatch.core.error.FlowValidationException;
import com.ryuqq.flowbatch.core.executor.FlowExecutor;
import com.ryuqq.flowbatch.core.model.FlowDefinition;
import com.ryuqq.flowbatch.core.spi.ExecutorFactory;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 실행 백엔드 종류별 ExecutorFactory 레지스트리.
 *
 * <p>{@link FlowDefinition#getExecutorKind()}로 팩토리를 찾아 executor를 만듭니다.
 * 등록되지 않은 종류는 {@link FlowValidationException}입니다.</p>
 *
 * <p><strong>Thread-safety:</strong> ConcurrentHashMap 기반으로 등록과 조회를 동시에 해도 안전합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class InMemoryExecutorRegistry implements ExecutorFactory {

    private final ConcurrentMap<String, ExecutorFactory> factories = new ConcurrentHashMap<>();

    /**
     * 팩토리 등록 (같은 종류가 있으면 교체).
     *
     * @param executorKind 실행 백엔드 종류
     * @param factory 팩토리
     * @return this
     * @throws IllegalArgumentException 인자가 비었거나 null인 경우
     */
    public InMemoryExecutorRegistry register(String executorKind, ExecutorFactory factory) {
        if (executorKind == null || executorKind.isBlank()) {
            throw new IllegalArgumentException("executorKind cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        factories.put(executorKind, factory);
        return this;
    }

    public boolean isRegistered(String executorKind) {
        return executorKind != null && factories.containsKey(executorKind);
    }

    public Set<String> getRegisteredKinds() {
        return Set.copyOf(factories.keySet());
    }

    @Override
    public FlowExecutor create(FlowDefinition flow) {
        if (flow == null) {
            throw new IllegalArgumentException("flow cannot be null");
        }
        ExecutorFactory factory = factories.get(flow.getExecutorKind());
        if (factory == null) {
            throw new FlowValidationException(String.format(
                "No executor registered for kind '%s' (flow '%s'). Registered kinds: %s",
                flow.getExecutorKind(), flow.getName(), new TreeSet<>(factories.keySet())));
        }
        return factory.create(flow);
    }
}
