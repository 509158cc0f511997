package com.ryuqq.flowbatch.core.spi;

import com.ryuqq.flowbatch.core.executor.FlowExecutor;
import com.ryuqq.flowbatch.core.model.FlowDefinition;

/**
 * Executor 생성 SPI.
 *
 * <p>flow가 선언한 백엔드 종류({@link FlowDefinition#getExecutorKind()})에 맞는
 * Executor를 만들어 백엔드와 연결된 상태로 반환합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public interface ExecutorFactory {

    /**
     * Executor 생성.
     *
     * @param flow 검증된 flow 정의
     * @return 연결이 끝난 Executor (호출자가 release 책임을 가짐)
     * @throws com.ryuqq.flowbatch.core.error.FlowValidationException 지원하지 않는 백엔드 종류인 경우
     */
    FlowExecutor create(FlowDefinition flow);
}
