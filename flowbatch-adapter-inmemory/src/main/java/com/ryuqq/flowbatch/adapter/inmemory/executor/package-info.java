/**
 * In-process 실행 백엔드.
 *
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.adapter.inmemory.executor.FunctionFlowExecutor} - Java 함수 기반 FlowExecutor</li>
 *   <li>{@link com.ryuqq.flowbatch.adapter.inmemory.executor.InMemoryExecutorRegistry} - 종류별 ExecutorFactory 레지스트리</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.adapter.inmemory.executor;
