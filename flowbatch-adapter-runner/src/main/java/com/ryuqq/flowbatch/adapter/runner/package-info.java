/**
 * Runner Adapter Layer - BatchEngine 구현체.
 *
 * <p>이 패키지는 BatchEngine 인터페이스의 구현체와 run 실행에 필요한 구성 요소를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.adapter.runner.DefaultBatchEngine} - run lifecycle 및 결과 조립</li>
 *   <li>{@link com.ryuqq.flowbatch.adapter.runner.LineScheduler} - 동시성 상한이 있는 라인 fan-out</li>
 *   <li>{@link com.ryuqq.flowbatch.adapter.runner.CancellationSupervisor} - 취소 감독 및 부분 결과 생성</li>
 *   <li>{@link com.ryuqq.flowbatch.adapter.runner.AggregationCoordinator} - 성공 라인 기반 집계</li>
 *   <li>{@link com.ryuqq.flowbatch.adapter.runner.SemaphoreBulkhead} - 라인 동시 실행 제한</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultBatchEngine)
 *   ↓ implements
 * application (BatchEngine interface)
 *   ↓ depends on
 * core (FlowDefinition, LineResult, BatchResult, RunState)
 *   ↓ depends on
 * core/executor, core/spi (FlowExecutor, ExecutorFactory, InputResolver, OutputWriter)
 * </pre>
 *
 * <h2>스레드 구성</h2>
 * <pre>
 * 호출 스레드 ── CancellationSupervisor 대기 (본문 종료 또는 취소)
 * flowbatch-run-{runId} ── run 본문, LineScheduler 제어 스레드
 * flowbatch-line-{runId}-N ── executeLine (최대 concurrency개)
 * </pre>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.adapter.runner;
