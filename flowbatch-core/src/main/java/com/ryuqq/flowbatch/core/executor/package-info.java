/**
 * Executor 계약 - 실행 백엔드 추상화.
 *
 * <p>이 패키지는 라인 실행, 배치 위임, 집계 실행, 리소스 해제를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.core.executor.FlowExecutor} - 실행 백엔드</li>
 *   <li>{@link com.ryuqq.flowbatch.core.executor.ExecutionMode} - 라인 단위 / 배치 전체 위임</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>라인 실패는 값:</strong> LineResult의 상태로 표현</li>
 *   <li><strong>인프라 장애만 예외:</strong> 오케스트레이터가 해당 라인만 FAILED로 기록</li>
 *   <li><strong>멱등 해제:</strong> release()는 여러 번 호출되어도 안전</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.core.executor;
