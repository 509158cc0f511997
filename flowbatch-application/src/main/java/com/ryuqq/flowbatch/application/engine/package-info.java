/**
 * Flow Batch Application Layer - 배치 실행 API.
 *
 * <p>이 패키지는 배치 실행 요청을 받아 {@link com.ryuqq.flowbatch.core.model.BatchResult}를
 * 돌려주는 애플리케이션 포트를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.application.engine.BatchEngine} - run / cancel 진입점</li>
 *   <li>{@link com.ryuqq.flowbatch.application.engine.BatchRunRequest} - 실행 요청</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>불변성:</strong> BatchRunRequest는 불변 객체</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.application.engine;
