/**
 * FlowBatch Testkit.
 *
 * <p>백엔드 구현이나 엔진 변경을 검증할 때 쓰는 테스트 도구입니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.testkit.ScriptedFlowExecutor} - 라인별 동작을 스크립트로 정하는 계측 executor</li>
 *   <li>{@link com.ryuqq.flowbatch.testkit.AbstractBatchContractTest} - 파일 입출력으로 엔진을 조립하는 Contract Test 베이스</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.testkit;
