/**
 * Run 상태 머신.
 *
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.core.statemachine.RunState} - Run 생명주기 상태</li>
 *   <li>{@link com.ryuqq.flowbatch.core.statemachine.RunStateTransition} - 전이 규칙 검증</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.core.statemachine;
