/**
 * 입력 매핑 규칙.
 *
 * <p>입력 디렉토리에서 읽은 데이터셋을 {@code ${data.col}} 형식의 매핑으로 라인 입력으로 바꿉니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.core.input;
