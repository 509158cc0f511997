package com.ryuqq.flowbatch.core.executor;

import com.ryuqq.flowbatch.core.model.AggregationResult;
import com.ryuqq.flowbatch.core.model.LineInput;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.core.model.RunId;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Flow 실행 백엔드.
 *
 * <p>모든 실행 백엔드(in-process, out-of-process)가 구현하는 계약입니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>라인 하나 실행 ({@link #executeLine})</li>
 *   <li>선택적으로 배치 전체 실행 ({@link #executeBatch}, {@link ExecutionMode#WHOLE_BATCH})</li>
 *   <li>집계 노드 실행 ({@link #executeAggregation})</li>
 *   <li>리소스 해제 ({@link #release})</li>
 * </ul>
 *
 * <p><strong>오류 규칙:</strong></p>
 * <ul>
 *   <li>라인 로직의 실패는 예외가 아니라 FAILED 상태의 {@link LineResult}로 반환해야 합니다.</li>
 *   <li>예외는 백엔드 접속 불가, 프로토콜 위반 같은 인프라 장애에만 사용합니다.</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>{@link #supportsConcurrentLines()}가 true이면 executeLine은 여러 스레드에서 동시에 호출됩니다.</li>
 *   <li>false이면 오케스트레이터는 동시성 상한을 1로 낮춥니다.</li>
 *   <li>취소 시 실행 중인 스레드가 인터럽트되므로, 블로킹 I/O는 인터럽트에 반응해야 합니다.</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public interface FlowExecutor {

    /**
     * 라인 하나 실행.
     *
     * @param input 라인 입력 (기본값 적용 완료)
     * @param runId Run ID
     * @return 라인 결과 (index는 input.index()와 같아야 함)
     * @throws InterruptedException 취소로 인해 실행 스레드가 인터럽트된 경우
     */
    LineResult executeLine(LineInput input, RunId runId) throws InterruptedException;

    /**
     * 배치 위임 방식.
     *
     * @return 기본값 {@link ExecutionMode#PER_LINE}
     */
    default ExecutionMode executionMode() {
        return ExecutionMode.PER_LINE;
    }

    /**
     * executeLine을 여러 스레드에서 동시에 호출해도 안전한지 여부.
     *
     * @return 기본값 true
     */
    default boolean supportsConcurrentLines() {
        return true;
    }

    /**
     * 배치 전체 실행 ({@link ExecutionMode#WHOLE_BATCH} 전용).
     *
     * @param inputs 모든 라인 입력
     * @param outputDir 출력 디렉토리
     * @param runId Run ID
     * @return 라인 결과 (순서 무관)
     * @throws InterruptedException 취소로 인해 실행 스레드가 인터럽트된 경우
     * @throws UnsupportedOperationException PER_LINE executor인 경우
     */
    default List<LineResult> executeBatch(List<LineInput> inputs, Path outputDir, RunId runId) throws InterruptedException {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support whole-batch execution");
    }

    /**
     * 집계 노드 실행.
     *
     * <p>두 입력 모두 성공한 라인만 index 순서로 담은 컬럼 형태입니다.
     * 같은 위치의 값끼리 묶으면 한 라인의 값이 됩니다.</p>
     *
     * @param inputs flow 입력 이름 → 성공 라인들의 값 목록
     * @param aggregationInputs 집계 입력 속성 → 성공 라인들의 값 목록
     * @param runId Run ID
     * @return 집계 결과
     * @throws InterruptedException 취소로 인해 실행 스레드가 인터럽트된 경우
     */
    AggregationResult executeAggregation(Map<String, List<Object>> inputs,
                                         Map<String, List<Object>> aggregationInputs,
                                         RunId runId) throws InterruptedException;

    /**
     * 리소스 해제.
     *
     * <p>run 종료 시 성공, 실패, 취소와 무관하게 정확히 한 번 호출됩니다.
     * 구현체는 멱등이어야 합니다.</p>
     */
    void release();
}
