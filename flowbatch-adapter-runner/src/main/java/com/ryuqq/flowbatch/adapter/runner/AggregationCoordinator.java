package com.ryuqq.flowbatch.adapter.runner;

import com.ryuqq.flowbatch.core.error.ErrorTarget;
import com.ryuqq.flowbatch.core.error.FlowBatchException;
import com.ryuqq.flowbatch.core.error.UnexpectedBatchException;
import com.ryuqq.flowbatch.core.executor.FlowExecutor;
import com.ryuqq.flowbatch.core.model.AggregationResult;
import com.ryuqq.flowbatch.core.model.ErrorInfo;
import com.ryuqq.flowbatch.core.model.FlowDefinition;
import com.ryuqq.flowbatch.core.model.LineInput;
import com.ryuqq.flowbatch.core.model.LineResult;
import com.ryuqq.flowbatch.core.model.RunId;
import com.ryuqq.flowbatch.core.validation.FlowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 집계 노드 실행 조정.
 *
 * <p>성공한 라인만 골라 라인 단위 데이터를 키 단위 컬럼으로 바꾼 뒤
 * {@link FlowExecutor#executeAggregation}을 한 번 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 집계 노드가 없으면 빈 결과 (executor 호출 없음)
 * 2. COMPLETED 라인의 index를 오름차순으로 선택
 * 3. 각 라인 원본 입력을 선언 타입으로 변환 → 선언된 입력 이름별 컬럼 (선언되지 않은 키는 제외)
 * 4. 각 라인 aggregationInputs → 집계 입력 속성별 컬럼 (없는 값은 null)
 * 5. executeAggregation 호출
 * </pre>
 *
 * <p>두 컬럼 맵의 같은 위치는 같은 라인을 가리킵니다.
 * 도메인 예외는 그대로, 그 외 예외는 {@link UnexpectedBatchException}(AGGREGATION)으로 전파합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public final class AggregationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AggregationCoordinator.class);

    /**
     * 집계 실행.
     *
     * @param flow flow 정의
     * @param executor 실행 백엔드
     * @param inputs 모든 라인 입력 (기본값 적용 완료)
     * @param results 모든 라인 결과
     * @param runId Run ID
     * @return 집계 결과 (집계 노드가 없거나 라인이 하나도 없으면 빈 결과)
     * @throws InterruptedException 집계 중 취소된 경우
     * @throws FlowBatchException 입력 타입 변환 실패 또는 executor의 도메인 오류
     */
    public AggregationResult aggregate(FlowDefinition flow, FlowExecutor executor, List<LineInput> inputs,
                                       List<LineResult> results, RunId runId) throws InterruptedException {
        if (!flow.hasAggregationNodes()) {
            return AggregationResult.empty();
        }
        if (results.isEmpty()) {
            log.info("Run {} has no lines, skipping aggregation nodes {}", runId, flow.getAggregationNodeNames());
            return AggregationResult.empty();
        }

        Map<Integer, LineInput> inputsByIndex = new HashMap<>();
        for (LineInput input : inputs) {
            inputsByIndex.put(input.index(), input);
        }
        List<LineResult> successful = results.stream()
            .filter(LineResult::isCompleted)
            .sorted(Comparator.comparingInt(LineResult::index))
            .toList();

        List<Map<String, Object>> inputRows = new ArrayList<>();
        List<Map<String, Object>> aggregationRows = new ArrayList<>();
        for (LineResult result : successful) {
            LineInput input = inputsByIndex.get(result.index());
            Map<String, Object> values = input == null ? Map.of() : input.values();
            inputRows.add(FlowValidator.ensureInputTypes(flow, values));
            aggregationRows.add(result.aggregationInputs());
        }

        Map<String, List<Object>> inputColumns = transpose(inputRows, flow.getInputNames());
        Map<String, List<Object>> aggregationColumns = transpose(aggregationRows, flow.getAggregationInputProperties());

        log.info("Run {} executing aggregation nodes {} over {} successful lines",
            runId, flow.getAggregationNodeNames(), successful.size());

        AggregationResult result;
        try {
            result = executor.executeAggregation(inputColumns, aggregationColumns, runId);
        } catch (FlowBatchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UnexpectedBatchException(ErrorTarget.AGGREGATION, "executing the aggregation nodes", e);
        }

        if (result == null) {
            return AggregationResult.empty();
        }
        for (Map.Entry<String, ErrorInfo> nodeError : result.nodeErrors().entrySet()) {
            log.warn("Run {} aggregation node '{}' failed: {}", runId, nodeError.getKey(), nodeError.getValue().typeAndMessage());
        }
        return result;
    }

    /**
     * 행 목록을 키별 컬럼으로 변환.
     *
     * @param rows 행 목록
     * @param keys 컬럼 키 (순서 유지)
     * @return 키 → 행 순서의 값 목록 (행에 없는 키는 null)
     */
    static Map<String, List<Object>> transpose(List<Map<String, Object>> rows, Collection<String> keys) {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (String key : keys) {
            List<Object> column = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                column.add(row.get(key));
            }
            columns.put(key, column);
        }
        return columns;
    }
}
