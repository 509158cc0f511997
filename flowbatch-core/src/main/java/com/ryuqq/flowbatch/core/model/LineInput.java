package com.ryuqq.flowbatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 한 라인(레코드)의 입력.
 *
 * <p>index는 배치 내 0-based 위치이며, 제출 순서가 아니라 이 값이 결과 정렬의 기준입니다.
 * values는 입력 이름 → 값 매핑이며 기본값이 이미 적용된 상태입니다.</p>
 *
 * @param index 배치 내 위치 (0 이상)
 * @param values 입력 이름 → 값 (불변 복사본으로 보관, null 값 허용)
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public record LineInput(
    int index,
    Map<String, Object> values
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException index가 음수이거나 values가 null인 경우
     */
    public LineInput {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
        }
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        // Map.copyOf는 null 값을 허용하지 않으므로 LinkedHashMap으로 복사
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * LineInput 생성.
     *
     * @param index 배치 내 위치
     * @param values 입력 값
     * @return LineInput 인스턴스
     */
    public static LineInput of(int index, Map<String, Object> values) {
        return new LineInput(index, values);
    }
}
