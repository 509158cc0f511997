package com.ryuqq.flowbatch.core.error;

import com.ryuqq.flowbatch.core.model.ValueType;

/**
 * 라인 입력 값을 선언된 타입으로 변환하지 못한 경우.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public class InputTypeException extends FlowBatchException {

    private final String inputName;
    private final ValueType expectedType;

    /**
     * 생성자.
     *
     * @param inputName 입력 이름
     * @param expectedType 선언된 타입
     * @param value 변환에 실패한 값
     * @param cause 변환 실패 원인
     */
    public InputTypeException(String inputName, ValueType expectedType, Object value, Throwable cause) {
        super("INPUT-002", ErrorTarget.INPUT,
            String.format("Input '%s' expects type %s but got value '%s' (%s)",
                inputName, expectedType, value, value == null ? "null" : value.getClass().getSimpleName()),
            cause);
        this.inputName = inputName;
        this.expectedType = expectedType;
    }

    public String getInputName() {
        return inputName;
    }

    public ValueType getExpectedType() {
        return expectedType;
    }
}
