package com.ryuqq.flowbatch.core.error;

/**
 * Flow 정의가 배치 실행에 적합하지 않은 경우.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public class FlowValidationException extends FlowBatchException {

    public FlowValidationException(String message) {
        super("FLOW-001", ErrorTarget.FLOW, message);
    }
}
