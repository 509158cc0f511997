package com.ryuqq.flowbatch.core.error;

/**
 * 입력 디렉토리와 입력 매핑으로부터 라인 입력을 만들지 못한 경우.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public class InputResolutionException extends FlowBatchException {

    public InputResolutionException(String message) {
        super("INPUT-001", ErrorTarget.INPUT, message);
    }

    public InputResolutionException(String message, Throwable cause) {
        super("INPUT-001", ErrorTarget.INPUT, message, cause);
    }
}
