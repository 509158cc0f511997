package com.ryuqq.flowbatch.core.error;

/**
 * 분류가 끝난 도메인 오류의 최상위 타입.
 *
 * <p>이 타입(및 하위 타입)은 이미 {@link ErrorTarget}과 오류 코드를 가지고 있으므로
 * 오케스트레이터는 다시 감싸지 않고 호출자에게 그대로 전파합니다.
 * 그 외의 예외는 {@link UnexpectedBatchException}으로 감싸집니다.</p>
 *
 * <p><strong>오류 코드 예시:</strong></p>
 * <ul>
 *   <li>FLOW-001: flow 구조 오류</li>
 *   <li>INPUT-001: 입력 해석 실패</li>
 *   <li>INPUT-002: 입력 타입 변환 실패</li>
 *   <li>BATCH-001: 라인 실패 (fail-fast)</li>
 *   <li>BATCH-500: 예상하지 못한 오류</li>
 * </ul>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public class FlowBatchException extends RuntimeException {

    private final String errorCode;
    private final ErrorTarget target;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드
     * @param target 오류 영역
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 비었거나 target이 null인 경우
     */
    public FlowBatchException(String errorCode, ErrorTarget target, String message) {
        this(errorCode, target, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param errorCode 오류 코드
     * @param target 오류 영역
     * @param message 오류 메시지
     * @param cause 원인 (null 허용)
     * @throws IllegalArgumentException errorCode가 비었거나 target이 null인 경우
     */
    public FlowBatchException(String errorCode, ErrorTarget target, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        this.errorCode = errorCode;
        this.target = target;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorTarget getTarget() {
        return target;
    }
}
