package com.ryuqq.flowbatch.core.error;

/**
 * 분류되지 않은 예외를 감싼 오류.
 *
 * <p>"시스템이 오동작했다"는 신호이며, "flow 자체 로직이 실패했다"와 구분하기 위해 사용합니다.
 * 원본 예외 타입 이름과 메시지를 진단 문자열로 보존하고, 원본은 cause로 유지합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public class UnexpectedBatchException extends FlowBatchException {

    private final String errorTypeAndMessage;

    /**
     * 생성자.
     *
     * @param target 오류 영역
     * @param context 어떤 작업 중이었는지 (예: "executing the batch run")
     * @param cause 원본 예외
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public UnexpectedBatchException(ErrorTarget target, String context, Throwable cause) {
        super("BATCH-500", target, buildMessage(context, cause), cause);
        this.errorTypeAndMessage = typeAndMessage(cause);
    }

    /**
     * "(Type) message" 형식의 원본 예외 요약.
     *
     * @return 원본 예외 타입 이름과 메시지
     */
    public String getErrorTypeAndMessage() {
        return errorTypeAndMessage;
    }

    private static String buildMessage(String context, Throwable cause) {
        return "Unexpected error occurred while " + context + ". Error: " + typeAndMessage(cause) + ".";
    }

    private static String typeAndMessage(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return "(" + cause.getClass().getSimpleName() + ") " + cause.getMessage();
    }
}
