package com.ryuqq.flowbatch.core.model;

/**
 * 실패 원인 요약.
 *
 * <p>예외 객체 대신 예외 타입 이름과 메시지만을 보관하여, 결과 객체가
 * 불변이면서 직렬화 가능한 상태로 남도록 합니다.</p>
 *
 * @param type 예외 타입 이름 (예: IllegalStateException)
 * @param message 오류 메시지 (null이면 빈 문자열로 정규화)
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public record ErrorInfo(
    String type,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null이거나 빈 문자열인 경우
     */
    public ErrorInfo {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (message == null) {
            message = "";
        }
    }

    /**
     * 예외로부터 ErrorInfo 생성.
     *
     * @param throwable 원인 예외
     * @return ErrorInfo 인스턴스
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public static ErrorInfo from(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        return new ErrorInfo(throwable.getClass().getSimpleName(), throwable.getMessage());
    }

    /**
     * ErrorInfo 생성.
     *
     * @param type 오류 타입
     * @param message 오류 메시지
     * @return ErrorInfo 인스턴스
     */
    public static ErrorInfo of(String type, String message) {
        return new ErrorInfo(type, message);
    }

    /**
     * "(Type) message" 형식의 진단 문자열.
     *
     * @return 타입과 메시지를 합친 문자열
     */
    public String typeAndMessage() {
        return "(" + type + ") " + message;
    }
}
