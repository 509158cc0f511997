package com.ryuqq.flowbatch.core.model;

/**
 * Flow가 선언한 입력 하나.
 *
 * @param name 입력 이름
 * @param type 선언된 타입
 * @param defaultValue 기본값 (null이면 기본값 없음)
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public record InputDefinition(
    String name,
    ValueType type,
    Object defaultValue
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 비었거나 type이 null인 경우
     */
    public InputDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    /**
     * 기본값 없는 입력 정의.
     *
     * @param name 입력 이름
     * @param type 선언된 타입
     * @return InputDefinition
     */
    public static InputDefinition of(String name, ValueType type) {
        return new InputDefinition(name, type, null);
    }

    /**
     * 기본값 있는 입력 정의.
     *
     * @param name 입력 이름
     * @param type 선언된 타입
     * @param defaultValue 기본값
     * @return InputDefinition
     */
    public static InputDefinition withDefault(String name, ValueType type, Object defaultValue) {
        return new InputDefinition(name, type, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
