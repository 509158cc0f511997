package com.ryuqq.flowbatch.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Flow 입력에 선언할 수 있는 값 타입.
 *
 * <p>{@link #coerce(Object)}는 문자열로 들어온 숫자나 불리언처럼 표현만 다른 값을
 * 선언된 타입으로 변환합니다. null은 그대로 통과합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
public enum ValueType {

    INT,
    DOUBLE,
    BOOL,
    STRING,
    LIST,
    OBJECT;

    /**
     * 값을 이 타입으로 변환.
     *
     * @param value 원본 값 (null 허용)
     * @return 변환된 값
     * @throws IllegalArgumentException 변환할 수 없는 값인 경우
     */
    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        return switch (this) {
            case INT -> toInteger(value);
            case DOUBLE -> toDouble(value);
            case BOOL -> toBoolean(value);
            case STRING -> value instanceof String ? value : String.valueOf(value);
            case LIST -> toList(value);
            case OBJECT -> value;
        };
    }

    private static final double LONG_MIN_AS_DOUBLE = -0x1p63;
    private static final double LONG_MAX_EXCLUSIVE_AS_DOUBLE = 0x1p63;

    private static Object toInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("value " + value + " is not an integral number");
            }
            // (long) 캐스트는 범위를 넘으면 Long.MIN_VALUE/MAX_VALUE로 포화됨
            if (d < LONG_MIN_AS_DOUBLE || d >= LONG_MAX_EXCLUSIVE_AS_DOUBLE) {
                throw new IllegalArgumentException("value " + value + " is out of range for int");
            }
            return narrow((long) d);
        }
        if (value instanceof String s) {
            try {
                return narrow(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("value '" + s + "' cannot be parsed as int", e);
            }
        }
        throw new IllegalArgumentException("value of type " + value.getClass().getSimpleName() + " cannot be converted to int");
    }

    private static Object narrow(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }

    private static Object toDouble(Object value) {
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("value '" + s + "' cannot be parsed as double", e);
            }
        }
        throw new IllegalArgumentException("value of type " + value.getClass().getSimpleName() + " cannot be converted to double");
    }

    private static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return Boolean.TRUE;
            }
            if ("false".equals(normalized)) {
                return Boolean.FALSE;
            }
        }
        throw new IllegalArgumentException("value '" + value + "' cannot be converted to bool");
    }

    private static Object toList(Object value) {
        if (value instanceof List) {
            return value;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        throw new IllegalArgumentException("value of type " + value.getClass().getSimpleName() + " cannot be converted to list");
    }
}
