package com.ryuqq.flowbatch.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ValueType 변환 테스트.
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
class ValueTypeTest {

    @Test
    void int_문자열_숫자를_정수로_변환한다() {
        assertThat(ValueType.INT.coerce("42")).isEqualTo(42);
        assertThat(ValueType.INT.coerce(" 7 ")).isEqualTo(7);
        assertThat(ValueType.INT.coerce("9999999999")).isEqualTo(9_999_999_999L);
        assertThat(ValueType.INT.coerce(3.0d)).isEqualTo(3);
    }

    @Test
    void int_정수가_아닌_값은_거부한다() {
        assertThatThrownBy(() -> ValueType.INT.coerce("4.5"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValueType.INT.coerce(4.5d))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not an integral number");
    }

    @Test
    void int_long_범위를_넘는_실수는_거부한다() {
        assertThatThrownBy(() -> ValueType.INT.coerce(1e20d))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("out of range");
        assertThatThrownBy(() -> ValueType.INT.coerce(-1e30d))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("out of range");
        assertThatThrownBy(() -> ValueType.INT.coerce(0x1p63))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(ValueType.INT.coerce(-0x1p63)).isEqualTo(Long.MIN_VALUE);
        assertThat(ValueType.INT.coerce(1e15d)).isEqualTo(1_000_000_000_000_000L);
    }

    @Test
    void double_숫자와_문자열을_변환한다() {
        assertThat(ValueType.DOUBLE.coerce("0.25")).isEqualTo(0.25d);
        assertThat(ValueType.DOUBLE.coerce(2)).isEqualTo(2.0d);
    }

    @Test
    void bool_true_false_문자열만_허용한다() {
        assertThat(ValueType.BOOL.coerce("TRUE")).isEqualTo(true);
        assertThat(ValueType.BOOL.coerce("false")).isEqualTo(false);
        assertThatThrownBy(() -> ValueType.BOOL.coerce("yes"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void string_과_object_그리고_null() {
        assertThat(ValueType.STRING.coerce(12)).isEqualTo("12");
        Object any = new Object();
        assertThat(ValueType.OBJECT.coerce(any)).isSameAs(any);
        assertThat(ValueType.INT.coerce(null)).isNull();
    }

    @Test
    void list_배열을_리스트로_변환한다() {
        assertThat(ValueType.LIST.coerce(new Object[]{"a", "b"})).isEqualTo(List.of("a", "b"));
        assertThatThrownBy(() -> ValueType.LIST.coerce("[1,2]"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
