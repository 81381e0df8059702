package com.x4.projector.resolver;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for AttributeType.
 */
class AttributeTypeTest {

    @Test
    void testIntAcceptsWholeDecimals() {
        assertThat(AttributeType.INT.coerce("12")).isEqualTo(12);
        assertThat(AttributeType.INT.coerce(" 12.0 ")).isEqualTo(12);
        assertThat(AttributeType.INT.coerce("-3")).isEqualTo(-3);
        assertThat(AttributeType.INT.coerce("1e3")).isEqualTo(1000);
        assertThat(AttributeType.INT.coerce("2147483647")).isEqualTo(Integer.MAX_VALUE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1e100000000", "-1e100000000", "1e-100000000", "12345678901"})
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testIntRejectsHugeExponentsQuickly(String raw) {
        assertThatThrownBy(() -> AttributeType.INT.coerce(raw)).isInstanceOf(ArithmeticException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"12.5", "abc", "", "1e20"})
    void testIntRejects(String raw) {
        assertThatThrownBy(() -> AttributeType.INT.coerce(raw))
                .isInstanceOfAny(NumberFormatException.class, ArithmeticException.class);
    }

    @Test
    void testFloat() {
        assertThat(AttributeType.FLOAT.coerce("0.5")).isEqualTo(0.5);
        assertThat(AttributeType.FLOAT.coerce("3")).isEqualTo(3.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"NaN", "Infinity", "fast"})
    void testFloatRejects(String raw) {
        assertThatThrownBy(() -> AttributeType.FLOAT.coerce(raw)).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void testListSplitsOnWhitespace() {
        assertThat(AttributeType.LIST.coerce("  container\teconomy  stationbuilding ")).isEqualTo(
                List.of("container", "economy", "stationbuilding"));
        assertThat(AttributeType.LIST.coerce("   ")).isEqualTo(List.of());
    }

    @Test
    void testStringIsKeptAsWritten() {
        assertThat(AttributeType.STRING.coerce(" {20101,1} ")).isEqualTo(" {20101,1} ");
    }

    @Test
    void testDefaults() {
        assertThat(AttributeType.LIST.defaultOrEmpty(null)).isEqualTo(List.of());
        assertThat(AttributeType.INT.defaultOrEmpty(null)).isNull();
        assertThat(AttributeType.FLOAT.defaultOrEmpty(1.0)).isEqualTo(1.0);
    }
}
