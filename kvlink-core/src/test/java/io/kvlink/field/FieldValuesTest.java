package io.kvlink.field;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValuesTest {

    @Test
    void comparesArraysByContent() {
        assertThat(FieldValues.valuesEqual(new byte[]{1, 2}, new byte[]{1, 2})).isTrue();
        assertThat(FieldValues.valuesEqual(new byte[]{1, 2}, new byte[]{2, 1})).isFalse();
    }

    @Test
    void comparesDecimalsByNumericValue() {
        assertThat(FieldValues.valuesEqual(new BigDecimal("1.50"), new BigDecimal("1.5"))).isTrue();
    }

    @Test
    void rendersShortAndLongByteArrays() {
        assertThat(FieldValues.render(new byte[]{1})).isEqualTo("b[1]");
        assertThat(FieldValues.render(new byte[40])).isEqualTo("byte[40]");
        assertThat(FieldValues.render("x")).isEqualTo("'x'");
    }
}
