package io.kvlink.field;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NullSentinelTest {

    @Test
    void equalsOnlyItself() {
        assertThat(NullSentinel.INSTANCE).isEqualTo(NullSentinel.INSTANCE);
        assertThat(NullSentinel.isNull(NullSentinel.INSTANCE)).isTrue();
    }

    @Test
    void isNeverEqualToEmptyStringOrFalse() {
        assertThat(NullSentinel.INSTANCE.equals("")).isFalse();
        assertThat(NullSentinel.INSTANCE.equals(Boolean.FALSE)).isFalse();
        assertThat(NullSentinel.INSTANCE.equals(0L)).isFalse();
        assertThat(NullSentinel.isNull(null)).isFalse();
    }

    @Test
    void valueEqualityTreatsSentinelAsDistinct() {
        assertThat(FieldValues.valuesEqual(NullSentinel.INSTANCE, NullSentinel.INSTANCE)).isTrue();
        assertThat(FieldValues.valuesEqual(NullSentinel.INSTANCE, "")).isFalse();
        assertThat(FieldValues.valuesEqual(false, NullSentinel.INSTANCE)).isFalse();
        assertThat(FieldValues.valuesEqual(null, NullSentinel.INSTANCE)).isFalse();
    }
}
