package io.kvlink.field;

import io.kvlink.core.SchemaException;
import io.kvlink.core.ValueConversionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScalarFieldsTest {

    @Test
    void stringRoundTripsAndReadsEmptyAsEmptyString() {
        StringField field = new StringField("name");

        byte[] stored = field.toStorage("héllo");

        assertThat(stored).isEqualTo("héllo".getBytes(StandardCharsets.UTF_8));
        assertThat(field.fromStorage(stored)).isEqualTo("héllo");
        assertThat(field.fromStorage(new byte[0])).isEqualTo("");
        assertThat(field.convertValue(null)).isEqualTo("");
    }

    @Test
    void stringUsesConfiguredCharset() {
        StringField field = new StringField("name", StandardCharsets.ISO_8859_1, false, null);

        assertThat(field.toStorage("é")).containsExactly((byte) 0xE9);
    }

    @Test
    void integerRoundTripsAndReadsEmptyAsSentinel() {
        IntegerField field = new IntegerField("count");

        assertThat(field.fromStorage(field.toStorage(-42L))).isEqualTo(-42L);
        assertThat(field.fromStorage(field.toStorage(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
        assertThat(field.fromStorage(new byte[0])).isSameAs(NullSentinel.INSTANCE);
        assertThat(field.toStorage(NullSentinel.INSTANCE)).isEmpty();
    }

    @Test
    void integerConvertsTextAndRejectsFractions() {
        IntegerField field = new IntegerField("count");

        assertThat(field.convertValue(" 42 ")).isEqualTo(42L);
        assertThat(field.convertValue(7)).isEqualTo(7L);
        assertThatThrownBy(() -> field.convertValue("forty"))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("count");
        assertThatThrownBy(() -> field.convertValue(1.5d))
                .isInstanceOf(ValueConversionException.class);
    }

    @Test
    @DisplayName("boolean parses true/1 and false/0 ignoring case")
    void booleanParsesKnownSpellings() {
        BooleanField field = new BooleanField("active");

        assertThat(field.convertValue("TRUE")).isEqualTo(true);
        assertThat(field.convertValue("1")).isEqualTo(true);
        assertThat(field.convertValue("False")).isEqualTo(false);
        assertThat(field.convertValue("0")).isEqualTo(false);
        assertThat(field.convertValue(1)).isEqualTo(true);
    }

    @Test
    void booleanRejectsAnythingElse() {
        BooleanField field = new BooleanField("active");

        assertThatThrownBy(() -> field.convertValue("maybe"))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("active");
        assertThatThrownBy(() -> field.convertValue(2))
                .isInstanceOf(ValueConversionException.class);
        assertThatThrownBy(() -> field.fromStorage("yes".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(ValueConversionException.class);
    }

    @Test
    void booleanFalseIsStoredAndNotConfusedWithEmpty() {
        BooleanField field = new BooleanField("active");

        byte[] stored = field.toStorage(false);

        assertThat(stored).isNotEmpty();
        assertThat(field.fromStorage(stored)).isEqualTo(false);
        assertThat(field.fromStorage(new byte[0])).isSameAs(NullSentinel.INSTANCE);
    }

    @Test
    void floatIsNeverIndexable() {
        FloatField field = new FloatField("ratio");

        assertThat(field.canIndex()).isFalse();
        assertThat(field.fromStorage(field.toStorage(0.1d))).isEqualTo(0.1d);
        assertThatThrownBy(() -> field.toIndex(0.1d)).isInstanceOf(SchemaException.class);
    }

    @Test
    void fixedPointRoundsToDeclaredPlaces() {
        FixedPointField field = new FixedPointField("price", 2);

        assertThat(field.canIndex()).isTrue();
        assertThat(new String(field.toStorage(1.005d), StandardCharsets.US_ASCII)).isEqualTo("1.01");
        assertThat(field.fromStorage(field.toStorage("3.14159"))).isEqualTo(new BigDecimal("3.14"));
        assertThat(field.toIndex(new BigDecimal("2.5"))).isEqualTo(field.toIndex("2.50"));
    }

    @Test
    void fixedPointRejectsUnsupportedPrecision() {
        assertThatThrownBy(() -> new FixedPointField("price", 19)).isInstanceOf(SchemaException.class);
    }

    @Test
    void bytesFieldCopiesAndIsNotIndexable() {
        BytesField field = new BytesField("blob");
        byte[] value = {0, 1, 2};

        byte[] stored = field.toStorage(value);
        value[0] = 9;

        assertThat(stored).containsExactly(0, 1, 2);
        assertThat(field.canIndex()).isFalse();
        assertThat((byte[]) field.fromStorage(new byte[0])).isEmpty();
    }

    @Test
    void base64StoresEncodedText() {
        Base64Field field = new Base64Field("token");

        byte[] stored = field.toStorage(new byte[]{(byte) 0xFF, 0x00});

        assertThat(new String(stored, StandardCharsets.US_ASCII)).isEqualTo("/wA=");
        assertThat((byte[]) field.fromStorage(stored)).containsExactly(0xFF, 0x00);
        assertThat(field.canIndex()).isTrue();
    }

    @Test
    void hashedIndexIsMd5OfStorageForm() {
        StringField field = new StringField("email", true);

        assertThat(field.toIndex("abc")).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
        assertThat(new StringField("email").toIndex("abc")).isEqualTo("abc");
    }

    @Test
    void hashedIndexOnNonIndexableTypeFailsValidation() {
        new IntegerField("n", true, null).validate();

        FieldChain hashedFloat = new FieldChain("ratio", List.of(new FloatField("")), true, null);

        assertThatThrownBy(hashedFloat::validate)
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("ratio");
    }

    @Test
    void defaultValueIsConvertedAndEmptyWhenAbsent() {
        assertThat(new IntegerField("n", false, 5L).defaultValue()).isEqualTo(5L);
        assertThat(new IntegerField("n").defaultValue()).isSameAs(NullSentinel.INSTANCE);
        assertThat(new StringField("s").defaultValue()).isEqualTo("");
    }
}
