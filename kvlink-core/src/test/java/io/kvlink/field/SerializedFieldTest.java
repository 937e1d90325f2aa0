package io.kvlink.field;

import io.kvlink.core.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerializedFieldTest {

    @Test
    void roundTripsSerializableValues() {
        SerializedField field = new SerializedField("payload");
        ArrayList<String> value = new ArrayList<>(List.of("a", "b"));

        byte[] stored = field.toStorage(value);

        assertThat(stored).startsWith((byte) 0xAC, (byte) 0xED, (byte) 0x00, (byte) 0x05);
        assertThat(field.fromStorage(stored)).isEqualTo(value);
    }

    @Test
    void bytesWithoutStreamHeaderPassThrough() {
        SerializedField field = new SerializedField("payload");
        byte[] raw = {1, 2, 3, 4, 5};

        assertThat((byte[]) field.fromStorage(raw)).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void isNeverIndexable() {
        SerializedField field = new SerializedField("payload");

        assertThat(field.canIndex()).isFalse();
        assertThatThrownBy(() -> field.toIndex("x")).isInstanceOf(SchemaException.class);
    }

    @Test
    void emptyReadsAsSentinel() {
        assertThat(new SerializedField("payload").fromStorage(new byte[0])).isSameAs(NullSentinel.INSTANCE);
    }

    @Test
    void emptyValuesAreSerializedLikeAnyOther() {
        SerializedField field = new SerializedField("payload");

        byte[] storedString = field.toStorage("");
        byte[] storedBytes = field.toStorage(new byte[0]);

        assertThat(storedString).isNotEmpty();
        assertThat(field.fromStorage(storedString)).isEqualTo("");
        assertThat((byte[]) field.fromStorage(storedBytes)).isEmpty();
        assertThat(field.toStorage(NullSentinel.INSTANCE)).isEmpty();
    }
}
