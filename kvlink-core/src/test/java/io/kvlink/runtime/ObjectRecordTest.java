package io.kvlink.runtime;

import io.kvlink.core.KvlinkArena;
import io.kvlink.core.SchemaException;
import io.kvlink.core.ValueConversionException;
import io.kvlink.field.CompressedField;
import io.kvlink.field.CompressionMode;
import io.kvlink.field.NullSentinel;
import io.kvlink.schema.ModelSchema;
import io.kvlink.testutil.TestModels;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.Deflater;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectRecordTest {

    private static final byte[] HELLO = "\u0001Hello World\u0001".getBytes(StandardCharsets.ISO_8859_1);

    private final KvlinkArena arena = TestModels.arena();
    private final RecordRepository refed = TestModels.refed(arena);

    @AfterEach
    void closeArena() {
        arena.close();
    }

    @Test
    @DisplayName("updated fields: empty when fresh, one entry after a change, empty after save")
    void dirtyDiffFollowsSaves() {
        ObjectRecord record = refed.create(Map.of("name", "rone", "intVal", 1));

        assertThat(record.getUpdatedFields()).isEmpty();

        record.set("intVal", 5);
        assertThat(record.getUpdatedFields())
                .containsOnlyKeys("intVal")
                .containsEntry("intVal", new UpdatedField(1L, 5L));

        record.save();
        assertThat(record.getUpdatedFields()).isEmpty();
        assertThat(record.getId()).isNotNull();
    }

    @Test
    void settingBackToBaselineClearsTheDiff() {
        ObjectRecord record = refed.create(Map.of("name", "rone"));
        record.save();

        record.set("name", "other");
        record.set("name", "rone");

        assertThat(record.getUpdatedFields()).isEmpty();
    }

    @Test
    void missingFieldsTakeDefaults() {
        ObjectRecord record = refed.create();

        assertThat(record.get("name")).isEqualTo("");
        assertThat(record.get("intVal")).isSameAs(NullSentinel.INSTANCE);
    }

    @Test
    void valuesAreConvertedOnAssignment() {
        ObjectRecord record = refed.create(Map.of("intVal", "42"));

        assertThat(record.get("intVal")).isEqualTo(42L);
        assertThatThrownBy(() -> record.set("intVal", "many"))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("intVal");
    }

    @Test
    void unknownFieldsAreRejected() {
        assertThatThrownBy(() -> refed.create(Map.of("nope", 1)))
                .isInstanceOf(SchemaException.class);
        ObjectRecord record = refed.create();
        assertThatThrownBy(() -> record.get("nope")).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> record.getLink("name")).isInstanceOf(SchemaException.class);
    }

    @Test
    void savedValuesLoadBack() {
        ObjectRecord record = refed.create(Map.of("name", "rone", "strVal", "hello", "intVal", 0));
        long id = record.save().get(0);

        ObjectRecord loaded = refed.get(id);

        assertThat(loaded.getId()).isEqualTo(id);
        assertThat(loaded.get("intVal")).isEqualTo(0L);
        assertThat(loaded.hasSameValues(record)).isTrue();
        assertThat(loaded.getUpdatedFields()).isEmpty();
        assertThat(refed.get(id + 100)).isNull();
    }

    @Test
    void asDictGivesStorageOrTypedValues() {
        RecordRepository blobs = arena.register(ModelSchema.builder("Blob")
                .field(new CompressedField("value", CompressionMode.DEFLATE))
                .build());
        ObjectRecord blob = blobs.create(Map.of("value", HELLO));

        assertThat((byte[]) blob.asDict(true).get("value")).isEqualTo(deflateBest(HELLO));
        assertThat((byte[]) blob.asDict(false).get("value")).isEqualTo(HELLO);

        long id = blob.save().get(0);
        assertThat(arena.store().getFields("Blob", id).get("value")).isEqualTo(deflateBest(HELLO));
        assertThat((byte[]) blobs.get(id).get("value")).isEqualTo(HELLO);
    }

    @Test
    void asDictCanIncludeId() {
        ObjectRecord record = refed.create(Map.of("name", "rone"));
        record.save();

        assertThat(record.asDict(false, true))
                .containsEntry(ModelSchema.ID_FIELD, record.getId())
                .containsEntry("name", "rone");
        assertThat(record.asDict(false)).doesNotContainKey(ModelSchema.ID_FIELD);
    }

    @Test
    void copyWithoutIdSavesAsNewRecord() {
        ObjectRecord record = refed.create(Map.of("name", "rone", "intVal", 3));
        record.save();

        ObjectRecord copy = record.copy(false);

        assertThat(copy.getId()).isNull();
        assertThat(copy.hasSameValues(record)).isTrue();
        copy.save();
        assertThat(copy.getId()).isNotEqualTo(record.getId());
        assertThat(refed.count()).isEqualTo(2);
    }

    @Test
    void copyWithIdKeepsBaseline() {
        ObjectRecord record = refed.create(Map.of("name", "rone"));
        record.save();
        record.set("name", "changed");

        ObjectRecord copy = record.copy(true);

        assertThat(copy.getId()).isEqualTo(record.getId());
        assertThat(copy.getUpdatedFields()).containsOnlyKeys("name");
    }

    @Test
    void deleteRemovesRecordAndIndexEntries() {
        ObjectRecord record = refed.create(Map.of("name", "rone", "intVal", 1));
        long id = record.save().get(0);

        assertThat(record.delete()).isTrue();

        assertThat(refed.exists(id)).isFalse();
        assertThat(refed.filter("name", "rone").count()).isZero();
        assertThat(refed.filter("intVal", 1).count()).isZero();
        assertThat(record.getId()).isNull();
        assertThat(record.delete()).isFalse();
    }

    @Test
    void toStringShowsValuesWithoutResolvingLinks() {
        ObjectRecord record = refed.create(Map.of("name", "rone"));

        assertThat(record.toString()).contains("RefedModel").contains("unsaved").contains("'rone'");
    }

    private static byte[] deflateBest(byte[] data) {
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        deflater.setInput(data);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[256];
        while (!deflater.finished()) {
            out.write(buffer, 0, deflater.deflate(buffer));
        }
        deflater.end();
        return out.toByteArray();
    }
}
