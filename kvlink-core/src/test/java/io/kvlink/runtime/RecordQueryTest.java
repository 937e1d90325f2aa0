package io.kvlink.runtime;

import io.kvlink.core.KvlinkArena;
import io.kvlink.core.SchemaException;
import io.kvlink.core.ValueConversionException;
import io.kvlink.field.NullSentinel;
import io.kvlink.storage.InMemoryRecordStore;
import io.kvlink.testutil.TestModels;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordQueryTest {

    private final KvlinkArena arena = TestModels.arena();
    private final RecordRepository refed = TestModels.refed(arena);
    private final RecordRepository main = TestModels.main(arena);
    private final RecordRepository preMain = TestModels.preMain(arena);

    @AfterEach
    void closeArena() {
        arena.close();
    }

    @Test
    void linkFieldsFilterByIdOrRecord() {
        ObjectRecord ref = saved(refed.create(Map.of("name", "rone")));
        ObjectRecord holder = saved(main.create(Map.of("name", "one", "other", ref)));
        saved(main.create(Map.of("name", "two")));

        assertThat(main.filter("other", ref.getId()).getIds()).containsExactly(holder.getId());
        assertThat(main.filter("other", ref).getIds()).containsExactly(holder.getId());
        assertThat(main.filter("other", String.valueOf(ref.getId())).getIds()).containsExactly(holder.getId());
        assertThat(main.filter("other", holder.getLink("other")).getIds()).containsExactly(holder.getId());
    }

    @Test
    void emptyLinksAreIndexedToo() {
        ObjectRecord ref = saved(refed.create(Map.of("name", "rone")));
        saved(main.create(Map.of("name", "one", "other", ref)));
        ObjectRecord lonely = saved(main.create(Map.of("name", "two")));

        assertThat(main.filter("other", NullSentinel.INSTANCE).getIds()).containsExactly(lonely.getId());
    }

    @Test
    void unsavedRecordCannotBeAFilterValue() {
        ObjectRecord ref = refed.create(Map.of("name", "rone"));

        assertThatThrownBy(() -> main.filter("other", ref))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("unsaved");
    }

    @Test
    void linkToUnsavedRecordCannotBeAFilterValue() {
        ForeignLink pending = main.create(Map.of("other", refed.create())).getLink("other");

        assertThatThrownBy(() -> main.filter("other", pending))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("unsaved");
    }

    @Test
    void deletedRecordLeavesNoIndexEntries() {
        InMemoryRecordStore store = (InMemoryRecordStore) arena.store();
        String storeKey = arena.storeKey(TestModels.REFED);
        ObjectRecord ref = saved(refed.create(Map.of("name", "rone", "intVal", 4)));
        ref.set("name", "renamed");
        ref.save();

        assertThat(store.indexEntries(storeKey, "name")).containsOnlyKeys("renamed");

        ref.delete();

        assertThat(store.indexEntries(storeKey, "name")).isEmpty();
        assertThat(store.indexEntries(storeKey, "intVal")).isEmpty();
    }

    @Test
    void hashedFieldsAcceptValueOrDigest() {
        ObjectRecord middle = saved(main.create(Map.of("name", "one")));
        ObjectRecord top = saved(preMain.create(Map.of("name", "pone", "main", middle)));
        IndexDigest digest = IndexDigest.of(String.valueOf(middle.getId()).getBytes(StandardCharsets.US_ASCII));

        assertThat(preMain.filter("main", middle).getIds()).containsExactly(top.getId());
        assertThat(preMain.filter("main", digest).getIds()).containsExactly(top.getId());
    }

    @Test
    void digestOnPlainIndexIsRejected() {
        IndexDigest digest = IndexDigest.of("rone".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> refed.filter("name", digest))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("not hash-indexed");
        assertThatThrownBy(() -> new IndexDigest("not-a-digest"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyIndexedFieldsCanBeFiltered() {
        assertThatThrownBy(() -> refed.filter("strVal", "hello"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("not indexed");
        assertThatThrownBy(() -> refed.filter("missing", "x"))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void filtersIntersect() {
        saved(refed.create(Map.of("name", "a", "intVal", 1)));
        ObjectRecord both = saved(refed.create(Map.of("name", "a", "intVal", 2)));
        saved(refed.create(Map.of("name", "b", "intVal", 2)));

        RecordQuery query = refed.filter("name", "a").filter("intVal", "2");

        assertThat(query.getIds()).containsExactly(both.getId());
        assertThat(query.count()).isEqualTo(1);
        assertThat(refed.filter("name", "a").count()).isEqualTo(2);
    }

    @Test
    void queryWithoutFiltersMatchesEverything() {
        ObjectRecord first = saved(refed.create(Map.of("name", "a")));
        saved(refed.create(Map.of("name", "b")));

        assertThat(refed.query().count()).isEqualTo(2);
        assertThat(refed.all()).hasSize(2);
        assertThat(refed.query().first().getId()).isEqualTo(first.getId());
        assertThat(refed.filter("name", "zzz").first()).isNull();
    }

    @Test
    void deleteRemovesMatchesOnly() {
        saved(refed.create(Map.of("name", "a", "intVal", 1)));
        saved(refed.create(Map.of("name", "a", "intVal", 2)));
        ObjectRecord kept = saved(refed.create(Map.of("name", "b", "intVal", 1)));

        assertThat(refed.filter("name", "a").delete()).isEqualTo(2);

        assertThat(refed.query().getIds()).containsExactly(kept.getId());
        assertThat(refed.filter("intVal", 1).getIds()).containsExactly(kept.getId());
    }

    @Test
    void deleteAllDestroysTheModel() {
        saved(refed.create(Map.of("name", "a")));
        saved(refed.create(Map.of("name", "b")));

        assertThat(refed.deleteAll()).isEqualTo(2);

        assertThat(refed.count()).isZero();
        assertThat(refed.filter("name", "a").count()).isZero();
    }

    @Test
    void getMultipleSkipsMissingIds() {
        ObjectRecord a = saved(refed.create(Map.of("name", "a")));
        ObjectRecord b = saved(refed.create(Map.of("name", "b")));

        List<ObjectRecord> found = refed.getMultiple(List.of(b.getId(), 404L, a.getId()));

        assertThat(found).extracting(ObjectRecord::getId).containsExactly(b.getId(), a.getId());
    }

    private static ObjectRecord saved(ObjectRecord record) {
        record.save();
        return record;
    }
}
