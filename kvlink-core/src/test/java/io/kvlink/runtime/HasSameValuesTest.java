package io.kvlink.runtime;

import io.kvlink.core.KvlinkArena;
import io.kvlink.testutil.TestModels;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HasSameValuesTest {

    private final KvlinkArena arena = TestModels.arena();
    private final RecordRepository refed = TestModels.refed(arena);
    private final RecordRepository main = TestModels.main(arena);
    private final RecordRepository node = TestModels.node(arena);

    @AfterEach
    void closeArena() {
        arena.close();
    }

    @Test
    void comparesScalarsIgnoringIds() {
        ObjectRecord saved = refed.create(Map.of("name", "rone", "intVal", 1));
        saved.save();
        ObjectRecord fresh = refed.create(Map.of("name", "rone", "intVal", 1));

        assertThat(saved.hasSameValues(fresh)).isTrue();

        fresh.set("intVal", 2);
        assertThat(saved.hasSameValues(fresh)).isFalse();
    }

    @Test
    void differentModelsOrNullAreNeverEqual() {
        ObjectRecord ref = refed.create();

        assertThat(ref.hasSameValues(main.create())).isFalse();
        assertThat(ref.hasSameValues(null)).isFalse();
        assertThat(ref.hasSameValues(ref)).isTrue();
    }

    @Test
    void withoutCascadeLinksCompareById() {
        ObjectRecord refA = saved(refed.create(Map.of("name", "same")));
        ObjectRecord refB = saved(refed.create(Map.of("name", "same")));
        ObjectRecord left = main.create(Map.of("name", "m", "other", refA));
        ObjectRecord right = main.create(Map.of("name", "m", "other", refB));

        assertThat(left.hasSameValues(right, false)).isFalse();
        assertThat(left.hasSameValues(right, true)).isTrue();
    }

    @Test
    void nestedDriftOnlyMattersWithCascade() {
        ObjectRecord ref = saved(refed.create(Map.of("name", "rone", "intVal", 1)));
        long id = saved(main.create(Map.of("name", "m", "other", ref.getId()))).getId();
        ObjectRecord resolved = main.get(id);
        ObjectRecord unresolved = main.get(id);

        resolved.getRecord("other").set("intVal", 77);

        assertThat(resolved.hasSameValues(unresolved, false)).isTrue();
        assertThat(resolved.hasSameValues(unresolved, true)).isFalse();
        assertThat(unresolved.getLink("other").isFetched()).isFalse();
    }

    @Test
    void bothResolvedComparesTargetsByValue() {
        ObjectRecord ref = saved(refed.create(Map.of("name", "rone", "intVal", 1)));
        long id = saved(main.create(Map.of("name", "m", "other", ref.getId()))).getId();
        ObjectRecord left = main.get(id, true);
        ObjectRecord right = main.get(id, true);

        assertThat(left.hasSameValues(right)).isTrue();

        right.getRecord("other").set("intVal", 2);
        assertThat(left.hasSameValues(right)).isFalse();
        assertThat(left.hasSameValues(right, false)).isTrue();
    }

    @Test
    void cyclicGraphsCompareWithoutLooping() {
        ObjectRecord a = node.create(Map.of("name", "a"));
        ObjectRecord b = node.create(Map.of("name", "b", "next", a));
        a.set("next", b);
        a.save();

        ObjectRecord left = node.get(a.getId(), true);
        ObjectRecord right = node.get(a.getId(), true);

        assertThat(left.hasSameValues(right)).isTrue();
    }

    private static ObjectRecord saved(ObjectRecord record) {
        record.save();
        return record;
    }
}
