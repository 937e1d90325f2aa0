package io.kvlink.runtime;

import io.kvlink.core.KvlinkArena;
import io.kvlink.core.KvlinkException;
import io.kvlink.core.ReferentialIntegrityException;
import io.kvlink.field.FieldDescriptor;
import io.kvlink.field.FieldValues;
import io.kvlink.field.ForeignLinkField;
import io.kvlink.schema.ModelSchema;
import io.kvlink.storage.RecordStore;
import io.kvlink.storage.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks the link graph for save, fetch, reload and value comparison.
 * <p>
 * Every traversal keeps its own visited set, so cyclic and self-referential
 * graphs terminate and each distinct record is touched once per call.
 */
final class CascadeOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(CascadeOrchestrator.class);

    private final KvlinkArena arena;

    CascadeOrchestrator(KvlinkArena arena) {
        this.arena = arena;
    }

    /**
     * Save a record, and with {@code cascade} every attached record reachable
     * from it that is unsaved or modified.
     * <p>
     * Ids are allocated for every unsaved record before anything is written,
     * then all writes go to the store as one batch. If allocation, encoding or
     * the batch fails, records that were given an id lose it again and no
     * baseline changes.
     */
    List<Long> save(ObjectRecord root, boolean cascade) {
        List<ObjectRecord> order;
        if (cascade) {
            order = collect(root);
        } else {
            checkLinksPersisted(root);
            order = List.of(root);
        }

        List<ObjectRecord> toWrite = new ArrayList<>();
        for (ObjectRecord record : order) {
            if (record == root || record.hasUnsavedChanges()) {
                toWrite.add(record);
            }
        }

        Set<ObjectRecord> created = Collections.newSetFromMap(new IdentityHashMap<>());
        try {
            for (ObjectRecord record : toWrite) {
                if (record.getId() == null) {
                    RecordStore store = arena.store();
                    String storeKey = record.repository().storeKey();
                    record.assignId(RecordRepository.roundTrip("allocate an id for " + record.modelName(),
                            () -> store.nextId(storeKey)));
                    created.add(record);
                }
            }
            WriteBatch.Builder batch = WriteBatch.builder();
            for (ObjectRecord record : toWrite) {
                appendWrites(record, created.contains(record), batch);
            }
            apply(batch.build());
        } catch (RuntimeException e) {
            for (ObjectRecord record : created) {
                record.assignId(null);
            }
            throw e;
        }

        List<Long> ids = new ArrayList<>(toWrite.size());
        ids.add(root.getId());
        for (ObjectRecord record : toWrite) {
            record.markPersisted();
            if (record != root) {
                ids.add(record.getId());
            }
        }
        LOG.debug("Saved {}#{} ({} records written, {} new)", root.modelName(), root.getId(),
                toWrite.size(), created.size());
        return ids;
    }

    /**
     * Resolve every link reachable from the given records. A record already
     * loaded in this call is reused, so each distinct record costs one round
     * trip and a cycle ends at the first repeated record.
     */
    void fetch(Collection<ObjectRecord> roots) {
        Map<String, ObjectRecord> loaded = new HashMap<>();
        Set<ObjectRecord> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<ObjectRecord> pending = new ArrayDeque<>();
        for (ObjectRecord root : roots) {
            if (root.getId() != null) {
                loaded.putIfAbsent(key(root.modelName(), root.getId()), root);
            }
            pending.add(root);
        }
        int fetched = 0;
        while (!pending.isEmpty()) {
            ObjectRecord record = pending.poll();
            if (!seen.add(record)) {
                continue;
            }
            for (ForeignLinkField field : record.schema().linkFields()) {
                ForeignLink link = (ForeignLink) record.rawValue(field.name());
                if (!link.isFetched()) {
                    Long id = link.getId();
                    if (id == null) {
                        continue;
                    }
                    String key = key(link.targetModel(), id);
                    ObjectRecord target = loaded.get(key);
                    if (target == null) {
                        target = arena.repository(link.targetModel()).load(id);
                        fetched++;
                        if (target == null) {
                            LOG.warn("Link {}.{} of #{} points at missing {}", record.modelName(), field.name(),
                                    record.getId(), key);
                        } else {
                            loaded.put(key, target);
                        }
                    }
                    link.resolve(target);
                }
                if (link.peekObject() != null) {
                    pending.add(link.peekObject());
                }
            }
        }
        LOG.debug("Cascade fetch from {} records loaded {} linked records", roots.size(), fetched);
    }

    /**
     * Replace a record's values with the stored ones, and with {@code cascade}
     * those of every target already resolved. Every read happens before any
     * record changes, so a failure leaves all of them as they were.
     */
    Map<String, UpdatedField> reload(ObjectRecord record, boolean cascade) {
        List<ReloadPlan> plans = new ArrayList<>();
        Map<String, UpdatedField> changes = planReload(record, cascade,
                Collections.newSetFromMap(new IdentityHashMap<>()), plans);
        for (ReloadPlan plan : plans) {
            plan.replacements().forEach(plan.record()::putRaw);
            plan.record().markPersisted();
        }
        LOG.debug("Reloaded {}#{} and {} linked records: {} fields changed", record.modelName(), record.getId(),
                plans.size() - 1, changes.size());
        return changes;
    }

    /**
     * Compare field values of two records, ignoring their ids.
     */
    boolean sameValues(ObjectRecord left, ObjectRecord right, boolean cascade) {
        return sameValues(left, right, cascade, new HashSet<>());
    }

    /**
     * Attached records reachable from {@code root}, targets before the records
     * linking to them.
     */
    private List<ObjectRecord> collect(ObjectRecord root) {
        List<ObjectRecord> order = new ArrayList<>();
        Set<ObjectRecord> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<PendingLinks> stack = new ArrayDeque<>();
        visited.add(root);
        stack.push(new PendingLinks(root, root.schema().linkFields().iterator()));
        while (!stack.isEmpty()) {
            PendingLinks top = stack.peek();
            if (top.links().hasNext()) {
                ForeignLinkField field = top.links().next();
                ObjectRecord target = ((ForeignLink) top.record().rawValue(field.name())).peekObject();
                if (target != null && visited.add(target)) {
                    stack.push(new PendingLinks(target, target.schema().linkFields().iterator()));
                }
            } else {
                stack.pop();
                order.add(top.record());
            }
        }
        return order;
    }

    private void checkLinksPersisted(ObjectRecord record) {
        for (ForeignLinkField field : record.schema().linkFields()) {
            ForeignLink link = (ForeignLink) record.rawValue(field.name());
            if (!link.isEmpty() && link.getId() == null) {
                throw new ReferentialIntegrityException(record.modelName(), field.name());
            }
        }
    }

    private void appendWrites(ObjectRecord record, boolean created, WriteBatch.Builder batch) {
        ModelSchema schema = record.schema();
        String storeKey = record.repository().storeKey();
        long id = record.getId();
        Set<String> changed = created ? schema.fieldNames() : record.getUpdatedFields().keySet();

        Map<String, byte[]> fields = new LinkedHashMap<>();
        for (String name : changed) {
            fields.put(name, schema.requireField(name).toStorage(record.storableValue(name)));
        }
        batch.setFields(storeKey, id, fields);

        for (String indexed : schema.indexedFields()) {
            if (!changed.contains(indexed)) {
                continue;
            }
            FieldDescriptor<?> field = schema.requireField(indexed);
            String oldValue = created ? null : field.toIndex(record.storableBaseline(indexed));
            batch.indexUpdate(storeKey, indexed, oldValue, field.toIndex(record.storableValue(indexed)), id);
        }
    }

    void apply(WriteBatch batch) {
        RecordStore store = arena.store();
        RecordRepository.roundTrip("apply a batch of " + batch.size() + " writes", () -> {
            store.apply(batch);
            return null;
        });
    }

    /**
     * Compare a record, and with {@code cascade} its resolved targets, with
     * the store. Nothing is modified: the values to replace are added to
     * {@code plans} and applied by the caller once every read succeeded.
     */
    private Map<String, UpdatedField> planReload(ObjectRecord record, boolean cascade, Set<ObjectRecord> visited,
                                                 List<ReloadPlan> plans) {
        visited.add(record);
        Long id = record.getId();
        if (id == null) {
            throw new KvlinkException("Cannot reload an unsaved record of model '" + record.modelName() + "'");
        }
        RecordRepository repository = record.repository();
        Map<String, byte[]> stored = repository.fetchFields(id);
        if (stored.isEmpty()) {
            throw new KvlinkException(record.modelName() + "#" + id + " no longer exists");
        }
        Map<String, Object> fresh = repository.decode(id, stored);

        Map<String, Object> replacements = new LinkedHashMap<>();
        Map<String, UpdatedField> changes = new LinkedHashMap<>();
        for (FieldDescriptor<?> field : record.schema().fields()) {
            String name = field.name();
            Object current = record.rawValue(name);
            Object freshValue = fresh.get(name);
            if (field instanceof ForeignLinkField linkField) {
                ForeignLink link = (ForeignLink) current;
                Long freshId = freshValue instanceof Long storedId ? storedId : null;
                boolean sameId = freshId == null ? link.isEmpty() : freshId.equals(link.getId());
                if (!sameId) {
                    ForeignLink replacement = repository.linkFor(linkField, freshValue);
                    replacements.put(name, replacement);
                    changes.put(name, new UpdatedField(link, replacement));
                } else if (cascade && link.peekObject() != null && !visited.contains(link.peekObject())) {
                    ObjectRecord target = link.peekObject();
                    ObjectRecord before = target.copy(true);
                    if (!planReload(target, true, visited, plans).isEmpty()) {
                        changes.put(name, new UpdatedField(
                                ForeignLink.ofRecord(before, repository.linkResolver()), link));
                    }
                }
            } else if (!FieldValues.valuesEqual(current, freshValue)) {
                replacements.put(name, freshValue);
                changes.put(name, new UpdatedField(current, freshValue));
            }
        }
        plans.add(new ReloadPlan(record, replacements));
        return changes;
    }

    private boolean sameValues(ObjectRecord left, ObjectRecord right, boolean cascade, Set<RecordPair> visited) {
        if (right == null) {
            return false;
        }
        if (left == right) {
            return true;
        }
        if (!left.modelName().equals(right.modelName())) {
            return false;
        }
        if (!visited.add(new RecordPair(left, right))) {
            return true;
        }
        for (FieldDescriptor<?> field : left.schema().fields()) {
            Object leftValue = left.rawValue(field.name());
            Object rightValue = right.rawValue(field.name());
            if (leftValue instanceof ForeignLink leftLink && rightValue instanceof ForeignLink rightLink) {
                if (!sameLink(leftLink, rightLink, cascade, visited)) {
                    return false;
                }
            } else if (!FieldValues.valuesEqual(leftValue, rightValue)) {
                return false;
            }
        }
        return true;
    }

    private boolean sameLink(ForeignLink left, ForeignLink right, boolean cascade, Set<RecordPair> visited) {
        ObjectRecord leftTarget = left.peekObject();
        ObjectRecord rightTarget = right.peekObject();
        if (cascade && leftTarget != null && rightTarget != null) {
            return sameValues(leftTarget, rightTarget, true, visited);
        }
        if (!left.sameTarget(right)) {
            return false;
        }
        if (!cascade) {
            return true;
        }
        // only one side is attached: it matches the stored target unless it drifted
        ObjectRecord attached = leftTarget != null ? leftTarget : rightTarget;
        return attached == null || !attached.hasUnsavedChanges();
    }

    private static String key(String model, long id) {
        return model + "#" + id;
    }

    private record ReloadPlan(ObjectRecord record, Map<String, Object> replacements) {
    }

    private record PendingLinks(ObjectRecord record, Iterator<ForeignLinkField> links) {
    }

    /**
     * Pair of records compared by identity.
     */
    private record RecordPair(ObjectRecord left, ObjectRecord right) {
        @Override
        public boolean equals(Object o) {
            return o instanceof RecordPair other && other.left == left && other.right == right;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(left) + System.identityHashCode(right);
        }
    }
}
