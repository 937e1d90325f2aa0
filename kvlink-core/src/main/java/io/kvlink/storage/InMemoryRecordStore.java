package io.kvlink.storage;

import io.kvlink.core.StorageRoundTripException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link RecordStore}.
 * <p>
 * Batches are validated in full before the first operation is applied and run
 * under the write lock, so readers never observe half of a batch.
 */
public final class InMemoryRecordStore implements RecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private final ConcurrentMap<String, ModelData> models = new ConcurrentHashMap<>();
    // outlives destroyModel so ids are never handed out twice
    private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Map<String, byte[]> getFields(String model, long id) {
        lock.readLock().lock();
        try {
            ModelData data = models.get(model);
            Map<String, byte[]> row = data == null ? null : data.rows.get(id);
            if (row == null) {
                return Map.of();
            }
            var copy = new LinkedHashMap<String, byte[]>();
            row.forEach((field, value) -> copy.put(field, value.clone()));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<Long> indexLookup(String model, String fieldName, String indexValue) {
        lock.readLock().lock();
        try {
            ModelData data = models.get(model);
            HashIndex index = data == null ? null : data.indexes.get(fieldName);
            return index == null ? Set.of() : index.lookup(indexValue);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long nextId(String model) {
        return counter(model).incrementAndGet();
    }

    @Override
    public Set<Long> allIds(String model) {
        lock.readLock().lock();
        try {
            ModelData data = models.get(model);
            if (data == null) {
                return Set.of();
            }
            return Collections.unmodifiableSet(new TreeSet<>(data.rows.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean exists(String model, long id) {
        lock.readLock().lock();
        try {
            ModelData data = models.get(model);
            return data != null && data.rows.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void apply(WriteBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        for (WriteBatch.Operation operation : batch.operations()) {
            validate(operation);
        }
        lock.writeLock().lock();
        try {
            for (WriteBatch.Operation operation : batch.operations()) {
                applyOne(operation);
            }
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("Applied {} operations", batch.size());
    }

    @Override
    public int destroyModel(String model) {
        lock.writeLock().lock();
        try {
            ModelData removed = models.remove(model);
            int count = removed == null ? 0 : removed.rows.size();
            LOG.debug("Destroyed model {} ({} records)", model, count);
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Raw view used by tests that inspect what reached the store.
     */
    public Map<String, Set<Long>> indexEntries(String model, String fieldName) {
        lock.readLock().lock();
        try {
            ModelData data = models.get(model);
            HashIndex index = data == null ? null : data.indexes.get(fieldName);
            return index == null ? Map.of() : index.entries();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void validate(WriteBatch.Operation operation) {
        if (operation.id() <= 0) {
            throw new StorageRoundTripException("Invalid id " + operation.id() + " for model " + operation.model());
        }
        if (operation instanceof WriteBatch.SetFields set) {
            for (Map.Entry<String, byte[]> entry : set.fields().entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw new StorageRoundTripException("Null field or value in write to "
                            + set.model() + "#" + set.id());
                }
            }
        }
    }

    private void applyOne(WriteBatch.Operation operation) {
        ModelData data = data(operation.model());
        if (operation instanceof WriteBatch.SetFields set) {
            Map<String, byte[]> row = data.rows.computeIfAbsent(set.id(), ignored -> new HashMap<>());
            set.fields().forEach((field, value) -> row.put(field, Arrays.copyOf(value, value.length)));
            counter(set.model()).accumulateAndGet(set.id(), Math::max);
        } else if (operation instanceof WriteBatch.IndexUpdate update) {
            HashIndex index = data.indexes.computeIfAbsent(update.fieldName(), ignored -> new HashIndex());
            index.remove(update.oldValue(), update.id());
            if (update.newValue() != null) {
                index.add(update.newValue(), update.id());
            }
            LOG.trace("Index {}.{} of #{}: {} -> {}", update.model(), update.fieldName(), update.id(),
                    update.oldValue(), update.newValue());
        } else if (operation instanceof WriteBatch.Delete delete) {
            data.rows.remove(delete.id());
        }
    }

    private AtomicLong counter(String model) {
        return counters.computeIfAbsent(model, ignored -> new AtomicLong());
    }

    private ModelData data(String model) {
        return models.computeIfAbsent(model, ignored -> new ModelData());
    }

    private static final class ModelData {
        private final Map<Long, Map<String, byte[]>> rows = new HashMap<>();
        private final Map<String, HashIndex> indexes = new HashMap<>();
    }
}
