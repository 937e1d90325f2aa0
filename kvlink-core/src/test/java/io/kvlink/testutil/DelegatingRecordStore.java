package io.kvlink.testutil;

import io.kvlink.storage.InMemoryRecordStore;
import io.kvlink.storage.RecordStore;
import io.kvlink.storage.WriteBatch;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory store that counts round trips; override a method to inject failures.
 */
public class DelegatingRecordStore implements RecordStore {

    protected final InMemoryRecordStore delegate = new InMemoryRecordStore();
    private final AtomicInteger getFieldsCalls = new AtomicInteger();
    private final AtomicInteger applyCalls = new AtomicInteger();

    public int getFieldsCalls() {
        return getFieldsCalls.get();
    }

    public int applyCalls() {
        return applyCalls.get();
    }

    public void resetCounters() {
        getFieldsCalls.set(0);
        applyCalls.set(0);
    }

    public InMemoryRecordStore delegate() {
        return delegate;
    }

    @Override
    public Map<String, byte[]> getFields(String model, long id) {
        getFieldsCalls.incrementAndGet();
        return delegate.getFields(model, id);
    }

    @Override
    public Set<Long> indexLookup(String model, String fieldName, String indexValue) {
        return delegate.indexLookup(model, fieldName, indexValue);
    }

    @Override
    public long nextId(String model) {
        return delegate.nextId(model);
    }

    @Override
    public Set<Long> allIds(String model) {
        return delegate.allIds(model);
    }

    @Override
    public boolean exists(String model, long id) {
        return delegate.exists(model, id);
    }

    @Override
    public void apply(WriteBatch batch) {
        applyCalls.incrementAndGet();
        delegate.apply(batch);
    }

    @Override
    public int destroyModel(String model) {
        return delegate.destroyModel(model);
    }
}
