package io.kvlink.runtime;

import io.kvlink.core.KvlinkArena;
import io.kvlink.core.KvlinkConfiguration;
import io.kvlink.core.KvlinkException;
import io.kvlink.core.StorageRoundTripException;
import io.kvlink.core.ValueConversionException;
import io.kvlink.field.FieldDescriptor;
import io.kvlink.field.ForeignLinkField;
import io.kvlink.field.NullSentinel;
import io.kvlink.schema.ModelSchema;
import io.kvlink.storage.RecordStore;
import io.kvlink.storage.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point for the records of one model: construction, lookup by id and
 * equality queries.
 * <p>
 * Obtained from {@link KvlinkArena#register(ModelSchema)}. Stateless apart
 * from the arena and schema it is bound to.
 */
public final class RecordRepository {
    private static final Logger LOG = LoggerFactory.getLogger(RecordRepository.class);

    private final KvlinkArena arena;
    private final ModelSchema schema;
    private final String storeKey;
    private final CascadeOrchestrator orchestrator;
    private final ForeignLink.LinkResolver linkResolver;

    public RecordRepository(KvlinkArena arena, ModelSchema schema) {
        this.arena = Objects.requireNonNull(arena, "arena");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.storeKey = arena.storeKey(schema.name());
        this.orchestrator = new CascadeOrchestrator(arena);
        this.linkResolver = (targetModel, id) -> arena.repository(targetModel).load(id);
    }

    public ModelSchema schema() {
        return schema;
    }

    public String modelName() {
        return schema.name();
    }

    /**
     * Unsaved record with every field at its default.
     */
    public ObjectRecord create() {
        return create(Map.of());
    }

    /**
     * Unsaved record from field values. Fields not given take their default.
     *
     * @throws io.kvlink.core.SchemaException if a key is not a field of the model
     * @throws ValueConversionException       if a value does not fit its field
     */
    public ObjectRecord create(Map<String, ?> values) {
        return new ObjectRecord(this, null, values);
    }

    public ObjectRecord get(long id) {
        return get(id, configuration().cascadeFetchByDefault());
    }

    /**
     * Load one record.
     *
     * @return the record, or null if it does not exist
     */
    public ObjectRecord get(long id, boolean cascadeFetch) {
        ObjectRecord record = load(id);
        if (record != null && cascadeFetch) {
            orchestrator.fetch(List.of(record));
        }
        return record;
    }

    /**
     * Load several records in the order given, skipping ids that do not exist.
     */
    public List<ObjectRecord> getMultiple(Collection<Long> ids) {
        return getMultiple(ids, configuration().cascadeFetchByDefault());
    }

    public List<ObjectRecord> getMultiple(Collection<Long> ids, boolean cascadeFetch) {
        List<ObjectRecord> records = new ArrayList<>(ids.size());
        for (Long id : ids) {
            ObjectRecord record = load(id);
            if (record != null) {
                records.add(record);
            }
        }
        if (cascadeFetch) {
            orchestrator.fetch(records);
        }
        return records;
    }

    public boolean exists(long id) {
        RecordStore store = store();
        return roundTrip("check " + modelName() + "#" + id, () -> store.exists(storeKey, id));
    }

    public RecordQuery query() {
        return new RecordQuery(this);
    }

    /**
     * Query on one indexed field; chain {@link RecordQuery#filter} for more.
     */
    public RecordQuery filter(String fieldName, Object value) {
        return query().filter(fieldName, value);
    }

    public List<ObjectRecord> all() {
        return query().all();
    }

    public List<ObjectRecord> all(boolean cascadeFetch) {
        return query().all(cascadeFetch);
    }

    public long count() {
        return allIds().size();
    }

    /**
     * Remove a saved record together with its index entries, in one batch.
     * The record keeps its values and becomes unsaved.
     *
     * @return false if the record was never saved
     */
    public boolean delete(ObjectRecord record) {
        if (record.repository() != this) {
            throw new IllegalArgumentException("Record of model '" + record.modelName()
                    + "' does not belong to model '" + modelName() + "'");
        }
        Long id = record.getId();
        if (id == null) {
            return false;
        }
        WriteBatch.Builder batch = WriteBatch.builder().delete(storeKey, id);
        for (String indexed : schema.indexedFields()) {
            FieldDescriptor<?> field = schema.requireField(indexed);
            batch.indexUpdate(storeKey, indexed, field.toIndex(record.storableBaseline(indexed)), null, id);
        }
        orchestrator.apply(batch.build());
        record.assignId(null);
        LOG.debug("Deleted {}#{}", modelName(), id);
        return true;
    }

    /**
     * Remove every record and index entry of the model.
     *
     * @return number of records removed
     */
    public int deleteAll() {
        RecordStore store = store();
        int removed = roundTrip("destroy " + modelName(), () -> store.destroyModel(storeKey));
        LOG.debug("Destroyed {} records of {}", removed, modelName());
        return removed;
    }

    /**
     * One store round trip for one record.
     *
     * @return the record, or null if it does not exist
     * @throws StorageRoundTripException if a stored value cannot be decoded
     */
    ObjectRecord load(long id) {
        Map<String, byte[]> stored = fetchFields(id);
        LOG.debug("Fetched {}#{} ({} fields)", modelName(), id, stored.size());
        if (stored.isEmpty()) {
            return null;
        }
        return new ObjectRecord(this, id, decode(id, stored));
    }

    /**
     * Raw stored mapping of one record, empty if it does not exist.
     *
     * @throws StorageRoundTripException if the store fails
     */
    Map<String, byte[]> fetchFields(long id) {
        RecordStore store = store();
        return roundTrip("read " + modelName() + "#" + id, () -> store.getFields(storeKey, id));
    }

    Set<Long> allIds() {
        RecordStore store = store();
        return roundTrip("list ids of " + modelName(), () -> store.allIds(storeKey));
    }

    Set<Long> indexLookup(String fieldName, String indexKey) {
        RecordStore store = store();
        return roundTrip("look up " + modelName() + "." + fieldName,
                () -> store.indexLookup(storeKey, fieldName, indexKey));
    }

    /**
     * Run one store call, reporting any failure that is not already a kvlink
     * error as {@link StorageRoundTripException}.
     */
    static <T> T roundTrip(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (KvlinkException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageRoundTripException("Store failed to " + action, e);
        }
    }

    /**
     * Typed values of a stored mapping; link fields give ids or
     * {@link NullSentinel}.
     */
    Map<String, Object> decode(long id, Map<String, byte[]> stored) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldDescriptor<?> field : schema.fields()) {
            byte[] raw = stored.get(field.name());
            try {
                values.put(field.name(), field.fromStorage(raw));
            } catch (ValueConversionException e) {
                throw new StorageRoundTripException("Malformed value of field '" + field.name() + "' in "
                        + modelName() + "#" + id, e);
            }
        }
        return values;
    }

    ForeignLink linkFor(ForeignLinkField field, Object storedId) {
        if (NullSentinel.isNull(storedId)) {
            return ForeignLink.empty(field.targetModel(), linkResolver);
        }
        return ForeignLink.ofId(field.targetModel(), (Long) storedId, linkResolver);
    }

    ForeignLink.LinkResolver linkResolver() {
        return linkResolver;
    }

    CascadeOrchestrator orchestrator() {
        return orchestrator;
    }

    KvlinkConfiguration configuration() {
        return arena.configuration();
    }

    RecordStore store() {
        return arena.store();
    }

    String storeKey() {
        return storeKey;
    }

    @Override
    public String toString() {
        return "RecordRepository{model='" + modelName() + "', key='" + storeKey + "'}";
    }
}
