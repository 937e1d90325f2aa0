package io.kvlink.storage;

import java.util.Map;
import java.util.Set;

/**
 * Backing key-value store.
 * <p>
 * Records are addressed by model key and numeric id and hold a mapping of
 * field name to stored bytes. Secondary indexes map (field, index value) to
 * the set of ids carrying that value.
 * <p>
 * Implementations are the sole arbiter of consistency: {@link #apply(WriteBatch)}
 * must apply every operation of the batch or none of them. Any failure to
 * reach the store or to interpret its answer is reported as
 * {@link io.kvlink.core.StorageRoundTripException}.
 */
public interface RecordStore {

    /**
     * Stored fields of a record.
     *
     * @return the fields, empty if the record does not exist
     */
    Map<String, byte[]> getFields(String model, long id);

    /**
     * Merge fields into a record, creating it if needed.
     */
    default void setFields(String model, long id, Map<String, byte[]> fields) {
        apply(WriteBatch.builder().setFields(model, id, fields).build());
    }

    /**
     * Ids carrying the given value in a field's index.
     */
    Set<Long> indexLookup(String model, String fieldName, String indexValue);

    /**
     * Move an id from one index value to another. A null old value only adds,
     * a null new value only removes.
     */
    default void indexUpdate(String model, String fieldName, String oldValue, String newValue, long id) {
        apply(WriteBatch.builder().indexUpdate(model, fieldName, oldValue, newValue, id).build());
    }

    /**
     * Allocate the next id of a model. Ids are positive and never reused.
     */
    long nextId(String model);

    /**
     * Remove a record's fields. Index entries are removed separately.
     */
    default void delete(String model, long id) {
        apply(WriteBatch.builder().delete(model, id).build());
    }

    /**
     * Ids of every stored record of a model.
     */
    Set<Long> allIds(String model);

    boolean exists(String model, long id);

    /**
     * Apply every operation of the batch atomically.
     */
    void apply(WriteBatch batch);

    /**
     * Remove every record and index entry of a model.
     *
     * @return number of records removed
     */
    int destroyModel(String model);
}
