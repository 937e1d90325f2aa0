package io.kvlink.runtime;

import io.kvlink.core.SchemaException;
import io.kvlink.core.ValueConversionException;
import io.kvlink.field.FieldDescriptor;
import io.kvlink.field.FieldValues;
import io.kvlink.field.ForeignLinkField;
import io.kvlink.field.NullSentinel;
import io.kvlink.schema.ModelSchema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A typed row of one model.
 * <p>
 * Holds the current value of every declared field and a baseline: the values
 * as last saved or loaded. {@link #getUpdatedFields()} is the difference of
 * the two. Link fields hold a {@link ForeignLink}; nothing on this class
 * resolves a link except {@link #get(String)} and {@link #getRecord(String)}.
 * <p>
 * Not thread-safe. A record belongs to whoever holds it.
 */
public final class ObjectRecord {

    private final RecordRepository repository;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private Map<String, Object> baseline;
    private Long id;

    ObjectRecord(RecordRepository repository, Long id, Map<String, ?> initial) {
        this.repository = repository;
        this.id = id;
        ModelSchema schema = repository.schema();
        for (String name : initial.keySet()) {
            schema.requireField(name);
        }
        for (FieldDescriptor<?> field : schema.fields()) {
            if (initial.containsKey(field.name())) {
                values.put(field.name(), convert(field, initial.get(field.name())));
            } else if (field instanceof ForeignLinkField link) {
                values.put(field.name(), ForeignLink.empty(link.targetModel(), repository.linkResolver()));
            } else {
                values.put(field.name(), field.defaultValue());
            }
        }
        this.baseline = snapshot();
    }

    public String modelName() {
        return repository.schema().name();
    }

    public ModelSchema schema() {
        return repository.schema();
    }

    /**
     * Store-assigned id, null until the first successful save.
     */
    public Long getId() {
        return id;
    }

    /**
     * Current value of a field.
     * <p>
     * Link fields return the linked {@link ObjectRecord}, fetching it on first
     * access, or {@link NullSentinel} when the link is empty.
     *
     * @throws SchemaException if the model has no such field
     */
    public Object get(String fieldName) {
        FieldDescriptor<?> field = schema().requireField(fieldName);
        Object value = values.get(field.name());
        if (value instanceof ForeignLink link) {
            return link.getObject();
        }
        return value;
    }

    /**
     * The linked record of a link field, or null when the link is empty.
     */
    public ObjectRecord getRecord(String fieldName) {
        Object value = get(fieldName);
        return value instanceof ObjectRecord record ? record : null;
    }

    /**
     * Assign a field.
     * <p>
     * Link fields accept an id, an {@link ObjectRecord} of the target model
     * (saved or not), or null / {@link NullSentinel} to clear the link.
     *
     * @return this record
     * @throws ValueConversionException if the value does not fit the field
     */
    public ObjectRecord set(String fieldName, Object value) {
        FieldDescriptor<?> field = schema().requireField(fieldName);
        values.put(field.name(), convert(field, value));
        return this;
    }

    /**
     * The handle of a link field. Never resolves.
     */
    public ForeignLink getLink(String fieldName) {
        FieldDescriptor<?> field = schema().requireField(fieldName);
        if (!(field instanceof ForeignLinkField)) {
            throw new SchemaException("Field '" + fieldName + "' of model '" + modelName() + "' is not a link");
        }
        return (ForeignLink) values.get(field.name());
    }

    public Long getLinkId(String fieldName) {
        return getLink(fieldName).getId();
    }

    /**
     * Fields whose current value differs from the baseline, in declaration
     * order. Links are compared by target id; no link is resolved.
     */
    public Map<String, UpdatedField> getUpdatedFields() {
        Map<String, UpdatedField> updated = new LinkedHashMap<>();
        for (FieldDescriptor<?> field : schema().fields()) {
            Object previous = baseline.get(field.name());
            Object current = values.get(field.name());
            if (!sameValue(previous, current)) {
                updated.put(field.name(), new UpdatedField(previous, current));
            }
        }
        return updated;
    }

    /**
     * Whether a save would write anything for this record itself.
     */
    public boolean hasUnsavedChanges() {
        return id == null || !getUpdatedFields().isEmpty();
    }

    public List<Long> save() {
        return save(repository.configuration().cascadeSaveByDefault());
    }

    /**
     * Persist this record.
     *
     * @param cascadeSave also save every attached linked record that is
     *                    unsaved or modified, recursively
     * @return ids of every record written, this record's first
     * @throws io.kvlink.core.ReferentialIntegrityException if not cascading
     *         and a link points at an unsaved record
     */
    public List<Long> save(boolean cascadeSave) {
        return repository.orchestrator().save(this, cascadeSave);
    }

    public Map<String, UpdatedField> reload() {
        return reload(repository.configuration().reloadCascadeByDefault());
    }

    /**
     * Replace the current values with the stored ones.
     *
     * @param cascadeObjects also reload linked records that are already
     *                       resolved; unresolved links stay unresolved
     * @return fields whose value changed, keyed by field name
     */
    public Map<String, UpdatedField> reload(boolean cascadeObjects) {
        return repository.orchestrator().reload(this, cascadeObjects);
    }

    /**
     * Resolve every link reachable from this record.
     */
    public ObjectRecord cascadeFetch() {
        repository.orchestrator().fetch(List.of(this));
        return this;
    }

    /**
     * Remove the record and its index entries. The record becomes unsaved.
     *
     * @return whether anything was deleted
     */
    public boolean delete() {
        return repository.delete(this);
    }

    public boolean hasSameValues(ObjectRecord other) {
        return hasSameValues(other, true);
    }

    /**
     * Compare field values, ignoring ids.
     *
     * @param cascadeObject compare records attached on both sides by value;
     *                      otherwise links compare by id only
     */
    public boolean hasSameValues(ObjectRecord other, boolean cascadeObject) {
        return repository.orchestrator().sameValues(this, other, cascadeObject);
    }

    public Map<String, Object> asDict(boolean forStorage) {
        return asDict(forStorage, false);
    }

    /**
     * Field values by name.
     *
     * @param forStorage storage bytes instead of typed values
     * @param includeId  add the id under {@link ModelSchema#ID_FIELD}
     * @return a new map; link fields give the target id or
     *         {@link NullSentinel}, never a resolved record
     */
    public Map<String, Object> asDict(boolean forStorage, boolean includeId) {
        Map<String, Object> dict = new LinkedHashMap<>();
        if (includeId) {
            dict.put(ModelSchema.ID_FIELD, id);
        }
        for (FieldDescriptor<?> field : schema().fields()) {
            Object value = storableValue(field.name());
            dict.put(field.name(), forStorage ? field.toStorage(value) : value);
        }
        return dict;
    }

    /**
     * Copy of this record.
     *
     * @param copyId keep the id, so saving the copy overwrites this record;
     *               otherwise the copy is unsaved and saving creates a new one
     */
    public ObjectRecord copy(boolean copyId) {
        ObjectRecord copy = new ObjectRecord(repository, copyId ? id : null, Map.of());
        values.forEach((name, value) -> copy.values.put(name, copyValue(value)));
        if (copyId) {
            copy.baseline = copyMap(baseline);
        } else {
            copy.baseline = copy.snapshot();
        }
        return copy;
    }

    Object rawValue(String fieldName) {
        return values.get(fieldName);
    }

    void putRaw(String fieldName, Object value) {
        values.put(fieldName, value);
    }

    /**
     * Value as handed to the descriptor: the id for links.
     */
    Object storableValue(String fieldName) {
        Object value = values.get(fieldName);
        if (value instanceof ForeignLink link) {
            Long target = link.getId();
            return target == null ? NullSentinel.INSTANCE : target;
        }
        return value;
    }

    Object storableBaseline(String fieldName) {
        Object value = baseline.get(fieldName);
        if (value instanceof ForeignLink link) {
            Long target = link.getId();
            return target == null ? NullSentinel.INSTANCE : target;
        }
        return value;
    }

    void assignId(Long id) {
        this.id = id;
    }

    void markPersisted() {
        this.baseline = snapshot();
    }

    RecordRepository repository() {
        return repository;
    }

    private Object convert(FieldDescriptor<?> field, Object value) {
        if (field instanceof ForeignLinkField link) {
            return toLink(link, value);
        }
        return field.convertValue(value);
    }

    private ForeignLink toLink(ForeignLinkField field, Object value) {
        ForeignLink.LinkResolver resolver = repository.linkResolver();
        if (value == null || NullSentinel.isNull(value)) {
            return ForeignLink.empty(field.targetModel(), resolver);
        }
        if (value instanceof ObjectRecord record) {
            if (!record.modelName().equals(field.targetModel())) {
                throw new ValueConversionException(field.name(), "Expected a record of model '"
                        + field.targetModel() + "', got '" + record.modelName() + "'");
            }
            return ForeignLink.ofRecord(record, resolver);
        }
        if (value instanceof ForeignLink link) {
            if (!link.targetModel().equals(field.targetModel())) {
                throw new ValueConversionException(field.name(), "Expected a link to model '"
                        + field.targetModel() + "', got one to '" + link.targetModel() + "'");
            }
            return link.snapshot();
        }
        Object converted = field.convertValue(value);
        if (NullSentinel.isNull(converted)) {
            return ForeignLink.empty(field.targetModel(), resolver);
        }
        return ForeignLink.ofId(field.targetModel(), (Long) converted, resolver);
    }

    private Map<String, Object> snapshot() {
        return copyMap(values);
    }

    private static Map<String, Object> copyMap(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((name, value) -> copy.put(name, copyValue(value)));
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (value instanceof ForeignLink link) {
            return link.snapshot();
        }
        return value;
    }

    static boolean sameValue(Object left, Object right) {
        if (left instanceof ForeignLink leftLink && right instanceof ForeignLink rightLink) {
            return leftLink.sameTarget(rightLink);
        }
        return FieldValues.valuesEqual(left, right);
    }

    /**
     * Prints ids for links; never resolves.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(modelName()).append('{')
                .append(ModelSchema.ID_FIELD).append('=').append(id == null ? "unsaved" : id);
        values.forEach((name, value) -> sb.append(", ").append(name).append('=').append(FieldValues.render(value)));
        return sb.append('}').toString();
    }
}
