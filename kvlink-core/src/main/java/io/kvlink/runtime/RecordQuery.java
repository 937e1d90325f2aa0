package io.kvlink.runtime;

import io.kvlink.core.SchemaException;
import io.kvlink.core.ValueConversionException;
import io.kvlink.field.FieldDescriptor;
import io.kvlink.field.ForeignLinkField;
import io.kvlink.schema.ModelSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Equality filters over indexed fields, combined with AND.
 * <p>
 * Immutable: {@link #filter(String, Object)} returns a new query. Values are
 * turned into index keys when the filter is added, so conversion errors
 * surface there rather than at execution. A query without filters matches
 * every record of the model.
 */
public final class RecordQuery {

    private final RecordRepository repository;
    private final List<Condition> conditions;

    RecordQuery(RecordRepository repository) {
        this(repository, List.of());
    }

    private RecordQuery(RecordRepository repository, List<Condition> conditions) {
        this.repository = repository;
        this.conditions = conditions;
    }

    /**
     * Add an equality condition.
     * <p>
     * Link fields take an id, a saved {@link ObjectRecord} or a
     * {@link ForeignLink}. Hash-indexed fields take the value or an
     * {@link IndexDigest} of its storage form.
     *
     * @throws SchemaException          if the field is unknown or not indexed
     * @throws ValueConversionException if the value does not fit the field
     */
    public RecordQuery filter(String fieldName, Object value) {
        ModelSchema schema = repository.schema();
        FieldDescriptor<?> field = schema.requireField(fieldName);
        if (!schema.isIndexed(fieldName)) {
            throw new SchemaException("Field '" + fieldName + "' of model '" + schema.name()
                    + "' is not indexed and cannot be filtered on");
        }
        List<Condition> next = new ArrayList<>(conditions);
        next.add(new Condition(fieldName, indexKey(field, value)));
        return new RecordQuery(repository, List.copyOf(next));
    }

    /**
     * Matching ids in ascending order.
     */
    public Set<Long> getIds() {
        if (conditions.isEmpty()) {
            return repository.allIds();
        }
        Set<Long> matches = null;
        for (Condition condition : conditions) {
            Set<Long> ids = repository.indexLookup(condition.fieldName(), condition.indexKey());
            if (matches == null) {
                matches = new TreeSet<>(ids);
            } else {
                matches.retainAll(ids);
            }
            if (matches.isEmpty()) {
                break;
            }
        }
        return Collections.unmodifiableSet(matches);
    }

    public List<ObjectRecord> all() {
        return all(repository.configuration().cascadeFetchByDefault());
    }

    /**
     * Load every match.
     *
     * @param cascadeFetch resolve every link reachable from the results
     */
    public List<ObjectRecord> all(boolean cascadeFetch) {
        return repository.getMultiple(getIds(), cascadeFetch);
    }

    /**
     * Match with the lowest id, or null.
     */
    public ObjectRecord first() {
        for (Long id : new TreeSet<>(getIds())) {
            ObjectRecord record = repository.get(id, false);
            if (record != null) {
                return record;
            }
        }
        return null;
    }

    public int count() {
        return getIds().size();
    }

    /**
     * Delete every match.
     *
     * @return number of records deleted
     */
    public int delete() {
        int deleted = 0;
        for (ObjectRecord record : all(false)) {
            if (record.delete()) {
                deleted++;
            }
        }
        return deleted;
    }

    private static String indexKey(FieldDescriptor<?> field, Object value) {
        if (value instanceof IndexDigest digest) {
            if (!field.isIndexHashed()) {
                throw new SchemaException("Field '" + field.name() + "' is not hash-indexed; filter on the value");
            }
            return digest.hex();
        }
        if (field instanceof ForeignLinkField link) {
            return field.toIndex(linkId(link, value));
        }
        return field.toIndex(value);
    }

    private static Object linkId(ForeignLinkField field, Object value) {
        if (value instanceof ObjectRecord record) {
            if (!record.modelName().equals(field.targetModel())) {
                throw new ValueConversionException(field.name(), "Expected a record of model '"
                        + field.targetModel() + "', got '" + record.modelName() + "'");
            }
            if (record.getId() == null) {
                throw new ValueConversionException(field.name(), "Cannot filter on an unsaved record");
            }
            return record.getId();
        }
        if (value instanceof ForeignLink link) {
            if (!link.targetModel().equals(field.targetModel())) {
                throw new ValueConversionException(field.name(), "Expected a link to model '"
                        + field.targetModel() + "', got one to '" + link.targetModel() + "'");
            }
            if (!link.isEmpty() && link.getId() == null) {
                throw new ValueConversionException(field.name(), "Cannot filter on a link to an unsaved record");
            }
            return link.isEmpty() ? null : link.getId();
        }
        return value;
    }

    @Override
    public String toString() {
        return "RecordQuery{model='" + repository.modelName() + "', conditions=" + conditions + "}";
    }

    private record Condition(String fieldName, String indexKey) {
    }
}
