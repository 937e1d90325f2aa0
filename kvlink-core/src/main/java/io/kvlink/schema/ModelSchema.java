package io.kvlink.schema;

import io.kvlink.core.SchemaException;
import io.kvlink.field.FieldDescriptor;
import io.kvlink.field.ForeignLinkField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declaration of a model: its name, the ordered field descriptors and the
 * fields that carry an equality index.
 * <p>
 * Immutable once built. Field names are plain strings joined to their
 * descriptors through this schema.
 */
public final class ModelSchema {

    /** Name reserved for the store-assigned record id. */
    public static final String ID_FIELD = "_id";

    private final String name;
    private final List<FieldDescriptor<?>> fields;
    private final Map<String, FieldDescriptor<?>> fieldsByName;
    private final Set<String> indexedFields;
    private final List<ForeignLinkField> linkFields;

    private ModelSchema(String name, List<FieldDescriptor<?>> fields, Set<String> indexedFields) {
        this.name = name;
        this.fields = List.copyOf(fields);
        var byName = new LinkedHashMap<String, FieldDescriptor<?>>();
        var links = new ArrayList<ForeignLinkField>();
        for (FieldDescriptor<?> field : this.fields) {
            byName.put(field.name(), field);
            if (field instanceof ForeignLinkField link) {
                links.add(link);
            }
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
        this.indexedFields = Collections.unmodifiableSet(new LinkedHashSet<>(indexedFields));
        this.linkFields = List.copyOf(links);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<FieldDescriptor<?>> fields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fieldsByName.keySet();
    }

    /**
     * @return the descriptor, or null if the model has no such field
     */
    public FieldDescriptor<?> field(String fieldName) {
        return fieldsByName.get(fieldName);
    }

    /**
     * @throws SchemaException if the model has no such field
     */
    public FieldDescriptor<?> requireField(String fieldName) {
        FieldDescriptor<?> field = fieldsByName.get(fieldName);
        if (field == null) {
            throw new SchemaException("Model '" + name + "' has no field '" + fieldName + "'");
        }
        return field;
    }

    public boolean hasField(String fieldName) {
        return fieldsByName.containsKey(fieldName);
    }

    public boolean isIndexed(String fieldName) {
        return indexedFields.contains(fieldName);
    }

    public Set<String> indexedFields() {
        return indexedFields;
    }

    public List<ForeignLinkField> linkFields() {
        return linkFields;
    }

    @Override
    public String toString() {
        return "ModelSchema{name='" + name + "', fields=" + fieldsByName.keySet() + ", indexed=" + indexedFields + "}";
    }

    /**
     * Builder for ModelSchema. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private final String name;
        private final List<FieldDescriptor<?>> fields = new ArrayList<>();
        private final Set<String> indexedFields = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder field(FieldDescriptor<?> field) {
            fields.add(field);
            return this;
        }

        /**
         * Add a field and index it.
         */
        public Builder indexedField(FieldDescriptor<?> field) {
            fields.add(field);
            indexedFields.add(field.name());
            return this;
        }

        public Builder index(String... fieldNames) {
            Collections.addAll(indexedFields, fieldNames);
            return this;
        }

        /**
         * @throws SchemaException on a blank or reserved name, a duplicate field,
         *                         an index on an unknown or non-indexable field, or
         *                         an option a descriptor cannot honour
         */
        public ModelSchema build() {
            if (name == null || name.isBlank()) {
                throw new SchemaException("Model name required");
            }
            var seen = new LinkedHashSet<String>();
            for (FieldDescriptor<?> field : fields) {
                if (field.name().isBlank()) {
                    throw new SchemaException("Model '" + name + "' declares a field without a name");
                }
                if (ID_FIELD.equals(field.name())) {
                    throw new SchemaException("Model '" + name + "': field name '" + ID_FIELD + "' is reserved");
                }
                if (!seen.add(field.name())) {
                    throw new SchemaException("Model '" + name + "' declares field '" + field.name() + "' twice");
                }
                field.validate();
            }
            for (String indexed : indexedFields) {
                FieldDescriptor<?> field = fields.stream()
                        .filter(candidate -> candidate.name().equals(indexed))
                        .findFirst()
                        .orElseThrow(() -> new SchemaException(
                                "Model '" + name + "' indexes unknown field '" + indexed + "'"));
                if (!field.canIndex()) {
                    throw new SchemaException("Model '" + name + "': field '" + indexed + "' of type "
                            + field.fieldType() + " cannot be indexed");
                }
            }
            return new ModelSchema(name, fields, indexedFields);
        }
    }
}
