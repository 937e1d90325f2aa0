package io.kvlink.field;

import io.kvlink.core.SchemaException;

import java.util.List;

/**
 * Ordered composition of descriptors under one field name.
 *
 * <p>Stages run in declared order when storing and in reverse when loading.
 * A chain of {@code [StringField, CompressedField]} encodes text, then
 * compresses it; on load it decompresses, then decodes. The first stage
 * decides the value type; every later stage must be byte-typed so that it can
 * take the previous stage's output as its input. A {@link NullSentinel}
 * produced by any stage on load ends the chain.
 *
 * <p>The chain is indexable only if every stage is, and its index is hashed
 * if any stage hashes.
 */
public class FieldChain extends FieldDescriptor<Object> {

    private final List<FieldDescriptor<?>> stages;

    public FieldChain(String name, List<? extends FieldDescriptor<?>> stages) {
        this(name, stages, false, null);
    }

    public FieldChain(String name, List<? extends FieldDescriptor<?>> stages, boolean hashIndex, Object defaultValue) {
        super(name, hashIndex, defaultValue);
        if (stages == null || stages.isEmpty()) {
            throw new SchemaException("Field chain '" + name + "' needs at least one stage");
        }
        this.stages = List.copyOf(stages);
        for (int i = 0; i < this.stages.size(); i++) {
            FieldDescriptor<?> stage = this.stages.get(i);
            if (stage instanceof ForeignLinkField) {
                throw new SchemaException("Field chain '" + name + "' cannot contain a link field");
            }
            if (i > 0 && stage.valueType() != byte[].class) {
                throw new SchemaException("Field chain '" + name + "': stage " + i + " (" + stage
                        + ") must be byte-typed to follow another stage");
            }
        }
    }

    public List<FieldDescriptor<?>> stages() {
        return stages;
    }

    @Override
    public FieldType fieldType() {
        return stages.get(0).fieldType();
    }

    @Override
    @SuppressWarnings("unchecked")
    public Class<Object> valueType() {
        return (Class<Object>) stages.get(0).valueType();
    }

    @Override
    public boolean canIndex() {
        for (FieldDescriptor<?> stage : stages) {
            if (!stage.canIndex()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isIndexHashed() {
        if (super.isIndexHashed()) {
            return true;
        }
        for (FieldDescriptor<?> stage : stages) {
            if (stage.isIndexHashed()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Object emptyValue() {
        return stages.get(0).emptyValue();
    }

    @Override
    public void validate() {
        super.validate();
        for (FieldDescriptor<?> stage : stages) {
            stage.validate();
        }
    }

    @Override
    protected Object fromInput(Object input) {
        return stages.get(0).convertValue(input);
    }

    @Override
    protected byte[] encode(Object value) {
        byte[] bytes = stages.get(0).toStorage(value);
        for (int i = 1; i < stages.size() && bytes.length > 0; i++) {
            bytes = stages.get(i).toStorage(bytes);
        }
        return bytes;
    }

    @Override
    protected Object decode(byte[] raw) {
        byte[] bytes = raw;
        for (int i = stages.size() - 1; i > 0; i--) {
            Object value = stages.get(i).fromStorage(bytes);
            if (NullSentinel.isNull(value)) {
                return NullSentinel.INSTANCE;
            }
            if (!(value instanceof byte[] next)) {
                return value;
            }
            bytes = next;
        }
        return stages.get(0).fromStorage(bytes);
    }

    @Override
    public String toString() {
        return "FieldChain{name='" + name() + "', stages=" + stages + "}";
    }
}
