package io.kvlink.field;

import io.kvlink.core.SchemaException;

import java.nio.charset.StandardCharsets;

/**
 * Field holding the id of a record in another model.
 * <p>
 * The descriptor converts ids only. Records keep the value of a link field
 * in a lazily resolved handle; resolution is done by the runtime, never here.
 * An empty stored value reads back as {@link NullSentinel}, meaning no link.
 */
public class ForeignLinkField extends FieldDescriptor<Long> {

    private final String targetModel;

    public ForeignLinkField(String name, String targetModel) {
        this(name, targetModel, false);
    }

    /**
     * @param targetModel name of the linked model; may name the declaring model itself
     */
    public ForeignLinkField(String name, String targetModel, boolean hashIndex) {
        super(name, hashIndex, null);
        if (targetModel == null || targetModel.isBlank()) {
            throw new SchemaException("Link field '" + name + "' requires a target model");
        }
        this.targetModel = targetModel;
    }

    public String targetModel() {
        return targetModel;
    }

    @Override
    public FieldType fieldType() {
        return FieldType.REFERENCE;
    }

    @Override
    public Class<Long> valueType() {
        return Long.class;
    }

    @Override
    protected Long fromInput(Object input) {
        if (input instanceof Long id) {
            return id;
        }
        if (input instanceof Integer || input instanceof Short) {
            return ((Number) input).longValue();
        }
        if (input instanceof CharSequence text) {
            try {
                return Long.parseLong(text.toString().trim());
            } catch (NumberFormatException e) {
                throw conversionError(input, e);
            }
        }
        throw conversionError(input);
    }

    @Override
    protected byte[] encode(Long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    protected Object decode(byte[] raw) {
        String text = new String(raw, StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw conversionError(text, e);
        }
    }

    @Override
    public String toString() {
        return "ForeignLinkField{name='" + name() + "', target=" + targetModel + "}";
    }
}
