package io.kvlink.field;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Binary field stored as standard Base64 text, which keeps it indexable.
 */
public class Base64Field extends FieldDescriptor<byte[]> {

    public Base64Field(String name) {
        this(name, false, null);
    }

    public Base64Field(String name, boolean hashIndex, byte[] defaultValue) {
        super(name, hashIndex, defaultValue);
    }

    @Override
    public FieldType fieldType() {
        return FieldType.RAW_BYTES;
    }

    @Override
    public Class<byte[]> valueType() {
        return byte[].class;
    }

    @Override
    public Object emptyValue() {
        return new byte[0];
    }

    @Override
    protected byte[] fromInput(Object input) {
        if (input instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (input instanceof CharSequence text) {
            return text.toString().getBytes(StandardCharsets.UTF_8);
        }
        throw conversionError(input);
    }

    @Override
    protected byte[] encode(byte[] value) {
        return Base64.getEncoder().encode(value);
    }

    @Override
    protected Object decode(byte[] raw) {
        try {
            return Base64.getDecoder().decode(raw);
        } catch (IllegalArgumentException e) {
            throw conversionError(raw, e);
        }
    }
}
