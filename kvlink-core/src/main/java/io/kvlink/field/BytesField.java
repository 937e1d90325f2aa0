package io.kvlink.field;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Binary field stored as-is.
 * <p>
 * Text input is encoded with the field's charset. Byte fields are not
 * indexable.
 */
public class BytesField extends FieldDescriptor<byte[]> {

    private final Charset inputCharset;

    public BytesField(String name) {
        this(name, StandardCharsets.UTF_8, null);
    }

    public BytesField(String name, Charset inputCharset, byte[] defaultValue) {
        super(name, false, defaultValue);
        this.inputCharset = Objects.requireNonNull(inputCharset, "inputCharset");
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
    public boolean canIndex() {
        return false;
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
            return text.toString().getBytes(inputCharset);
        }
        throw conversionError(input);
    }

    @Override
    protected byte[] encode(byte[] value) {
        return value.clone();
    }

    @Override
    protected Object decode(byte[] raw) {
        return raw.clone();
    }
}
