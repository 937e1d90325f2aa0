package io.kvlink.field;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Text field encoded with a fixed charset (UTF-8 unless stated otherwise).
 * <p>
 * Strings have no null: an empty stored value reads back as {@code ""}.
 */
public class StringField extends FieldDescriptor<String> {

    private final Charset charset;

    public StringField(String name) {
        this(name, StandardCharsets.UTF_8, false, null);
    }

    public StringField(String name, boolean hashIndex) {
        this(name, StandardCharsets.UTF_8, hashIndex, null);
    }

    public StringField(String name, Charset charset, boolean hashIndex, String defaultValue) {
        super(name, hashIndex, defaultValue);
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    public Charset charset() {
        return charset;
    }

    @Override
    public FieldType fieldType() {
        return FieldType.STRING;
    }

    @Override
    public Class<String> valueType() {
        return String.class;
    }

    @Override
    public Object emptyValue() {
        return "";
    }

    @Override
    protected String fromInput(Object input) {
        if (input instanceof String s) {
            return s;
        }
        if (input instanceof byte[] bytes) {
            return new String(bytes, charset);
        }
        if (input instanceof CharSequence || input instanceof Character
                || input instanceof Number || input instanceof Boolean) {
            return input.toString();
        }
        throw conversionError(input);
    }

    @Override
    protected byte[] encode(String value) {
        return value.getBytes(charset);
    }

    @Override
    protected Object decode(byte[] raw) {
        return new String(raw, charset);
    }
}
