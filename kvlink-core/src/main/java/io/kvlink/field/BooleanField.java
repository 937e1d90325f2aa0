package io.kvlink.field;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Boolean field.
 *
 * <p>Stored as {@code "true"} or {@code "false"}. When parsing, {@code "true"}
 * and {@code "1"} mean true and {@code "false"} and {@code "0"} mean false,
 * ignoring case. Anything else is rejected instead of defaulting.
 */
public class BooleanField extends FieldDescriptor<Boolean> {

    private static final byte[] TRUE = "true".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FALSE = "false".getBytes(StandardCharsets.US_ASCII);

    public BooleanField(String name) {
        this(name, false, null);
    }

    public BooleanField(String name, boolean hashIndex, Boolean defaultValue) {
        super(name, hashIndex, defaultValue);
    }

    @Override
    public FieldType fieldType() {
        return FieldType.BOOLEAN;
    }

    @Override
    public Class<Boolean> valueType() {
        return Boolean.class;
    }

    @Override
    protected Boolean fromInput(Object input) {
        if (input instanceof Boolean b) {
            return b;
        }
        if (input instanceof Number n) {
            long value = n.longValue();
            if (value == 1L && n.doubleValue() == 1d) {
                return Boolean.TRUE;
            }
            if (value == 0L && n.doubleValue() == 0d) {
                return Boolean.FALSE;
            }
            throw conversionError(input);
        }
        if (input instanceof CharSequence text) {
            return parse(text.toString());
        }
        throw conversionError(input);
    }

    @Override
    protected byte[] encode(Boolean value) {
        return value ? TRUE.clone() : FALSE.clone();
    }

    @Override
    protected Object decode(byte[] raw) {
        return parse(new String(raw, StandardCharsets.US_ASCII));
    }

    private Boolean parse(String text) {
        String lowered = text.toLowerCase(Locale.ROOT);
        return switch (lowered) {
            case "true", "1" -> Boolean.TRUE;
            case "false", "0" -> Boolean.FALSE;
            default -> throw conversionError(text);
        };
    }
}
