package io.kvlink.field;

import java.nio.charset.StandardCharsets;

/**
 * Double-precision floating point field.
 * <p>
 * Never indexable: the text form of a float is not guaranteed to match
 * across platforms. Use {@link FixedPointField} for numbers that must be
 * filtered on.
 */
public class FloatField extends FieldDescriptor<Double> {

    public FloatField(String name) {
        this(name, null);
    }

    public FloatField(String name, Double defaultValue) {
        super(name, false, defaultValue);
    }

    @Override
    public FieldType fieldType() {
        return FieldType.FLOAT;
    }

    @Override
    public Class<Double> valueType() {
        return Double.class;
    }

    @Override
    protected Double fromInput(Object input) {
        if (input instanceof Double d) {
            return d;
        }
        if (input instanceof Number n) {
            return n.doubleValue();
        }
        if (input instanceof CharSequence text) {
            try {
                return Double.parseDouble(text.toString().trim());
            } catch (NumberFormatException e) {
                throw conversionError(input, e);
            }
        }
        throw conversionError(input);
    }

    @Override
    protected byte[] encode(Double value) {
        return Double.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    protected Object decode(byte[] raw) {
        String text = new String(raw, StandardCharsets.US_ASCII);
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw conversionError(text, e);
        }
    }
}
