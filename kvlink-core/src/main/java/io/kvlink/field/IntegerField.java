package io.kvlink.field;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Signed 64-bit integer stored as decimal text.
 */
public class IntegerField extends FieldDescriptor<Long> {

    public IntegerField(String name) {
        this(name, false, null);
    }

    public IntegerField(String name, boolean hashIndex, Long defaultValue) {
        super(name, hashIndex, defaultValue);
    }

    @Override
    public FieldType fieldType() {
        return FieldType.INTEGER;
    }

    @Override
    public Class<Long> valueType() {
        return Long.class;
    }

    @Override
    protected Long fromInput(Object input) {
        if (input instanceof Long l) {
            return l;
        }
        if (input instanceof Integer || input instanceof Short || input instanceof Byte) {
            return ((Number) input).longValue();
        }
        try {
            if (input instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (input instanceof BigDecimal decimal) {
                return decimal.longValueExact();
            }
            if (input instanceof Double || input instanceof Float) {
                return new BigDecimal(input.toString()).longValueExact();
            }
            if (input instanceof CharSequence text) {
                return Long.parseLong(text.toString().trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw conversionError(input, e);
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
}
