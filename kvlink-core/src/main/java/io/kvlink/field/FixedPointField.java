package io.kvlink.field;

import io.kvlink.core.SchemaException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Decimal field rounded to a fixed number of digits after the point.
 *
 * <p>Every value is scaled to {@link #decimalPlaces()} with half-up rounding
 * before it is stored, so equal numbers always produce the same text and the
 * field can be indexed. Round trips are exact within that precision.
 */
public class FixedPointField extends FieldDescriptor<BigDecimal> {

    public static final int DEFAULT_DECIMAL_PLACES = 5;

    private final int decimalPlaces;

    public FixedPointField(String name) {
        this(name, DEFAULT_DECIMAL_PLACES, false, null);
    }

    public FixedPointField(String name, int decimalPlaces) {
        this(name, decimalPlaces, false, null);
    }

    public FixedPointField(String name, int decimalPlaces, boolean hashIndex, BigDecimal defaultValue) {
        super(name, hashIndex, defaultValue);
        if (decimalPlaces < 0 || decimalPlaces > 18) {
            throw new SchemaException("Field '" + name + "': decimalPlaces must be between 0 and 18, got " + decimalPlaces);
        }
        this.decimalPlaces = decimalPlaces;
    }

    public int decimalPlaces() {
        return decimalPlaces;
    }

    @Override
    public FieldType fieldType() {
        return FieldType.FIXED_POINT;
    }

    @Override
    public Class<BigDecimal> valueType() {
        return BigDecimal.class;
    }

    @Override
    protected BigDecimal fromInput(Object input) {
        BigDecimal value;
        if (input instanceof BigDecimal decimal) {
            value = decimal;
        } else if (input instanceof Double || input instanceof Float) {
            double d = ((Number) input).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw conversionError(input);
            }
            value = BigDecimal.valueOf(d);
        } else if (input instanceof Number n) {
            value = new BigDecimal(n.toString());
        } else if (input instanceof CharSequence text) {
            try {
                value = new BigDecimal(text.toString().trim());
            } catch (NumberFormatException e) {
                throw conversionError(input, e);
            }
        } else {
            throw conversionError(input);
        }
        return value.setScale(decimalPlaces, RoundingMode.HALF_UP);
    }

    @Override
    protected byte[] encode(BigDecimal value) {
        return value.setScale(decimalPlaces, RoundingMode.HALF_UP).toPlainString().getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    protected Object decode(byte[] raw) {
        String text = new String(raw, StandardCharsets.US_ASCII);
        try {
            return new BigDecimal(text).setScale(decimalPlaces, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            throw conversionError(text, e);
        }
    }
}
