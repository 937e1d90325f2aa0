package io.kvlink.field;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;

/**
 * Value-level equality for field values held by records.
 */
public final class FieldValues {

    private FieldValues() {
    }

    /**
     * Compare two field values.
     * <p>
     * {@link NullSentinel} equals only itself, arrays compare by content and
     * decimals by numeric value.
     */
    public static boolean valuesEqual(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null || NullSentinel.isNull(left) || NullSentinel.isNull(right)) {
            return false;
        }
        if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
            return l.compareTo(r) == 0;
        }
        return Objects.deepEquals(left, right);
    }

    /**
     * Printable form of a value; byte arrays are abbreviated.
     */
    public static String render(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes.length <= 16 ? "b" + Arrays.toString(bytes) : "byte[" + bytes.length + "]";
        }
        if (value instanceof String s) {
            return "'" + s + "'";
        }
        return String.valueOf(value);
    }
}
