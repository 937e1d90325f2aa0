package io.kvlink.field;

/**
 * Marker for "no value assigned" on any field that is not string- or
 * byte-typed.
 * <p>
 * There is exactly one instance. It equals only itself, so it never equals
 * an empty string, {@code false} or {@code 0}, which lets callers tell an
 * unset integer apart from a stored zero.
 */
public enum NullSentinel {

    INSTANCE;

    public static boolean isNull(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "NullSentinel";
    }
}
