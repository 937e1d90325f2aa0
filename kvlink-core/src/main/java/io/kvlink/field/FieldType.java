package io.kvlink.field;

/**
 * Declared type tag of a field.
 * <p>
 * The tag decides whether the field may be indexed at all and what an empty
 * stored value reads back as.
 */
public enum FieldType {
    /** Binary payload; reads back as an empty array when empty. */
    RAW_BYTES(true),
    /** Text; reads back as the empty string when empty. */
    STRING(true),
    INTEGER(true),
    BOOLEAN(true),
    /** Rounding differs across platforms, so floats are never indexable. */
    FLOAT(false),
    /** Decimal formatted to a fixed number of digits, safe to index. */
    FIXED_POINT(true),
    /** Serialized object graph; the byte form is not stable enough to index. */
    OPAQUE(false),
    /** Id of a record in another model. */
    REFERENCE(true);

    private final boolean indexable;

    FieldType(boolean indexable) {
        this.indexable = indexable;
    }

    public boolean isIndexable() {
        return indexable;
    }

    /**
     * Whether an empty stored value means "empty" rather than "unset".
     */
    public boolean hasNaturalEmpty() {
        return this == RAW_BYTES || this == STRING;
    }
}
