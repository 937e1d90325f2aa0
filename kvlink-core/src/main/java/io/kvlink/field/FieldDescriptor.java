package io.kvlink.field;

import io.kvlink.core.SchemaException;
import io.kvlink.core.ValueConversionException;

import java.nio.charset.StandardCharsets;

/**
 * Schema unit describing how one field of a model is converted to and from
 * the store.
 * <p>
 * Every stored value is a byte array and the zero-length array is the empty
 * representation. Conversions are pure: no descriptor touches the store.
 * <ul>
 *   <li>{@link #toStorage(Object)} and {@link #fromStorage(byte[])} are inverses
 *   for any value of the declared type.</li>
 *   <li>{@link #fromStorage(byte[])} on the empty representation yields
 *   {@link #emptyValue()}: the empty string or array for string and byte types,
 *   {@link NullSentinel} for every other type.</li>
 *   <li>{@link #toIndex(Object)} is the storage form, or its MD5 hex digest when
 *   the index is hashed.</li>
 * </ul>
 * Descriptors are identified by {@link #name()}; two descriptors of a model
 * never share a name.
 *
 * @param <T> the Java type of a present value
 */
public abstract class FieldDescriptor<T> {

    protected static final byte[] EMPTY = new byte[0];

    private final String name;
    private final boolean hashIndex;
    private final Object defaultValue;

    /**
     * @param name         field name, empty for a stage inside a {@link FieldChain}
     * @param hashIndex    index by the MD5 digest of the storage form
     * @param defaultValue value given to records that do not provide one;
     *                     {@code null} means {@link #emptyValue()}
     */
    protected FieldDescriptor(String name, boolean hashIndex, Object defaultValue) {
        this.name = name == null ? "" : name;
        this.hashIndex = hashIndex;
        this.defaultValue = defaultValue;
    }

    public final String name() {
        return name;
    }

    public abstract FieldType fieldType();

    public abstract Class<T> valueType();

    /**
     * Whether this field may carry a secondary index.
     */
    public boolean canIndex() {
        return fieldType().isIndexable();
    }

    /**
     * Whether index entries are keyed by the digest of the storage form.
     */
    public boolean isIndexHashed() {
        return hashIndex;
    }

    /**
     * Value an empty stored representation reads back as.
     */
    public Object emptyValue() {
        return NullSentinel.INSTANCE;
    }

    /**
     * Value assigned to a record field that was not given one at construction.
     */
    public final Object defaultValue() {
        return defaultValue == null ? emptyValue() : convertValue(defaultValue);
    }

    /**
     * Check the declaration for options the type cannot honour.
     *
     * @throws SchemaException if hashing is requested on a non-indexable type
     */
    public void validate() {
        if (hashIndex && !canIndex()) {
            throw new SchemaException("Field '" + name + "' of type " + fieldType()
                    + " cannot be indexed, so it cannot use a hashed index");
        }
    }

    /**
     * Normalize caller input into the value held by a record.
     * <p>
     * {@code null} and {@link NullSentinel} become {@link #emptyValue()}.
     *
     * @throws ValueConversionException if the input cannot represent this type
     */
    public final Object convertValue(Object input) {
        if (input == null || NullSentinel.isNull(input)) {
            return emptyValue();
        }
        return fromInput(input);
    }

    /**
     * Encode a value for the store.
     * <p>
     * Accepts anything {@link #convertValue(Object)} accepts. Null-equivalent
     * values encode as the empty representation, and so do empty strings and
     * arrays of types whose empty value is natural; other types encode them
     * like any other value.
     */
    public final byte[] toStorage(Object value) {
        Object converted = convertValue(value);
        if (NullSentinel.isNull(converted) || isEmptyValue(converted)) {
            return EMPTY;
        }
        return encode(valueType().cast(converted));
    }

    /**
     * Decode a stored value.
     *
     * @param raw stored bytes, {@code null} treated as empty
     * @return a value of {@link #valueType()}, {@link #emptyValue()} for empty
     *         input, or for sniffing descriptors the raw bytes unchanged
     */
    public final Object fromStorage(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return emptyValue();
        }
        return decode(raw);
    }

    /**
     * Index key for a value. Non-hashed keys carry the storage bytes one char
     * per byte.
     *
     * @throws SchemaException if the field cannot be indexed
     */
    public final String toIndex(Object value) {
        if (!canIndex()) {
            throw new SchemaException("Field '" + name + "' of type " + fieldType() + " cannot be indexed");
        }
        byte[] stored = toStorage(value);
        if (isIndexHashed()) {
            return IndexHashing.md5Hex(stored);
        }
        return new String(stored, StandardCharsets.ISO_8859_1);
    }

    /**
     * Convert non-null, non-sentinel input to the value type.
     */
    protected abstract T fromInput(Object input);

    protected abstract byte[] encode(T value);

    /**
     * Decode a non-empty stored value.
     */
    protected abstract Object decode(byte[] raw);

    protected ValueConversionException conversionError(Object input) {
        return new ValueConversionException(name, "Cannot convert " + describe(input) + " to " + fieldType());
    }

    protected ValueConversionException conversionError(Object input, Throwable cause) {
        return new ValueConversionException(name, "Cannot convert " + describe(input) + " to " + fieldType(), cause);
    }

    private boolean isEmptyValue(Object converted) {
        if (!fieldType().hasNaturalEmpty()) {
            return false;
        }
        if (converted instanceof byte[] bytes) {
            return bytes.length == 0;
        }
        return converted instanceof String s && s.isEmpty();
    }

    private static String describe(Object input) {
        if (input instanceof byte[] bytes) {
            return "byte[" + bytes.length + "]";
        }
        return input.getClass().getSimpleName() + " '" + input + "'";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', type=" + fieldType()
                + (hashIndex ? ", hashIndex" : "") + "}";
    }
}
