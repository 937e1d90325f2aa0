package io.kvlink.field;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Binary field compressed on the way to the store.
 *
 * <p>Storage: empty input stays empty; input that already starts with the
 * mode's header is stored unchanged, anything else is compressed at maximum
 * level. Retrieval: input carrying the header is decompressed, anything else
 * is returned unchanged.
 *
 * <p>Header detection is best effort. A raw, uncompressed value that happens
 * to begin with the header bytes is taken for compressed data: it is stored
 * without compression and decompressing it on load fails.
 *
 * <p>The field is always indexable through a hashed index, since compressed
 * bytes are too long and too opaque to use as keys directly.
 */
public class CompressedField extends FieldDescriptor<byte[]> {

    private final CompressionMode mode;

    public CompressedField(String name) {
        this(name, CompressionMode.DEFLATE, null);
    }

    public CompressedField(String name, CompressionMode mode) {
        this(name, mode, null);
    }

    /**
     * @param compressMode mode name or alias, for example {@code "zlib"} or {@code "bz2"}
     * @throws io.kvlink.core.SchemaException if the name is unknown
     */
    public CompressedField(String name, String compressMode) {
        this(name, CompressionMode.forName(compressMode), null);
    }

    public CompressedField(String name, CompressionMode mode, Object defaultValue) {
        super(name, true, defaultValue);
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public CompressionMode mode() {
        return mode;
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
    public boolean isIndexHashed() {
        return true;
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
            return text.toString().getBytes(StandardCharsets.UTF_8);
        }
        throw conversionError(input);
    }

    @Override
    protected byte[] encode(byte[] value) {
        if (mode.hasHeader(value)) {
            return value.clone();
        }
        try {
            return mode.compress(value);
        } catch (IOException e) {
            throw conversionError(value, e);
        }
    }

    @Override
    protected Object decode(byte[] raw) {
        if (!mode.hasHeader(raw)) {
            return raw.clone();
        }
        try {
            return mode.decompress(raw);
        } catch (IOException e) {
            throw conversionError(raw, e);
        }
    }

    @Override
    public String toString() {
        return "CompressedField{name='" + name() + "', mode=" + mode + "}";
    }
}
