package io.kvlink.field;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;

/**
 * Arbitrary {@link Serializable} value stored with Java object serialization.
 *
 * <p>The stream protocol is pinned to version 5, whose header
 * {@code AC ED 00 05} is used to recognise serialized data on retrieval.
 * Stored bytes without that header are returned unchanged. As with
 * {@link CompressedField}, detection is best effort.
 *
 * <p>Never indexable: equal objects do not always serialize to equal bytes.
 * Pass an {@link ObjectInputFilter} when stored data is not fully trusted.
 */
public class SerializedField extends FieldDescriptor<Serializable> {

    private static final byte[] STREAM_HEADER = {(byte) 0xAC, (byte) 0xED, 0x00, 0x05};

    private final ObjectInputFilter inputFilter;

    public SerializedField(String name) {
        this(name, null, null);
    }

    public SerializedField(String name, ObjectInputFilter inputFilter, Serializable defaultValue) {
        super(name, false, defaultValue);
        this.inputFilter = inputFilter;
    }

    @Override
    public FieldType fieldType() {
        return FieldType.OPAQUE;
    }

    @Override
    public Class<Serializable> valueType() {
        return Serializable.class;
    }

    @Override
    protected Serializable fromInput(Object input) {
        if (input instanceof Serializable serializable) {
            return serializable;
        }
        throw conversionError(input);
    }

    @Override
    protected byte[] encode(Serializable value) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (IOException e) {
            throw conversionError(value, e);
        }
        return bytes.toByteArray();
    }

    @Override
    protected Object decode(byte[] raw) {
        if (!looksSerialized(raw)) {
            return raw.clone();
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(raw))) {
            if (inputFilter != null) {
                in.setObjectInputFilter(inputFilter);
            }
            return in.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw conversionError(raw, e);
        }
    }

    static boolean looksSerialized(byte[] raw) {
        if (raw.length <= STREAM_HEADER.length) {
            return false;
        }
        for (int i = 0; i < STREAM_HEADER.length; i++) {
            if (raw[i] != STREAM_HEADER[i]) {
                return false;
            }
        }
        return true;
    }
}
