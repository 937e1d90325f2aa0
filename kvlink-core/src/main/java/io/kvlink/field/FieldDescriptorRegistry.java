package io.kvlink.field;

import io.kvlink.core.SchemaException;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps Java types to the descriptor used for a field of that type when a
 * model is declared from an annotated class.
 * <p>
 * Comes with defaults for the common types; callers may register their own
 * factories or override the defaults. Types without a factory that are
 * {@link Serializable} fall back to {@link SerializedField}.
 */
public final class FieldDescriptorRegistry {

    /**
     * Creates a descriptor for a named field.
     */
    @FunctionalInterface
    public interface DescriptorFactory {
        FieldDescriptor<?> create(String name, boolean hashIndex);
    }

    private final Map<Class<?>, DescriptorFactory> factories = new HashMap<>();

    private FieldDescriptorRegistry() {
    }

    /**
     * Registry pre-populated with the built-in descriptors.
     *
     * @param fixedPointPlaces decimal places used for {@link BigDecimal} fields
     */
    public static FieldDescriptorRegistry withDefaults(int fixedPointPlaces) {
        FieldDescriptorRegistry registry = new FieldDescriptorRegistry();
        registry.registerDefaults(fixedPointPlaces);
        return registry;
    }

    private void registerDefaults(int fixedPointPlaces) {
        // Text and binary
        register(String.class, StringField::new);
        register(byte[].class, (name, hashIndex) -> new BytesField(name));

        // Integral types widen to long
        DescriptorFactory integer = (name, hashIndex) -> new IntegerField(name, hashIndex, null);
        register(long.class, integer);
        register(Long.class, integer);
        register(int.class, integer);
        register(Integer.class, integer);
        register(short.class, integer);
        register(Short.class, integer);
        register(byte.class, integer);
        register(Byte.class, integer);

        DescriptorFactory bool = (name, hashIndex) -> new BooleanField(name, hashIndex, null);
        register(boolean.class, bool);
        register(Boolean.class, bool);

        // Floats are stored but never indexed
        DescriptorFactory floating = (name, hashIndex) -> new FloatField(name);
        register(double.class, floating);
        register(Double.class, floating);
        register(float.class, floating);
        register(Float.class, floating);

        register(BigDecimal.class, (name, hashIndex) -> new FixedPointField(name, fixedPointPlaces, hashIndex, null));
    }

    public void register(Class<?> javaType, DescriptorFactory factory) {
        factories.put(javaType, factory);
    }

    public boolean hasFactory(Class<?> javaType) {
        return factories.containsKey(javaType);
    }

    /**
     * Create the descriptor for a field of the given Java type.
     *
     * @throws SchemaException if the type has no factory and is not serializable
     */
    public FieldDescriptor<?> create(String name, Class<?> javaType, boolean hashIndex) {
        DescriptorFactory factory = factories.get(javaType);
        FieldDescriptor<?> descriptor;
        if (factory != null) {
            descriptor = factory.create(name, hashIndex);
        } else if (Serializable.class.isAssignableFrom(javaType)) {
            descriptor = new SerializedField(name);
        } else {
            throw noDescriptor(name, javaType);
        }
        if (hashIndex && !descriptor.isIndexHashed()) {
            throw new SchemaException("Field '" + name + "' of type " + descriptor.fieldType()
                    + " cannot use a hashed index");
        }
        return descriptor;
    }

    private static SchemaException noDescriptor(String name, Class<?> javaType) {
        return new SchemaException("No field descriptor for type " + javaType.getName() + " (field '" + name + "')");
    }
}
