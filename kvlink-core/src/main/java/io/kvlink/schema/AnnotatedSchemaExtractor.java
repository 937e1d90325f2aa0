package io.kvlink.schema;

import io.kvlink.core.KvlinkConfiguration;
import io.kvlink.core.SchemaException;
import io.kvlink.field.CompressedField;
import io.kvlink.field.CompressionMode;
import io.kvlink.field.FieldChain;
import io.kvlink.field.FieldDescriptor;
import io.kvlink.field.FieldDescriptorRegistry;
import io.kvlink.field.FixedPointField;
import io.kvlink.field.ForeignLinkField;
import io.kvlink.field.SerializedField;
import io.kvlink.field.StringField;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link ModelSchema} from a class annotated with jakarta.persistence
 * annotations.
 * <p>
 * The class is only a declaration: records stay dynamic and are never bound
 * to instances of it. All reflection happens once, when the model is
 * registered.
 *
 * <p>Mapping rules:
 * <ul>
 *   <li>Model name: {@code @Table(name)}, then {@code @Entity(name)}, then the simple class name.</li>
 *   <li>Skipped: static and {@code transient} fields, {@code @Transient}, and the
 *   {@code @Id} field (ids are assigned by the store).</li>
 *   <li>{@code @Column(name)} renames a field.</li>
 *   <li>{@code @ManyToOne} / {@code @OneToOne} become link fields to the target's model.</li>
 *   <li>{@code @Compressed} or {@code @Lob} on {@code byte[]} / {@code String} become compressed fields.</li>
 *   <li>{@code @FixedPoint} and {@code @Serialized} pick those descriptors explicitly.</li>
 *   <li>Everything else goes through the {@link FieldDescriptorRegistry}.</li>
 *   <li>Indexes come from {@link Index} on fields and from single-column
 *   {@code @Table(indexes = ...)} entries.</li>
 * </ul>
 */
public final class AnnotatedSchemaExtractor {

    private final KvlinkConfiguration configuration;
    private final FieldDescriptorRegistry registry;

    public AnnotatedSchemaExtractor(KvlinkConfiguration configuration) {
        this(configuration, FieldDescriptorRegistry.withDefaults(configuration.defaultFixedPointPlaces()));
    }

    public AnnotatedSchemaExtractor(KvlinkConfiguration configuration, FieldDescriptorRegistry registry) {
        this.configuration = configuration;
        this.registry = registry;
    }

    /**
     * Extract the schema declared by a class.
     *
     * @throws SchemaException if the class is not an {@code @Entity} or declares
     *                         a field that cannot be mapped
     */
    public ModelSchema extract(Class<?> declaration) {
        String modelName = modelName(declaration);
        ModelSchema.Builder builder = ModelSchema.builder(modelName);
        Set<String> tableIndexes = tableIndexColumns(declaration);
        Set<String> declared = new HashSet<>();

        for (Field field : declaration.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) || Modifier.isTransient(field.getModifiers())
                    || field.isSynthetic() || field.isAnnotationPresent(Transient.class)
                    || field.isAnnotationPresent(Id.class)) {
                continue;
            }
            String fieldName = fieldName(field);
            Index index = field.getAnnotation(Index.class);
            boolean hashed = index != null && index.hashed();

            FieldDescriptor<?> descriptor = descriptorFor(field, fieldName, hashed);
            declared.add(fieldName);
            if (index != null || tableIndexes.contains(fieldName)) {
                builder.indexedField(descriptor);
            } else {
                builder.field(descriptor);
            }
        }

        for (String column : tableIndexes) {
            if (!declared.contains(column)) {
                throw new SchemaException("Model '" + modelName + "' indexes unknown column '" + column + "'");
            }
        }
        return builder.build();
    }

    /**
     * Model name a declaration class maps to.
     *
     * @throws SchemaException if the class is not annotated with {@code @Entity}
     */
    public static String modelName(Class<?> declaration) {
        Entity entity = declaration.getAnnotation(Entity.class);
        if (entity == null) {
            throw new SchemaException(declaration.getName() + " is not annotated with @Entity");
        }
        Table table = declaration.getAnnotation(Table.class);
        if (table != null && !table.name().isEmpty()) {
            return table.name();
        }
        if (!entity.name().isEmpty()) {
            return entity.name();
        }
        return declaration.getSimpleName();
    }

    private FieldDescriptor<?> descriptorFor(Field field, String fieldName, boolean hashed) {
        Class<?> type = field.getType();

        ManyToOne manyToOne = field.getAnnotation(ManyToOne.class);
        OneToOne oneToOne = field.getAnnotation(OneToOne.class);
        if (manyToOne != null || oneToOne != null) {
            Class<?> target = manyToOne != null ? manyToOne.targetEntity() : oneToOne.targetEntity();
            if (target == void.class) {
                target = type;
            }
            return new ForeignLinkField(fieldName, modelName(target), hashed);
        }

        Compressed compressed = field.getAnnotation(Compressed.class);
        if (compressed != null || field.isAnnotationPresent(Lob.class)) {
            CompressionMode mode = compressed == null || compressed.mode().isEmpty()
                    ? configuration.defaultCompressionMode()
                    : CompressionMode.forName(compressed.mode());
            if (type == byte[].class) {
                return new CompressedField(fieldName, mode);
            }
            if (type == String.class) {
                return new FieldChain(fieldName, List.of(new StringField(""), new CompressedField("", mode)));
            }
            throw new SchemaException("Field '" + fieldName + "': compression applies to byte[] or String, not "
                    + type.getName());
        }

        if (field.isAnnotationPresent(Serialized.class)) {
            if (hashed) {
                throw new SchemaException("Field '" + fieldName + "': serialized fields cannot be indexed");
            }
            return new SerializedField(fieldName);
        }

        FixedPoint fixedPoint = field.getAnnotation(FixedPoint.class);
        if (fixedPoint != null) {
            if (type != BigDecimal.class && type != double.class && type != Double.class
                    && type != float.class && type != Float.class) {
                throw new SchemaException("Field '" + fieldName + "': @FixedPoint applies to decimal types, not "
                        + type.getName());
            }
            int places = fixedPoint.decimalPlaces() < 0
                    ? configuration.defaultFixedPointPlaces()
                    : fixedPoint.decimalPlaces();
            return new FixedPointField(fieldName, places, hashed, null);
        }

        return registry.create(fieldName, type, hashed);
    }

    private static String fieldName(Field field) {
        Column column = field.getAnnotation(Column.class);
        if (column != null && !column.name().isEmpty()) {
            return column.name();
        }
        return field.getName();
    }

    private static Set<String> tableIndexColumns(Class<?> declaration) {
        Set<String> columns = new HashSet<>();
        Table table = declaration.getAnnotation(Table.class);
        if (table == null) {
            return columns;
        }
        for (jakarta.persistence.Index index : table.indexes()) {
            String columnList = index.columnList().trim();
            if (columnList.contains(",")) {
                throw new SchemaException("Composite index '" + columnList + "' on "
                        + declaration.getName() + " is not supported; only single-field equality indexes are");
            }
            String column = columnList.split("\\s+")[0];
            if (!column.isEmpty()) {
                columns.add(column);
            }
        }
        return columns;
    }
}
