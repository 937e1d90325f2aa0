package io.kvlink.core;

import io.kvlink.runtime.RecordRepository;
import io.kvlink.schema.AnnotatedSchemaExtractor;
import io.kvlink.schema.ModelSchema;
import io.kvlink.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A set of model schemas bound to one backing store.
 * <p>
 * Every model that a link field names must be registered in the same arena
 * before the link is resolved. Model names are keys: registering a second,
 * different schema under a name already in use is an error. Store keys are
 * the model name behind {@link KvlinkConfiguration#keyPrefix()}, so several
 * arenas can share a store without colliding.
 * <pre>
 * try (KvlinkArena arena = new KvlinkArena(new InMemoryRecordStore())) {
 *     RecordRepository users = arena.register(User.class);
 *     ObjectRecord user = users.create(Map.of("name", "ada"));
 *     user.save();
 * }
 * </pre>
 */
public final class KvlinkArena implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(KvlinkArena.class);

    private final RecordStore store;
    private final KvlinkConfiguration configuration;
    private final AnnotatedSchemaExtractor extractor;

    private final ConcurrentMap<String, RecordRepository> repositories = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public KvlinkArena(RecordStore store) {
        this(store, KvlinkConfiguration.defaults());
    }

    public KvlinkArena(RecordStore store, KvlinkConfiguration configuration) {
        this.store = Objects.requireNonNull(store, "store");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.extractor = new AnnotatedSchemaExtractor(configuration);
    }

    /**
     * Register a model, or get the repository of an identical registration.
     *
     * @throws SchemaException if another schema is registered under the same name
     */
    public RecordRepository register(ModelSchema schema) {
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            RecordRepository repository = repositories.computeIfAbsent(schema.name(), name -> {
                LOG.debug("Registering model {} with fields {}", name, schema.fieldNames());
                return new RecordRepository(this, schema);
            });
            if (repository.schema() != schema && !sameDeclaration(repository.schema(), schema)) {
                throw new SchemaException("Model '" + schema.name() + "' is already registered with a different schema");
            }
            return repository;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Register the model declared by a {@code jakarta.persistence.Entity} class.
     */
    public RecordRepository register(Class<?> declaration) {
        return register(extractor.extract(declaration));
    }

    /**
     * Register several declarations at once, typically models that link to
     * each other.
     */
    public List<RecordRepository> registerAll(Class<?>... declarations) {
        return Arrays.stream(declarations).map(this::register).toList();
    }

    /**
     * @throws SchemaException if no model of that name is registered
     */
    public RecordRepository repository(String modelName) {
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            RecordRepository repository = repositories.get(modelName);
            if (repository == null) {
                throw new SchemaException("Model '" + modelName + "' is not registered");
            }
            return repository;
        } finally {
            readLock.unlock();
        }
    }

    public RecordRepository repository(Class<?> declaration) {
        return repository(AnnotatedSchemaExtractor.modelName(declaration));
    }

    public boolean isRegistered(String modelName) {
        return repositories.containsKey(modelName);
    }

    public ModelSchema schema(String modelName) {
        return repository(modelName).schema();
    }

    /**
     * The store, guarded against use after {@link #close()}.
     */
    public RecordStore store() {
        assertOpen();
        return store;
    }

    public KvlinkConfiguration configuration() {
        return configuration;
    }

    /**
     * Key under which a model's records live in the store.
     */
    public String storeKey(String modelName) {
        return configuration.keyPrefix() + modelName;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Drop every registration. The store itself is not closed; it belongs to
     * the caller.
     */
    @Override
    public void close() {
        var writeLock = lifecycleLock.writeLock();
        writeLock.lock();
        try {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            repositories.clear();
        } finally {
            writeLock.unlock();
        }
    }

    private void assertOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Arena is closed");
        }
    }

    private static boolean sameDeclaration(ModelSchema left, ModelSchema right) {
        if (!left.fieldNames().equals(right.fieldNames()) || !left.indexedFields().equals(right.indexedFields())) {
            return false;
        }
        for (String name : left.fieldNames()) {
            if (!left.field(name).toString().equals(right.field(name).toString())) {
                return false;
            }
        }
        return true;
    }
}
