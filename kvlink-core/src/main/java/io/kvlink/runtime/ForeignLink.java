package io.kvlink.runtime;

import io.kvlink.field.NullSentinel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Lazily resolved reference from a record to a record of another model.
 * <p>
 * A handle is created per assignment: giving a link field a new id or record
 * replaces the handle, so a cached resolution never outlives the value it was
 * resolved for. While unresolved only the id is authoritative; once a record
 * is attached its id is read through it, which lets an unsaved record be
 * linked before it has one.
 */
public final class ForeignLink {
    private static final Logger LOG = LoggerFactory.getLogger(ForeignLink.class);

    private final String targetModel;
    private final Long id;
    private final LinkResolver resolver;
    private ObjectRecord object;
    private boolean fetched;

    private ForeignLink(String targetModel, Long id, ObjectRecord object, LinkResolver resolver) {
        this.targetModel = Objects.requireNonNull(targetModel, "targetModel");
        this.id = id;
        this.object = object;
        this.fetched = object != null;
        this.resolver = resolver;
    }

    static ForeignLink empty(String targetModel, LinkResolver resolver) {
        return new ForeignLink(targetModel, null, null, resolver);
    }

    static ForeignLink ofId(String targetModel, long id, LinkResolver resolver) {
        return new ForeignLink(targetModel, id, null, resolver);
    }

    static ForeignLink ofRecord(ObjectRecord record, LinkResolver resolver) {
        return new ForeignLink(record.modelName(), null, record, resolver);
    }

    public String targetModel() {
        return targetModel;
    }

    /**
     * Id of the linked record, or null when the link is empty or points at a
     * record that has not been saved yet.
     */
    public Long getId() {
        return object != null ? object.getId() : id;
    }

    /**
     * Whether the link points at nothing.
     */
    public boolean isEmpty() {
        return object == null && id == null;
    }

    /**
     * Whether a record is attached, either assigned directly or fetched.
     * Never triggers a fetch.
     */
    public boolean isFetched() {
        return fetched;
    }

    /**
     * The attached record without fetching; null when unresolved.
     */
    public ObjectRecord peekObject() {
        return object;
    }

    /**
     * The linked record, fetching it on first access.
     *
     * @return the record, or {@link NullSentinel} when the link is empty or
     *         the id no longer exists
     */
    public Object getObject() {
        if (!fetched) {
            if (id == null) {
                return NullSentinel.INSTANCE;
            }
            resolve(resolver.resolve(targetModel, id));
            if (object == null) {
                LOG.warn("Link to {}#{} points at a missing record", targetModel, id);
            }
        }
        return object == null ? NullSentinel.INSTANCE : object;
    }

    void resolve(ObjectRecord resolved) {
        this.object = resolved;
        this.fetched = true;
    }

    /**
     * Whether two handles designate the same target: equal ids, or the same
     * unsaved record. Never resolves.
     */
    boolean sameTarget(ForeignLink other) {
        if (other == null) {
            return isEmpty();
        }
        Long leftId = getId();
        Long rightId = other.getId();
        if (leftId != null || rightId != null) {
            return Objects.equals(leftId, rightId);
        }
        return object == other.object;
    }

    /**
     * Copy that keeps the id and any attached record.
     */
    ForeignLink snapshot() {
        ForeignLink copy = new ForeignLink(targetModel, getId(), object, resolver);
        copy.fetched = fetched;
        return copy;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "ForeignLink{" + targetModel + ", empty}";
        }
        Long current = getId();
        return "ForeignLink{" + targetModel + "#" + (current == null ? "unsaved" : current)
                + (fetched ? ", fetched" : "") + "}";
    }

    /**
     * Loads link targets by model name and id.
     */
    @FunctionalInterface
    interface LinkResolver {
        /**
         * @return the record, or null if it does not exist
         */
        ObjectRecord resolve(String targetModel, long id);
    }
}
