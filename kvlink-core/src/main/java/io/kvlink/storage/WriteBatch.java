package io.kvlink.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered group of store writes applied all-or-nothing by
 * {@link RecordStore#apply(WriteBatch)}.
 */
public final class WriteBatch {

    /**
     * One write of a batch.
     */
    public sealed interface Operation permits SetFields, IndexUpdate, Delete {
        String model();

        long id();
    }

    public record SetFields(String model, long id, Map<String, byte[]> fields) implements Operation {
        public SetFields {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model required");
            }
            if (fields == null) {
                throw new IllegalArgumentException("fields required");
            }
        }
    }

    public record IndexUpdate(String model, long id, String fieldName, String oldValue, String newValue)
            implements Operation {
        public IndexUpdate {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model required");
            }
            if (fieldName == null || fieldName.isBlank()) {
                throw new IllegalArgumentException("fieldName required");
            }
        }
    }

    public record Delete(String model, long id) implements Operation {
        public Delete {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model required");
            }
        }
    }

    private final List<Operation> operations;

    private WriteBatch(List<Operation> operations) {
        this.operations = List.copyOf(operations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Operation> operations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    @Override
    public String toString() {
        return "WriteBatch{operations=" + operations.size() + "}";
    }

    public static final class Builder {
        private final List<Operation> operations = new ArrayList<>();

        private Builder() {
        }

        public Builder setFields(String model, long id, Map<String, byte[]> fields) {
            if (!fields.isEmpty()) {
                operations.add(new SetFields(model, id, new LinkedHashMap<>(fields)));
            }
            return this;
        }

        public Builder indexUpdate(String model, String fieldName, String oldValue, String newValue, long id) {
            if (oldValue == null && newValue == null) {
                return this;
            }
            if (oldValue != null && oldValue.equals(newValue)) {
                return this;
            }
            operations.add(new IndexUpdate(model, id, fieldName, oldValue, newValue));
            return this;
        }

        public Builder delete(String model, long id) {
            operations.add(new Delete(model, id));
            return this;
        }

        public WriteBatch build() {
            return new WriteBatch(operations);
        }
    }
}
