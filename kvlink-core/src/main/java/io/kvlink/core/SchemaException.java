package io.kvlink.core;

/**
 * Invalid field or model declaration: unknown compression mode, an index
 * requested on a type that cannot be indexed, duplicate field names, or a
 * filter on a field that is not indexed.
 * <p>
 * Raised while the schema is being defined and never retried.
 */
public class SchemaException extends KvlinkException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
