package io.kvlink.core;

/**
 * The backing store was unreachable or answered with something that could
 * not be interpreted.
 */
public class StorageRoundTripException extends KvlinkException {

    public StorageRoundTripException(String message) {
        super(message);
    }

    public StorageRoundTripException(String message, Throwable cause) {
        super(message, cause);
    }
}
