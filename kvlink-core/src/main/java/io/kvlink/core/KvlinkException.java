package io.kvlink.core;

/**
 * Root of every failure raised by the mapping layer.
 */
public class KvlinkException extends RuntimeException {

    public KvlinkException(Throwable cause) {
        super(cause);
    }

    public KvlinkException(String message, Throwable cause) {
        super(message, cause);
    }

    public KvlinkException(String message) {
        super(message);
    }

}
