package io.kvlink.core;

/**
 * Input that a typed field cannot parse, for example {@code "maybe"} for a
 * boolean field.
 */
public class ValueConversionException extends KvlinkException {

    private final String fieldName;

    public ValueConversionException(String fieldName, String message) {
        super(message(fieldName, message));
        this.fieldName = fieldName;
    }

    public ValueConversionException(String fieldName, String message, Throwable cause) {
        super(message(fieldName, message), cause);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }

    private static String message(String fieldName, String message) {
        return fieldName == null || fieldName.isEmpty() ? message : "Field '" + fieldName + "': " + message;
    }
}
