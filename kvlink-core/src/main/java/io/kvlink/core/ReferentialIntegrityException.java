package io.kvlink.core;

/**
 * A save without cascading found a linked record that has never been
 * persisted, so there is no id that could be stored for the link.
 */
public class ReferentialIntegrityException extends KvlinkException {

    private final String modelName;
    private final String fieldName;

    public ReferentialIntegrityException(String modelName, String fieldName) {
        super("Link '" + fieldName + "' on model '" + modelName
                + "' points at an unsaved record; save it first or save with cascading enabled");
        this.modelName = modelName;
        this.fieldName = fieldName;
    }

    public String modelName() {
        return modelName;
    }

    public String fieldName() {
        return fieldName;
    }
}
