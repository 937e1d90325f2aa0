package io.kvlink.runtime;

import io.kvlink.field.FieldValues;

/**
 * One entry of a change report: the value before and after.
 * <p>
 * For link fields both sides are {@link ForeignLink} handles.
 */
public record UpdatedField(Object previous, Object current) {

    @Override
    public String toString() {
        return "(" + FieldValues.render(previous) + " -> " + FieldValues.render(current) + ")";
    }
}
