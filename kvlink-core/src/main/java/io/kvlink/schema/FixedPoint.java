package io.kvlink.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Stores a numeric field as a decimal with a fixed number of digits after
 * the point, which makes it indexable. Applies to {@code BigDecimal},
 * {@code double} and {@code float} fields.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FixedPoint {

    /**
     * Digits after the decimal point; negative uses the arena's default.
     */
    int decimalPlaces() default -1;
}
