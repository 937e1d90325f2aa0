package io.kvlink.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field of a model declaration as indexed for equality filtering.
 *
 * <p>Example usage:
 * <pre>
 * {@code @Entity}
 * public class Article {
 *     {@code @Index} String slug;                  // keyed by the stored value
 *     {@code @Index(hashed = true)} String title;  // keyed by its MD5 digest
 * }
 * </pre>
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Index {

    /**
     * Key the index by the MD5 digest of the stored value. Useful for long
     * values; fixed for the life of the model.
     */
    boolean hashed() default false;
}
