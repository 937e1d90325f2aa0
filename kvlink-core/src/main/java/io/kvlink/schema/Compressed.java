package io.kvlink.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Stores a {@code byte[]} or {@code String} field compressed.
 * A {@code String} field is encoded as UTF-8 first.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Compressed {

    /**
     * Mode name or alias ({@code "zlib"}, {@code "bz2"}, ...). Empty uses the
     * arena's default mode.
     */
    String mode() default "";
}
