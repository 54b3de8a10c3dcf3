package net.tearoff.v1.base.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.CLASS;

/**
 * This annotation is for interfaces and abstract classes that are implemented by the library itself.
 * <p>
 * New methods may be added to such types in later versions. Applications should not implement or extend
 * anything annotated with {@link DoNotImplement}.
 */
@Retention(CLASS)
@Target(TYPE)
@Documented
@Inherited
public @interface DoNotImplement {
}
