package net.tearoff.v1.base.annotations;

import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a class as permitted to be serialized as a transaction component.
 * <p>
 * The serialization service only writes and reads classes that carry this annotation, directly or through a
 * superclass or an implemented interface.
 */
@Target(TYPE)
@Retention(RUNTIME)
@Inherited
public @interface TearoffSerializable {
}
