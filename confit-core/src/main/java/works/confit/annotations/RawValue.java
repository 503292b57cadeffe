package works.confit.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks the instance field or zero-argument method of an enum
 * that supplies each constant's raw value.
 * A configuration value that matches no constant's name
 * is then matched against the raw values.
 */
@Retention(RUNTIME)
@Target({FIELD, METHOD})
public @interface RawValue {
}
