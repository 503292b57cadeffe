package works.confit.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares an {@code Object} component as a union of the given types,
 * tried in the order listed; the first one that decodes successfully wins.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface OneOf {
	Class<?>[] value();
}
