package works.confit.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * A literal value to decode when the component's key is absent.
 * <p>
 * The literal is decoded exactly as though it had appeared in the configuration.
 * Literals that look like integers or decimals are treated as numbers;
 * anything else is a string, which suits booleans, enums, timestamps and durations as well.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface Default {
	String value();
}
