package works.confit.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The component may be absent or null in the configuration,
 * in which case it decodes to {@code null}.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface Nullable {
}
