package works.confit.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The key under which the component appears in the configuration,
 * when it differs from the component name; for example, {@code @ConfigKey("data_root")}.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface ConfigKey {
	String value();
}
