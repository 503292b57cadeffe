package works.confit.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Names a static, zero-argument method of the enclosing record
 * that produces the component's value when its key is absent.
 * <p>
 * The method is called anew each time a default is needed,
 * so it may safely return mutable objects.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface DefaultFactory {
	String value();
}
