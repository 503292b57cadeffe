package works.confit.types;

/**
 * Captures a generic type for use at runtime:
 * {@code new TypeReference<Map<String, Endpoint>>() {}}.
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	java.lang.reflect.Type reflectionType() {
		return ((java.lang.reflect.ParameterizedType) getClass()
			.getGenericSuperclass()).getActualTypeArguments()[0];
	}
}
