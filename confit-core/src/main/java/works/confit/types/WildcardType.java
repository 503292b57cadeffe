package works.confit.types;

import java.util.Map;

/**
 * A wildcard like {@code ? extends Number}, or any other type expression
 * that can't be resolved to a single concrete type.
 *
 * @param description the Java source form of the type, for error messages
 */
public record WildcardType(String description) implements UnknownType {
	@Override
	public WildcardType substitute(Map<String, DataType> actualArguments) {
		return this;
	}

	@Override
	public String toString() {
		return description;
	}
}
