package works.confit.types;

import java.util.Map;

/**
 * A type parameter such as the {@code T} in {@code record Box<T>(T value)}.
 * Substituted with the actual type argument when the enclosing generic type is bound.
 */
public record TypeVariable(String name) implements UnknownType {
	@Override
	public DataType substitute(Map<String, DataType> actualArguments) {
		return actualArguments.getOrDefault(name, this);
	}

	@Override
	public String toString() {
		return name;
	}
}
