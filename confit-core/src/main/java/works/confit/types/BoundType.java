package works.confit.types;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.util.Collections.unmodifiableMap;
import static java.util.stream.Collectors.joining;

/**
 * A class type accompanied by generic type information.
 * Not to be confused with a <em>bounded type</em>;
 * this is about <em>bindings</em>, not <em>bounds</em>.
 * <p>
 * For ordinary classes, {@code bindings} will be empty,
 * indicating that the class has no type parameters.
 */
public record BoundType(Class<?> rawClass, List<? extends DataType> bindings) implements KnownType {
	public BoundType {
		assert !rawClass.isPrimitive();
		bindings = List.copyOf(bindings);
	}

	public BoundType(Class<?> rawClass, DataType... bindings) {
		this(rawClass, List.of(bindings));
	}

	public DataType typeArgument(int index) {
		return bindings().get(index);
	}

	public Stream<? extends DataType> typeArguments() {
		return this.bindings().stream();
	}

	public Map<String, DataType> actualArguments() {
		var typeParameters = rawClass().getTypeParameters();
		assert typeParameters.length == bindings.size();
		Map<String, DataType> map = new HashMap<>();
		for (int i = 0; i < typeParameters.length; i++) {
			map.put(typeParameters[i].getName(), bindings.get(i));
		}
		return unmodifiableMap(map);
	}

	@Override
	public BoundType substitute(Map<String, DataType> actualArguments) {
		return new BoundType(rawClass, bindings.stream()
			.map(ta -> ta.substitute(actualArguments))
			.toList());
	}

	@Override
	public boolean hasUnresolvedParameters() {
		return bindings.stream().anyMatch(DataType::hasUnresolvedParameters);
	}

	@Override
	public String toString() {
		String simpleName = this.rawClass().getSimpleName();
		if (simpleName.isEmpty()) {
			// Anonymous classes
			simpleName = this.rawClass().getName();
			simpleName = simpleName.substring(simpleName.lastIndexOf('.') + 1);
		}
		if (this.bindings().isEmpty()) {
			return simpleName;
		} else {
			return simpleName + "<"
				+ this.bindings().stream()
				.map(DataType::toString)
				.collect(joining(","))
				+ ">";
		}
	}
}
