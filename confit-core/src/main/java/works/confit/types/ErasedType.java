package works.confit.types;

import java.util.Map;

/**
 * A {@link KnownType} with its type arguments erased,
 * as when a raw {@code List} or {@code Map} is used.
 */
public record ErasedType(Class<?> rawClass) implements KnownType {
	public ErasedType {
		assert !rawClass.isPrimitive();
		assert rawClass.getTypeParameters().length > 0;
	}

	@Override
	public ErasedType substitute(Map<String, DataType> actualArguments) {
		return this;
	}

	@Override
	public boolean hasUnresolvedParameters() {
		// In effect, all the type parameters of an erased type are wildcards.
		return true;
	}

	@Override
	public String toString() {
		return rawClass.getSimpleName();
	}
}
