package works.confit.types;

import java.util.Map;

/**
 * A {@link DataType} representing a class or interface type
 * whose {@link #rawClass} is known.
 */
sealed public interface KnownType extends DataType permits BoundType, ErasedType, PrimitiveType {
	Class<?> rawClass();

	@Override
	default Class<?> leastUpperBoundClass() {
		return rawClass();
	}

	@Override
	KnownType substitute(Map<String, DataType> actualArguments);
}
