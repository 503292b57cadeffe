package works.confit.types;

/**
 * A {@link DataType} that stands for some type not determined by the declaration itself.
 * Descriptors can't be built for these; they must be substituted away first.
 */
public sealed interface UnknownType extends DataType permits TypeVariable, WildcardType {
	@Override
	default Class<?> leastUpperBoundClass() {
		return Object.class;
	}

	@Override
	default boolean hasUnresolvedParameters() {
		return true;
	}
}
