package works.confit.types;

import java.util.Map;

public record PrimitiveType(Class<?> rawClass) implements KnownType {
	public PrimitiveType {
		assert rawClass.isPrimitive();
	}

	@Override
	public PrimitiveType substitute(Map<String, DataType> actualArguments) {
		return this;
	}

	@Override
	public boolean hasUnresolvedParameters() {
		return false;
	}

	@Override
	public String toString() {
		return rawClass.getSimpleName();
	}
}
