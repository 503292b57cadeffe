package works.confit.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public sealed interface DataType permits KnownType, UnknownType {
	PrimitiveType BOOLEAN = new PrimitiveType(boolean.class);
	PrimitiveType BYTE = new PrimitiveType(byte.class);
	PrimitiveType SHORT = new PrimitiveType(short.class);
	PrimitiveType INT = new PrimitiveType(int.class);
	PrimitiveType LONG = new PrimitiveType(long.class);
	PrimitiveType FLOAT = new PrimitiveType(float.class);
	PrimitiveType DOUBLE = new PrimitiveType(double.class);
	BoundType STRING = (BoundType) DataType.of(String.class);
	BoundType OBJECT = (BoundType) DataType.of(Object.class);

	static KnownType known(Type type) {
		if (of(type) instanceof KnownType kt) {
			return kt;
		} else {
			throw new IllegalArgumentException("Type is not a KnownType: " + type);
		}
	}

	static KnownType known(TypeReference<?> ref) {
		return known(ref.reflectionType());
	}

	static DataType of(Type type) {
		if (type instanceof Class<?> clazz) {
			if (clazz.isPrimitive()) {
				return new PrimitiveType(clazz);
			} else if (clazz.getTypeParameters().length == 0) {
				return new BoundType(clazz, List.of());
			} else {
				return new ErasedType(clazz);
			}
		} else if (type instanceof ParameterizedType pt) {
			return new BoundType(
				(Class<?>) pt.getRawType(),
				Stream.of(pt.getActualTypeArguments()).map(DataType::of).toList());
		} else if (type instanceof java.lang.reflect.TypeVariable<?> tv) {
			return new TypeVariable(tv.getName());
		} else if (type instanceof java.lang.reflect.WildcardType w) {
			return new WildcardType(w.getTypeName());
		} else if (type instanceof GenericArrayType t) {
			// Generic arrays aren't supported as config targets; keep the name for the error message
			return new WildcardType(t.getTypeName());
		}
		throw new IllegalArgumentException("Unsupported type: " + type);
	}

	static DataType of(TypeReference<?> ref) {
		return of(ref.reflectionType());
	}

	/**
	 * @return The most specific common supertype of all possible types
	 * represented by this DataType.
	 */
	Class<?> leastUpperBoundClass();

	DataType substitute(Map<String, DataType> actualArguments);

	/**
	 * @return true if this type contains any {@link TypeVariable}, {@link WildcardType} or {@link ErasedType},
	 * meaning some of its generic type information is not available.
	 */
	boolean hasUnresolvedParameters();
}
