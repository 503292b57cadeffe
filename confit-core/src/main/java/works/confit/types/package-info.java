/**
 * Rich abstract datatype representing Java types, rooted at {@link works.confit.types.DataType}.
 * <p>
 * Provides the generic type information that {@link java.lang.reflect.Type} makes awkward to use,
 * so that descriptors can be built for types like {@code Map<String, List<Endpoint>>}.
 */
package works.confit.types;
