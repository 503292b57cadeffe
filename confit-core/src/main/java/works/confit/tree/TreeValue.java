package works.confit.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a parsed configuration document.
 * <p>
 * The {@link Object#toString() toString} method of each variant returns
 * a compact JSON-like rendering suitable for log messages.
 */
public sealed interface TreeValue permits
	NullValue,
	BooleanValue,
	NumberValue,
	StringValue,
	SequenceValue,
	MappingValue
{
	/**
	 * @return a short name for the shape of this value, used in error messages
	 */
	String shape();

	/**
	 * Converts plain Java data into a tree.
	 * Accepts {@code null}, {@link Boolean}, {@link Number}, {@link CharSequence},
	 * {@link List} and {@link Map} (with {@link String} keys), nested arbitrarily,
	 * as well as existing {@link TreeValue}s.
	 *
	 * @throws IllegalArgumentException if {@code value} contains anything else
	 */
	static TreeValue of(Object value) {
		if (value == null) {
			return NullValue.INSTANCE;
		} else if (value instanceof TreeValue t) {
			return t;
		} else if (value instanceof Boolean b) {
			return new BooleanValue(b);
		} else if (value instanceof Number n) {
			return new NumberValue(n);
		} else if (value instanceof CharSequence s) {
			return new StringValue(s.toString());
		} else if (value instanceof List<?> list) {
			return new SequenceValue(list.stream().map(TreeValue::of).toList());
		} else if (value instanceof Map<?, ?> map) {
			Map<String, TreeValue> members = new LinkedHashMap<>();
			map.forEach((k, v) -> {
				if (k instanceof String key) {
					members.put(key, TreeValue.of(v));
				} else {
					throw new IllegalArgumentException("Mapping keys must be strings; found " + k);
				}
			});
			return new MappingValue(members);
		}
		throw new IllegalArgumentException("Can't represent " + value.getClass().getSimpleName() + " as a TreeValue");
	}
}
