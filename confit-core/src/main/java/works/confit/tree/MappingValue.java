package works.confit.tree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.stream.Collectors.joining;

/**
 * An ordered mapping from string keys to values.
 * Iteration follows the order in which the format parser supplied the members.
 */
public record MappingValue(Map<String, TreeValue> members) implements TreeValue {
	public static final MappingValue EMPTY = new MappingValue(Map.of());

	public MappingValue {
		members = unmodifiableMap(new LinkedHashMap<>(members));
	}

	/**
	 * @return the value for {@code key}, or null if the key is absent
	 */
	public TreeValue get(String key) {
		return members.get(key);
	}

	public boolean containsKey(String key) {
		return members.containsKey(key);
	}

	public Set<String> keys() {
		return members.keySet();
	}

	/**
	 * @return a mapping with the same members as this one, except for {@code key}
	 */
	public MappingValue without(String key) {
		if (!members.containsKey(key)) {
			return this;
		}
		Map<String, TreeValue> result = new LinkedHashMap<>(members);
		result.remove(key);
		return new MappingValue(result);
	}

	@Override
	public String shape() {
		return "mapping";
	}

	@Override
	public String toString() {
		return members.entrySet().stream()
			.map(e -> "\"" + e.getKey() + "\": " + e.getValue())
			.collect(joining(", ", "{", "}"));
	}
}
