package works.confit.exceptions;

import java.util.List;
import java.util.SortedSet;
import works.confit.tree.ConfigPath;
import works.confit.types.KnownType;

import static java.util.stream.Collectors.joining;

/**
 * A mapping has keys that don't correspond to any field of the record
 * it was decoded into, and unexpected keys are not being ignored.
 */
public final class UnexpectedKeysException extends ConfigException {
	private final KnownType type;
	private final List<String> keys;

	public UnexpectedKeysException(ConfigPath path, KnownType type, SortedSet<String> keys) {
		super(path, "unexpected key(s) "
			+ keys.stream().map(k -> "\"" + k + "\"").collect(joining(", "))
			+ " detected for type " + type + " at " + path.describe());
		this.type = type;
		this.keys = List.copyOf(keys);
	}

	public KnownType type() {
		return type;
	}

	/**
	 * @return the offending keys, sorted
	 */
	public List<String> keys() {
		return keys;
	}
}
