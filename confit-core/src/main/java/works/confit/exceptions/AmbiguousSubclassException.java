package works.confit.exceptions;

import java.util.List;
import works.confit.tree.ConfigPath;
import works.confit.types.KnownType;

import static works.confit.mapping.SubclassRegistry.TYPE_TAG;

/**
 * More than one registered subclass of an open-polymorphic type
 * accepted the configuration value.
 * The value can be disambiguated with a {@value works.confit.mapping.SubclassRegistry#TYPE_TAG} key.
 */
public final class AmbiguousSubclassException extends ConfigException {
	private final KnownType baseType;
	private final List<KnownType> matches;

	public AmbiguousSubclassException(ConfigPath path, KnownType baseType, List<KnownType> matches) {
		super(path, "multiple subtypes of " + baseType + " matched at " + path.describe()
			+ ", use '" + TYPE_TAG + "' to disambiguate:"
			+ matches.stream().map(m -> "\n- " + m).reduce("", String::concat));
		this.baseType = baseType;
		this.matches = List.copyOf(matches);
	}

	public KnownType baseType() {
		return baseType;
	}

	/**
	 * @return the subclasses that matched, in registration order
	 */
	public List<KnownType> matches() {
		return matches;
	}
}
