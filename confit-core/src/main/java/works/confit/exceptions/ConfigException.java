package works.confit.exceptions;

import works.confit.tree.ConfigPath;

import static java.util.Objects.requireNonNull;

public sealed abstract class ConfigException extends RuntimeException permits
	AmbiguousSubclassException,
	MalformedConfigException,
	MissingTypeException,
	ParseException,
	TypeConfigException,
	UnexpectedKeysException
{
	private final ConfigPath path;

	protected ConfigException(ConfigPath path, String message) {
		super(message);
		this.path = requireNonNull(path);
	}

	protected ConfigException(ConfigPath path, String message, Throwable cause) {
		super(message, cause);
		this.path = requireNonNull(path);
	}

	/**
	 * @return where in the configuration tree the problem was detected
	 */
	public ConfigPath path() {
		return path;
	}
}
