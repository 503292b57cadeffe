package works.confit.exceptions;

import works.confit.tree.ConfigPath;

/**
 * The structure of the configuration tree doesn't match the structure of the target type:
 * a mapping where a scalar was expected, a required field that is missing, and so on.
 */
public final class MalformedConfigException extends ConfigException {
	public MalformedConfigException(ConfigPath path, String message) {
		super(path, message);
	}

	public MalformedConfigException(ConfigPath path, String message, Throwable cause) {
		super(path, message, cause);
	}
}
