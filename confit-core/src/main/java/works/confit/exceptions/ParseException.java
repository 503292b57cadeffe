package works.confit.exceptions;

import works.confit.tree.ConfigPath;

/**
 * A scalar has the right shape, but its content can't be interpreted as the
 * required kind: a malformed timestamp, an unknown enum member, an
 * out-of-range number, and so on.
 */
public final class ParseException extends ConfigException {
	public ParseException(ConfigPath path, String message) {
		super(path, message);
	}

	public ParseException(ConfigPath path, String message, Throwable cause) {
		super(path, message, cause);
	}
}
