package works.confit.exceptions;

import works.confit.tree.ConfigPath;

/**
 * A target type can't be decoded into because its description is incomplete or unsupported,
 * like a raw {@code List} with no element type.
 * <p>
 * This is a programming error rather than a configuration error,
 * and is thrown while building the type's descriptor, before any configuration is read.
 * The {@link #path() path} is the position of the offending type relative to the
 * type whose descriptor was being built.
 */
public final class MissingTypeException extends ConfigException {
	public MissingTypeException(String message) {
		super(ConfigPath.ROOT, message);
	}

	public MissingTypeException(ConfigPath path, String message) {
		super(path, message);
	}

	public MissingTypeException(ConfigPath path, String message, Throwable cause) {
		super(path, message, cause);
	}
}
