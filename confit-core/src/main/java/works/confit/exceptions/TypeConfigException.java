package works.confit.exceptions;

import java.util.List;
import works.confit.tree.ConfigPath;
import works.confit.types.KnownType;

/**
 * None of the candidate interpretations of a value succeeded.
 * <p>
 * Thrown for unions, where the candidates are the declared variants,
 * and for open-polymorphic types, where they are the registered subclasses.
 * The message lists each candidate's failure on its own line, in the order
 * the candidates were tried; the same exceptions are available from {@link #causes()}.
 */
public final class TypeConfigException extends ConfigException {
	private final KnownType type;
	private final List<ConfigException> causes;

	public TypeConfigException(ConfigPath path, KnownType type, String candidateKind, List<? extends ConfigException> causes) {
		super(path, "expected type " + type + " at " + path.describe() + ", failed " + candidateKind + ":" + bulletList(causes));
		this.type = type;
		this.causes = List.copyOf(causes);
		this.causes.forEach(this::addSuppressed);
	}

	public TypeConfigException(ConfigPath path, KnownType type, String message) {
		super(path, "expected type " + type + " at " + path.describe() + ", " + message);
		this.type = type;
		this.causes = List.of();
	}

	public KnownType type() {
		return type;
	}

	/**
	 * @return the failure of each candidate, in the order they were tried
	 */
	public List<ConfigException> causes() {
		return causes;
	}

	private static String bulletList(List<? extends ConfigException> causes) {
		StringBuilder sb = new StringBuilder();
		for (var cause : causes) {
			// Indent continuation lines so nested composites stay readable
			sb.append("\n- ").append(cause.getMessage().replace("\n", "\n  "));
		}
		return sb.toString();
	}
}
