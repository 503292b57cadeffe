package works.confit.tree;

/**
 * An explicit {@code null} in the document,
 * as distinct from a key that is missing altogether.
 */
public record NullValue() implements TreeValue {
	public static final NullValue INSTANCE = new NullValue();

	@Override
	public String shape() {
		return "null";
	}

	@Override
	public String toString() {
		return "null";
	}
}
