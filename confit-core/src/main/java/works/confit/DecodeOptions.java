package works.confit;

/**
 * Settings that affect how a configuration tree is decoded.
 *
 * @param strictUnexpectedKeys if true, mapping keys that correspond to no record component
 *                             cause an {@link works.confit.exceptions.UnexpectedKeysException};
 *                             if false, they're ignored
 * @param maxDepth the deepest nesting of sequences and mappings that will be decoded;
 *                 anything deeper is rejected rather than risking stack overflow
 */
public record DecodeOptions(
	boolean strictUnexpectedKeys,
	int maxDepth
) {
	public DecodeOptions {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	public static final DecodeOptions DEFAULT = new DecodeOptions(true, 512);
	public static final DecodeOptions LENIENT = DEFAULT.withStrictUnexpectedKeys(false);

	public DecodeOptions withStrictUnexpectedKeys(boolean strictUnexpectedKeys) {
		return new DecodeOptions(strictUnexpectedKeys, maxDepth);
	}

	public DecodeOptions withMaxDepth(int maxDepth) {
		return new DecodeOptions(strictUnexpectedKeys, maxDepth);
	}
}
