package works.confit.codec;

import works.confit.tree.TreeValue;

/**
 * Decodes configuration trees according to one particular {@link works.confit.mapping.spec.TargetSpec TargetSpec}.
 * Decoders are stateless; a single instance may be used concurrently.
 */
public interface Decoder {
	/**
	 * @throws works.confit.exceptions.ConfigException if {@code root} doesn't conform to the spec
	 */
	Object decode(TreeValue root);
}
