package works.confit.codec;

import works.confit.tree.TreeValue;

public interface Encoder {
	/**
	 * @return a tree that decodes back to an object equal to {@code value}
	 */
	TreeValue encode(Object value);
}
