package works.confit.codec;

import works.confit.mapping.spec.TargetSpec;

/**
 * A factory for decoders and encoders.
 * Accessible via {@link CodecBuilder}.
 * <p>
 * Typically, the {@code spec} passed to {@link #decoderFor(TargetSpec) decoderFor}
 * and {@link #encoderFor(TargetSpec) encoderFor}
 * should come from the same {@link works.confit.mapping.TypeScanner TypeScanner}
 * that was used to build this {@code Codec},
 * because any {@link works.confit.mapping.spec.TypeRefNode TypeRefNode}s in it
 * are resolved using that scanner's {@link works.confit.mapping.TypeMap TypeMap}.
 */
public interface Codec {
	Decoder decoderFor(TargetSpec spec);
	Encoder encoderFor(TargetSpec spec);
}
