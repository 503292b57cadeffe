package works.confit.codec;

import works.confit.DecodeOptions;
import works.confit.codec.interpreter.SpecInterpretingDecoder;
import works.confit.codec.interpreter.SpecInterpretingEncoder;
import works.confit.mapping.SubclassRegistry;
import works.confit.mapping.TypeScanner;
import works.confit.mapping.spec.TargetSpec;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Codec} according to the user's instructions.
 */
public class CodecBuilder {
	private final TypeScanner scanner;
	private SubclassRegistry registry = SubclassRegistry.global();
	private DecodeOptions options = DecodeOptions.DEFAULT;

	private CodecBuilder(TypeScanner scanner) {
		this.scanner = requireNonNull(scanner);
	}

	/**
	 * @param scanner is used to resolve any {@link works.confit.mapping.spec.TypeRefNode}s
	 *                and to scan subclasses found in the {@link SubclassRegistry}
	 */
	public static CodecBuilder using(TypeScanner scanner) {
		return new CodecBuilder(scanner);
	}

	public CodecBuilder withRegistry(SubclassRegistry registry) {
		this.registry = requireNonNull(registry);
		return this;
	}

	public CodecBuilder withOptions(DecodeOptions options) {
		this.options = requireNonNull(options);
		return this;
	}

	public Codec build() {
		TypeScanner scanner = this.scanner;
		SubclassRegistry registry = this.registry;
		DecodeOptions options = this.options;
		return new Codec() {
			@Override
			public Decoder decoderFor(TargetSpec spec) {
				return new SpecInterpretingDecoder(spec, scanner, registry, options);
			}

			@Override
			public Encoder encoderFor(TargetSpec spec) {
				return new SpecInterpretingEncoder(spec, scanner);
			}
		};
	}
}
