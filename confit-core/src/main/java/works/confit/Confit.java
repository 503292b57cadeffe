package works.confit;

import works.confit.codec.Codec;
import works.confit.codec.CodecBuilder;
import works.confit.mapping.SubclassRegistry;
import works.confit.mapping.TypeScanner;
import works.confit.mapping.spec.TargetSpec;
import works.confit.tree.TreeValue;
import works.confit.types.DataType;
import works.confit.types.TypeReference;

import static java.util.Objects.requireNonNull;

/**
 * Entry point for decoding configuration trees into typed objects and encoding them back.
 * <p>
 * {@link #standard()} uses the process-wide {@link TypeScanner#shared() TypeScanner}
 * and {@link SubclassRegistry#global() SubclassRegistry}, which is usually what you want.
 * Use {@link #builder()} for an isolated instance, and {@link #withOptions} to vary the
 * {@link DecodeOptions} while sharing everything else.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class Confit {
	private final TypeScanner scanner;
	private final SubclassRegistry registry;
	private final DecodeOptions options;
	private final Codec codec;

	private static final Confit STANDARD = new Confit(TypeScanner.shared(), SubclassRegistry.global(), DecodeOptions.DEFAULT);

	private Confit(TypeScanner scanner, SubclassRegistry registry, DecodeOptions options) {
		this.scanner = requireNonNull(scanner);
		this.registry = requireNonNull(registry);
		this.options = requireNonNull(options);
		this.codec = CodecBuilder.using(scanner)
			.withRegistry(registry)
			.withOptions(options)
			.build();
	}

	public static Confit standard() {
		return STANDARD;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Confit withOptions(DecodeOptions options) {
		return new Confit(scanner, registry, options);
	}

	/**
	 * @throws works.confit.exceptions.ConfigException if {@code value} can't be decoded as {@code type}
	 */
	@SuppressWarnings("unchecked")
	public <T> T decode(TreeValue value, Class<T> type) {
		return (T) decode(value, DataType.of(type));
	}

	@SuppressWarnings("unchecked")
	public <T> T decode(TreeValue value, TypeReference<T> type) {
		return (T) decode(value, DataType.of(type));
	}

	public Object decode(TreeValue value, DataType type) {
		return codec.decoderFor(specFor(type)).decode(value);
	}

	/**
	 * Encodes {@code value} according to its own class.
	 * For generic types like {@code Map<String, Endpoint>},
	 * use {@link #encode(Object, TypeReference)} instead.
	 */
	public TreeValue encode(Object value) {
		return encode(value, DataType.of(value.getClass()));
	}

	public <T> TreeValue encode(T value, TypeReference<T> type) {
		return encode(value, DataType.of(type));
	}

	public TreeValue encode(Object value, DataType type) {
		return codec.encoderFor(specFor(type)).encode(value);
	}

	/**
	 * Builds the descriptor for {@code type} if it hasn't been built already.
	 * Useful to detect unsupported types before reading any configuration.
	 *
	 * @throws works.confit.exceptions.MissingTypeException if {@code type} can't be decoded into
	 */
	public TargetSpec specFor(DataType type) {
		return scanner.specFor(type);
	}

	public TypeScanner scanner() {
		return scanner;
	}

	public SubclassRegistry registry() {
		return registry;
	}

	public DecodeOptions options() {
		return options;
	}

	public static final class Builder {
		private TypeScanner scanner;
		private SubclassRegistry registry;
		private DecodeOptions options = DecodeOptions.DEFAULT;

		private Builder() { }

		/**
		 * Defaults to a new {@link TypeScanner} with only the built-in directives.
		 */
		public Builder scanner(TypeScanner scanner) {
			this.scanner = requireNonNull(scanner);
			return this;
		}

		/**
		 * Defaults to {@link SubclassRegistry#global()}.
		 */
		public Builder registry(SubclassRegistry registry) {
			this.registry = requireNonNull(registry);
			return this;
		}

		public Builder options(DecodeOptions options) {
			this.options = requireNonNull(options);
			return this;
		}

		public Confit build() {
			return new Confit(
				scanner == null ? new TypeScanner() : scanner,
				registry == null ? SubclassRegistry.global() : registry,
				options);
		}
	}
}
