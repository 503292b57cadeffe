package works.confit.hocon;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigSyntax;
import java.net.URL;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.confit.Confit;
import works.confit.tree.TreeValue;
import works.confit.types.DataType;
import works.confit.types.TypeReference;

import static java.util.Objects.requireNonNull;

/**
 * Loads HOCON, JSON or Java properties documents into typed objects.
 * <p>
 * Substitutions like {@code ${?HOME}} are resolved before decoding,
 * falling back to environment variables for paths the document doesn't define.
 * The target type's descriptor is built before anything is parsed,
 * so an unsupported type fails fast with a
 * {@link works.confit.exceptions.MissingTypeException MissingTypeException}.
 * Errors from Typesafe Config itself, such as syntax errors,
 * propagate as {@link com.typesafe.config.ConfigException}s.
 */
public final class HoconLoader {
	private final Confit confit;

	private static final HoconLoader STANDARD = new HoconLoader(Confit.standard());

	public HoconLoader(Confit confit) {
		this.confit = requireNonNull(confit);
	}

	public static HoconLoader standard() {
		return STANDARD;
	}

	public <T> T loads(String text, Class<T> type) {
		return loads(text, ConfigSyntax.CONF, type);
	}

	public <T> T loads(String text, TypeReference<T> type) {
		return cast(load(DataType.of(type), "string", () -> ConfigFactory.parseString(text, options(ConfigSyntax.CONF))));
	}

	public <T> T loads(String text, ConfigSyntax syntax, Class<T> type) {
		return cast(load(DataType.of(type), "string", () -> ConfigFactory.parseString(text, options(syntax))));
	}

	/**
	 * The syntax is chosen by file extension:
	 * {@code .json} and {@code .properties} are parsed as such, and anything else as HOCON.
	 */
	public <T> T file(Path path, Class<T> type) {
		return cast(load(DataType.of(type), path.toString(), () -> ConfigFactory.parseFile(path.toFile(), options(syntaxFor(path.toString())))));
	}

	public <T> T url(URL url, Class<T> type) {
		return cast(load(DataType.of(type), url.toString(), () -> ConfigFactory.parseURL(url, options(syntaxFor(url.getPath())))));
	}

	/**
	 * Decodes an already-parsed {@link Config}, resolving it first if necessary.
	 */
	public <T> T config(Config config, Class<T> type) {
		return cast(load(DataType.of(type), config.origin().description(), () -> config));
	}

	private Object load(DataType type, String origin, Supplier<Config> parser) {
		confit.specFor(type);
		Config config = parser.get().resolve();
		TreeValue tree = HoconTrees.toTree(config.root());
		LOGGER.debug("Decoding {} from {}", type, origin);
		return confit.decode(tree, type);
	}

	private static ConfigParseOptions options(ConfigSyntax syntax) {
		return ConfigParseOptions.defaults()
			.setSyntax(syntax)
			.setAllowMissing(false);
	}

	private static ConfigSyntax syntaxFor(String name) {
		String lower = name.toLowerCase(Locale.ROOT);
		if (lower.endsWith(".json")) {
			return ConfigSyntax.JSON;
		} else if (lower.endsWith(".properties")) {
			return ConfigSyntax.PROPERTIES;
		} else {
			return ConfigSyntax.CONF;
		}
	}

	@SuppressWarnings("unchecked")
	private static <T> T cast(Object value) {
		return (T) value;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(HoconLoader.class);
}
