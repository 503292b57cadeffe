package works.confit.jackson;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;
import works.confit.Confit;
import works.confit.tree.MappingValue;
import works.confit.tree.TreeValue;
import works.confit.types.DataType;
import works.confit.types.TypeReference;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Loads JSON or YAML documents into typed objects using Jackson.
 * <p>
 * Jackson only parses the text into plain maps, lists and scalars;
 * all type-directed decoding is done by {@link Confit}.
 * A blank document decodes as an empty mapping.
 * Parse errors propagate as Jackson's own {@link tools.jackson.core.JacksonException}s.
 */
public final class JacksonLoader {
	private final ObjectMapper mapper;
	private final String formatName;
	private final Confit confit;

	private JacksonLoader(ObjectMapper mapper, String formatName, Confit confit) {
		this.mapper = requireNonNull(mapper);
		this.formatName = requireNonNull(formatName);
		this.confit = requireNonNull(confit);
	}

	public static JacksonLoader json() {
		return json(Confit.standard());
	}

	public static JacksonLoader json(Confit confit) {
		return new JacksonLoader(JsonMapper.builder().build(), "JSON", confit);
	}

	public static JacksonLoader yaml() {
		return yaml(Confit.standard());
	}

	public static JacksonLoader yaml(Confit confit) {
		return new JacksonLoader(YAMLMapper.builder().build(), "YAML", confit);
	}

	public <T> T loads(String text, Class<T> type) {
		return cast(load(DataType.of(type), "string", text));
	}

	public <T> T loads(String text, TypeReference<T> type) {
		return cast(load(DataType.of(type), "string", text));
	}

	public <T> T file(Path path, Class<T> type) throws IOException {
		DataType dataType = DataType.of(type);
		confit.specFor(dataType);
		return cast(load(dataType, path.toString(), Files.readString(path, UTF_8)));
	}

	public <T> T url(URL url, Class<T> type) throws IOException {
		DataType dataType = DataType.of(type);
		confit.specFor(dataType);
		String text;
		try (InputStream in = url.openStream()) {
			text = new String(in.readAllBytes(), UTF_8);
		}
		return cast(load(dataType, url.toString(), text));
	}

	/**
	 * Parses {@code text} without decoding it.
	 */
	public TreeValue parse(String text) {
		if (text.isBlank()) {
			return MappingValue.EMPTY;
		}
		Object value = mapper.readValue(text, Object.class);
		return (value == null) ? MappingValue.EMPTY : TreeValue.of(value);
	}

	private Object load(DataType type, String origin, String text) {
		confit.specFor(type);
		TreeValue tree = parse(text);
		LOGGER.debug("Decoding {} from {} {}", type, formatName, origin);
		return confit.decode(tree, type);
	}

	@SuppressWarnings("unchecked")
	private static <T> T cast(Object value) {
		return (T) value;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonLoader.class);
}
