package works.confit.hocon;

import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import works.confit.tree.BooleanValue;
import works.confit.tree.MappingValue;
import works.confit.tree.NullValue;
import works.confit.tree.NumberValue;
import works.confit.tree.SequenceValue;
import works.confit.tree.StringValue;
import works.confit.tree.TreeValue;

/**
 * Converts Typesafe Config values into {@link TreeValue}s.
 * <p>
 * Typesafe Config does not remember the order in which object members appeared in the document,
 * so members are sorted by key to keep the result deterministic.
 * Numbers keep the integer or floating-point nature of their literal.
 */
public final class HoconTrees {
	private HoconTrees() { }

	public static TreeValue toTree(ConfigValue value) {
		return switch (value.valueType()) {
			case OBJECT -> {
				Map<String, TreeValue> members = new LinkedHashMap<>();
				new TreeMap<>((ConfigObject) value).forEach((k, v) -> members.put(k, toTree(v)));
				yield new MappingValue(members);
			}
			case LIST -> {
				List<TreeValue> elements = ((ConfigList) value).stream()
					.map(HoconTrees::toTree)
					.toList();
				yield new SequenceValue(elements);
			}
			case NUMBER -> toNumber(value);
			case BOOLEAN -> new BooleanValue((Boolean) value.unwrapped());
			case STRING -> new StringValue((String) value.unwrapped());
			case NULL -> NullValue.INSTANCE;
		};
	}

	/**
	 * Typesafe Config stores a whole-valued floating-point literal like {@code 3.0}
	 * as an integer, so the literal's own text decides whether it stays floating-point.
	 */
	private static NumberValue toNumber(ConfigValue value) {
		Number number = (Number) value.unwrapped();
		if (number instanceof Integer || number instanceof Long) {
			String text = value.render();
			if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
				return new NumberValue(Double.valueOf(text));
			}
		}
		return new NumberValue(number);
	}
}
