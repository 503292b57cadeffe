package works.confit.codec.interpreter;

import java.lang.invoke.MethodType;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.confit.codec.Encoder;
import works.confit.mapping.TypeScanner;
import works.confit.mapping.spec.BooleanNode;
import works.confit.mapping.spec.CalendarDurationNode;
import works.confit.mapping.spec.DynamicNode;
import works.confit.mapping.spec.EnumNode;
import works.confit.mapping.spec.InstantNode;
import works.confit.mapping.spec.ListNode;
import works.confit.mapping.spec.MapNode;
import works.confit.mapping.spec.NumberNode;
import works.confit.mapping.spec.OptionalSpec;
import works.confit.mapping.spec.PolymorphicSpec;
import works.confit.mapping.spec.RecordMember;
import works.confit.mapping.spec.RecordNode;
import works.confit.mapping.spec.RepresentAsSpec;
import works.confit.mapping.spec.StringNode;
import works.confit.mapping.spec.TargetSpec;
import works.confit.mapping.spec.TypeRefNode;
import works.confit.mapping.spec.UnionSpec;
import works.confit.tree.BooleanValue;
import works.confit.tree.MappingValue;
import works.confit.tree.NullValue;
import works.confit.tree.NumberValue;
import works.confit.tree.SequenceValue;
import works.confit.tree.StringValue;
import works.confit.tree.TreeValue;
import works.confit.types.DataType;

import static java.util.Objects.requireNonNull;
import static works.confit.mapping.SubclassRegistry.TYPE_TAG;

/**
 * Produces a {@link TreeValue} from an object by walking the given {@link TargetSpec} tree.
 * <p>
 * Absent optional components are omitted, and open-polymorphic values carry a
 * {@value works.confit.mapping.SubclassRegistry#TYPE_TAG} key, so that the result
 * decodes back to an equal object.
 */
public class SpecInterpretingEncoder implements Encoder {
	final TargetSpec spec;
	final TypeScanner scanner;

	public SpecInterpretingEncoder(TargetSpec spec, TypeScanner scanner) {
		this.spec = requireNonNull(spec);
		this.scanner = requireNonNull(scanner);
	}

	@Override
	public TreeValue encode(Object value) {
		return encodeAny(spec, value);
	}

	private TreeValue encodeAny(TargetSpec node, Object value) {
		LOGGER.trace("encodeAny({}, {})", node, value);
		if (node instanceof TypeRefNode n) {
			return encodeAny(scanner.typeMap().get(n.type()), value);
		} else if (node instanceof OptionalSpec n) {
			Object present = n.unwrap(value);
			return (present == null) ? NullValue.INSTANCE : encodeAny(n.child(), present);
		} else if (node instanceof DynamicNode) {
			return (TreeValue) value;
		} else if (value == null) {
			throw new IllegalArgumentException("Unexpected null for non-optional " + node);
		} else if (node instanceof StringNode) {
			return new StringValue((String) value);
		} else if (node instanceof BooleanNode) {
			return new BooleanValue((Boolean) value);
		} else if (node instanceof NumberNode) {
			return new NumberValue((Number) value);
		} else if (node instanceof InstantNode) {
			return new StringValue(toInstant(value).toString());
		} else if (node instanceof CalendarDurationNode) {
			return new StringValue(value.toString());
		} else if (node instanceof EnumNode) {
			return new StringValue(((Enum<?>) value).name());
		} else if (node instanceof ListNode n) {
			List<TreeValue> elements = new ArrayList<>();
			((Iterable<?>) value).forEach(e -> elements.add(encodeAny(n.elementSpec(), e)));
			return new SequenceValue(elements);
		} else if (node instanceof MapNode n) {
			Map<String, TreeValue> members = new LinkedHashMap<>();
			((Map<?, ?>) value).forEach((k, v) -> members.put((String) k, encodeAny(n.valueSpec(), v)));
			return new MappingValue(members);
		} else if (node instanceof RecordNode n) {
			return encodeRecord(n, value);
		} else if (node instanceof UnionSpec n) {
			return encodeAny(variantFor(n, value), value);
		} else if (node instanceof PolymorphicSpec) {
			return encodePolymorphic(value);
		} else if (node instanceof RepresentAsSpec n) {
			return encodeAny(n.representation(), n.toRepresentation().invoke(value));
		}
		throw new IllegalStateException("Unexpected spec node " + node);
	}

	private TreeValue encodeRecord(RecordNode node, Object value) {
		Map<String, TreeValue> members = new LinkedHashMap<>();
		for (RecordMember member : node.members()) {
			Object memberValue = member.accessor().invoke(value);
			if (resolve(member.valueSpec()) instanceof OptionalSpec o && o.unwrap(memberValue) == null) {
				continue;
			}
			members.put(member.key(), encodeAny(member.valueSpec(), memberValue));
		}
		return new MappingValue(members);
	}

	private TreeValue encodePolymorphic(Object value) {
		TreeValue encoded = encodeAny(scanner.specFor(DataType.known(value.getClass())), value);
		Map<String, TreeValue> members = new LinkedHashMap<>();
		members.put(TYPE_TAG, new StringValue(value.getClass().getSimpleName()));
		members.putAll(((MappingValue) encoded).members());
		return new MappingValue(members);
	}

	private static TargetSpec variantFor(UnionSpec node, Object value) {
		for (TargetSpec variant : node.variants()) {
			Class<?> variantClass = MethodType.methodType(variant.dataType().rawClass()).wrap().returnType();
			if (variantClass.isInstance(value)) {
				return variant;
			}
		}
		throw new IllegalArgumentException("Value of " + value.getClass().getSimpleName() + " matches no variant of " + node);
	}

	private static Instant toInstant(Object value) {
		if (value instanceof OffsetDateTime t) {
			return t.toInstant();
		} else if (value instanceof ZonedDateTime t) {
			return t.toInstant();
		} else {
			return (Instant) value;
		}
	}

	private TargetSpec resolve(TargetSpec node) {
		while (node instanceof TypeRefNode ref) {
			node = scanner.typeMap().get(ref.type());
		}
		return node;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SpecInterpretingEncoder.class);
}
