package works.confit.codec.interpreter;

import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.confit.DecodeOptions;
import works.confit.codec.Decoder;
import works.confit.exceptions.AmbiguousSubclassException;
import works.confit.exceptions.ConfigException;
import works.confit.exceptions.MalformedConfigException;
import works.confit.exceptions.MissingTypeException;
import works.confit.exceptions.ParseException;
import works.confit.exceptions.TypeConfigException;
import works.confit.exceptions.UnexpectedKeysException;
import works.confit.mapping.SubclassRegistry;
import works.confit.mapping.TypeScanner;
import works.confit.mapping.spec.BooleanNode;
import works.confit.mapping.spec.CalendarDurationNode;
import works.confit.mapping.spec.ComputedSpec;
import works.confit.mapping.spec.DefaultLiteral;
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
import works.confit.mapping.spec.ScalarSpec;
import works.confit.mapping.spec.StringNode;
import works.confit.mapping.spec.TargetSpec;
import works.confit.mapping.spec.TypeRefNode;
import works.confit.mapping.spec.UnionSpec;
import works.confit.time.CalendarDuration;
import works.confit.tree.BooleanValue;
import works.confit.tree.ConfigPath;
import works.confit.tree.MappingValue;
import works.confit.tree.NullValue;
import works.confit.tree.NumberValue;
import works.confit.tree.SequenceValue;
import works.confit.tree.StringValue;
import works.confit.tree.TreeValue;
import works.confit.types.DataType;
import works.confit.types.KnownType;

import static java.time.format.DateTimeFormatter.ISO_DATE_TIME;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static works.confit.mapping.SubclassRegistry.TYPE_TAG;

/**
 * Decodes a {@link TreeValue} by walking the given {@link TargetSpec} tree alongside it.
 * <p>
 * Decoding is a pure function of the tree, the spec, the options,
 * and the {@link SubclassRegistry} candidates at the time of the call:
 * nothing is mutated, and the same inputs always give the same result or the same exception.
 */
public class SpecInterpretingDecoder implements Decoder {
	final TargetSpec spec;
	final TypeScanner scanner;
	final SubclassRegistry registry;
	final DecodeOptions options;

	public SpecInterpretingDecoder(TargetSpec spec, TypeScanner scanner, SubclassRegistry registry, DecodeOptions options) {
		this.spec = requireNonNull(spec);
		this.scanner = requireNonNull(scanner);
		this.registry = requireNonNull(registry);
		this.options = requireNonNull(options);
	}

	@Override
	public Object decode(TreeValue root) {
		return new DecodeSession().decodeAny(spec, requireNonNull(root), ConfigPath.ROOT, 0);
	}

	/**
	 * A single decoding operation.
	 * <p>
	 * The {@code depth} passed around counts the sequences and mappings
	 * enclosing the current value, not the spec nodes traversed.
	 */
	private class DecodeSession {
		Object decodeAny(TargetSpec node, TreeValue value, ConfigPath path, int depth) {
			LOGGER.trace("decodeAny({}, {})", path, node);
			if (depth > options.maxDepth()) {
				throw new MalformedConfigException(path, "exceeded maximum nesting depth of " + options.maxDepth() + " at " + path.describe());
			}
			if (node instanceof TypeRefNode n) {
				return decodeAny(scanner.typeMap().get(n.type()), value, path, depth);
			} else if (node instanceof OptionalSpec n) {
				return (value instanceof NullValue)
					? n.absentValue()
					: n.wrap(decodeAny(n.child(), value, path, depth));
			} else if (node instanceof DynamicNode) {
				return value;
			} else if (value instanceof NullValue) {
				throw malformed(node, path, "found null");
			} else if (node instanceof ScalarSpec n) {
				return decodeScalar(n, value, path);
			} else if (node instanceof ListNode n) {
				return decodeList(n, value, path, depth);
			} else if (node instanceof MapNode n) {
				return decodeMap(n, value, path, depth);
			} else if (node instanceof RecordNode n) {
				return decodeRecord(n, value, path, depth);
			} else if (node instanceof UnionSpec n) {
				return decodeUnion(n, value, path, depth);
			} else if (node instanceof PolymorphicSpec n) {
				return decodePolymorphic(n, value, path, depth);
			} else if (node instanceof RepresentAsSpec n) {
				return decodeAndConvert(n, value, path, depth);
			}
			throw new IllegalStateException("Unexpected spec node " + node);
		}

		private Object decodeScalar(ScalarSpec node, TreeValue value, ConfigPath path) {
			if (node instanceof StringNode) {
				if (value instanceof StringValue s) {
					return s.value();
				}
			} else if (node instanceof BooleanNode) {
				if (value instanceof BooleanValue b) {
					return b.value();
				} else if (value instanceof StringValue s) {
					if (s.value().equalsIgnoreCase("true")) {
						return true;
					} else if (s.value().equalsIgnoreCase("false")) {
						return false;
					} else {
						throw new ParseException(path, expected(node, path) + ", found \"" + s.value() + "\"");
					}
				}
			} else if (node instanceof NumberNode n) {
				if (value instanceof NumberValue v) {
					return decodeNumber(n, v, path);
				}
			} else if (node instanceof InstantNode n) {
				if (value instanceof StringValue s) {
					return decodeTimestamp(n, s.value(), path);
				}
			} else if (node instanceof CalendarDurationNode) {
				if (value instanceof StringValue s) {
					try {
						return CalendarDuration.parse(s.value());
					} catch (IllegalArgumentException e) {
						throw new ParseException(path, expected(node, path) + ", " + e.getMessage(), e);
					}
				}
			} else if (node instanceof EnumNode n) {
				if (value instanceof StringValue || value instanceof NumberValue || value instanceof BooleanValue) {
					return decodeEnum(n, value, path);
				}
			}
			throw malformed(node, path, "found " + value.shape());
		}

		private Object decodeNumber(NumberNode node, NumberValue value, ConfigPath path) {
			Class<?> c = node.numberClass();
			if (node.isIntegral()) {
				if (!value.isIntegral()) {
					throw new ParseException(path, expected(node, path) + ", found non-integer " + value);
				}
				BigInteger big = value.bigIntegerValue();
				if (c == BigInteger.class) {
					return big;
				}
				var range = INTEGRAL_RANGES.get(c);
				if (big.compareTo(range[0]) < 0 || big.compareTo(range[1]) > 0) {
					throw new ParseException(path, expected(node, path) + ", " + value + " is out of range");
				}
				if (c == byte.class || c == Byte.class) {
					return big.byteValue();
				} else if (c == short.class || c == Short.class) {
					return big.shortValue();
				} else if (c == int.class || c == Integer.class) {
					return big.intValue();
				} else {
					return big.longValue();
				}
			} else if (c == float.class || c == Float.class) {
				return value.value().floatValue();
			} else if (c == double.class || c == Double.class) {
				return value.value().doubleValue();
			} else {
				try {
					return value.bigDecimalValue();
				} catch (NumberFormatException e) {
					throw new ParseException(path, expected(node, path) + ", found " + value, e);
				}
			}
		}

		private Object decodeTimestamp(InstantNode node, String text, ConfigPath path) {
			Instant instant;
			try {
				instant = ZonedDateTime.parse(text, ISO_DATE_TIME).toInstant();
			} catch (DateTimeParseException e) {
				throw new ParseException(path, expected(node, path) + ", can't parse \"" + text
					+ "\" as an ISO-8601 timestamp with offset", e);
			}
			Class<?> c = node.temporalClass();
			if (c == Instant.class) {
				return instant;
			} else if (c == OffsetDateTime.class) {
				return instant.atOffset(ZoneOffset.UTC);
			} else {
				return instant.atZone(ZoneOffset.UTC);
			}
		}

		/**
		 * Names take precedence over raw values.
		 */
		private Object decodeEnum(EnumNode node, TreeValue value, ConfigPath path) {
			if (value instanceof StringValue s) {
				for (var member : node.members()) {
					if (member.name().equals(s.value())) {
						return member.constant();
					}
				}
			}
			for (var member : node.members()) {
				if (rawValueMatches(member.rawValue(), value)) {
					return member.constant();
				}
			}
			throw new ParseException(path, expected(node, path) + ", found " + value
				+ "; valid names are " + node.members().stream().map(EnumNode.Member::name).collect(joining(", ")));
		}

		private Object decodeList(ListNode node, TreeValue value, ConfigPath path, int depth) {
			if (!(value instanceof SequenceValue sequence)) {
				throw malformed(node, path, "found " + value.shape());
			}
			Collection<Object> result = node.isSet() ? new LinkedHashSet<>() : new ArrayList<>();
			for (int i = 0; i < sequence.size(); i++) {
				result.add(decodeAny(node.elementSpec(), sequence.get(i), path.index(i), depth + 1));
			}
			return node.isSet()
				? unmodifiableSet((Set<Object>) result)
				: unmodifiableList((List<Object>) result);
		}

		private Object decodeMap(MapNode node, TreeValue value, ConfigPath path, int depth) {
			if (!(value instanceof MappingValue mapping)) {
				throw malformed(node, path, "found " + value.shape());
			}
			Map<String, Object> result = new LinkedHashMap<>();
			mapping.members().forEach((key, member) ->
				result.put(key, decodeAny(node.valueSpec(), member, path.member(key), depth + 1)));
			return unmodifiableMap(result);
		}

		/**
		 * Components are decoded in declaration order, and the first failure is thrown.
		 * Leftover keys are checked only once every component has succeeded.
		 */
		private Object decodeRecord(RecordNode node, TreeValue value, ConfigPath path, int depth) {
			if (!(value instanceof MappingValue mapping)) {
				throw malformed(node, path, "found " + value.shape());
			}
			List<RecordMember> members = node.members();
			Object[] args = new Object[members.size()];
			Set<String> consumed = new HashSet<>();
			for (int i = 0; i < args.length; i++) {
				RecordMember member = members.get(i);
				TreeValue memberValue = mapping.get(member.key());
				ConfigPath memberPath = path.member(member.key());
				if (memberValue == null) {
					args[i] = decodeAbsent(node, member, path, depth);
				} else {
					consumed.add(member.key());
					args[i] = decodeAny(member.valueSpec(), memberValue, memberPath, depth + 1);
				}
			}

			TreeSet<String> leftovers = new TreeSet<>(mapping.keys());
			leftovers.removeAll(consumed);
			if (!leftovers.isEmpty()) {
				if (options.strictUnexpectedKeys()) {
					throw new UnexpectedKeysException(path, node.dataType(), leftovers);
				} else {
					LOGGER.debug("Ignoring unexpected key(s) {} for type {} at {}", leftovers, node.dataType(), path.describe());
				}
			}

			try {
				return node.finisher().invoke(args);
			} catch (ConfigException e) {
				throw e;
			} catch (RuntimeException e) {
				throw new MalformedConfigException(path, expected(node, path) + ", construction failed: " + e.getMessage(), e);
			}
		}

		/**
		 * A default takes precedence over the absent value of an optional component.
		 */
		private Object decodeAbsent(RecordNode node, RecordMember member, ConfigPath recordPath, int depth) {
			ConfigPath memberPath = recordPath.member(member.key());
			if (member.defaultSpec() instanceof DefaultLiteral d) {
				LOGGER.trace("Using default {} at {}", d, memberPath);
				return decodeAny(member.valueSpec(), d.literal(), memberPath, depth + 1);
			} else if (member.defaultSpec() instanceof ComputedSpec d) {
				LOGGER.trace("Computing default at {}", memberPath);
				try {
					return d.supplier().invoke();
				} catch (RuntimeException e) {
					throw new MalformedConfigException(memberPath, "default for " + member.key()
						+ " of " + node.dataType() + " failed: " + e.getMessage(), e);
				}
			} else if (resolve(member.valueSpec()) instanceof OptionalSpec o) {
				return o.absentValue();
			} else {
				throw new MalformedConfigException(memberPath, expected(node, recordPath)
					+ ", no " + member.key() + " found in record");
			}
		}

		/**
		 * The first variant that succeeds wins; later variants aren't attempted.
		 */
		private Object decodeUnion(UnionSpec node, TreeValue value, ConfigPath path, int depth) {
			List<ConfigException> failures = new ArrayList<>();
			for (TargetSpec variant : node.variants()) {
				try {
					return decodeAny(variant, value, path, depth);
				} catch (MissingTypeException e) {
					throw e;
				} catch (ConfigException e) {
					LOGGER.trace("Variant {} failed at {}", variant, path, e);
					failures.add(e);
				}
			}
			throw new TypeConfigException(path, node.dataType(), "variants", failures);
		}

		/**
		 * Unlike a union, exactly one candidate must succeed,
		 * unless the value names its candidate explicitly.
		 */
		private Object decodePolymorphic(PolymorphicSpec node, TreeValue value, ConfigPath path, int depth) {
			KnownType baseType = node.dataType();
			List<Class<?>> candidates = registry.candidatesFor(baseType.rawClass());
			if (value instanceof MappingValue mapping && mapping.containsKey(TYPE_TAG)) {
				Class<?> chosen = chooseCandidate(node, candidates, mapping.get(TYPE_TAG), path);
				LOGGER.debug("Value at {} names subclass {}", path.describe(), chosen.getSimpleName());
				try {
					return decodeCandidate(chosen, mapping.without(TYPE_TAG), path, depth);
				} catch (MissingTypeException e) {
					throw e;
				} catch (ConfigException e) {
					throw new TypeConfigException(path, baseType, "subclasses", List.of(e));
				}
			}
			if (candidates.isEmpty()) {
				throw new TypeConfigException(path, baseType, "no subclasses are registered");
			}

			List<Object> successes = new ArrayList<>();
			List<KnownType> matches = new ArrayList<>();
			List<ConfigException> failures = new ArrayList<>();
			for (Class<?> candidate : candidates) {
				try {
					successes.add(decodeCandidate(candidate, value, path, depth));
					matches.add(DataType.known(candidate));
				} catch (MissingTypeException e) {
					throw e;
				} catch (ConfigException e) {
					LOGGER.trace("Subclass {} failed at {}", candidate.getSimpleName(), path, e);
					failures.add(e);
				}
			}
			LOGGER.debug("{} of {} subclass(es) of {} matched at {}", matches.size(), candidates.size(), baseType, path.describe());
			if (matches.size() == 1) {
				return successes.get(0);
			} else if (matches.isEmpty()) {
				throw new TypeConfigException(path, baseType, "subclasses", failures);
			} else {
				throw new AmbiguousSubclassException(path, baseType, matches);
			}
		}

		private Class<?> chooseCandidate(PolymorphicSpec node, List<Class<?>> candidates, TreeValue tag, ConfigPath path) {
			ConfigPath tagPath = path.member(TYPE_TAG);
			if (!(tag instanceof StringValue name)) {
				throw new MalformedConfigException(tagPath, "expected type String at " + tagPath.describe() + ", found " + tag.shape());
			}
			for (Class<?> candidate : candidates) {
				if (candidate.getSimpleName().equals(name.value()) || candidate.getName().equals(name.value())) {
					return candidate;
				}
			}
			throw new TypeConfigException(path, node.dataType(), "unknown " + TYPE_TAG + " \"" + name.value()
				+ "\"; expected one of [" + candidates.stream().map(Class::getSimpleName).collect(joining(", ")) + "]");
		}

		private Object decodeCandidate(Class<?> candidate, TreeValue value, ConfigPath path, int depth) {
			return decodeAny(scanner.specFor(DataType.known(candidate)), value, path, depth);
		}

		private Object decodeAndConvert(RepresentAsSpec node, TreeValue value, ConfigPath path, int depth) {
			Object representation = decodeAny(node.representation(), value, path, depth);
			try {
				return node.fromRepresentation().invoke(representation);
			} catch (ConfigException e) {
				throw e;
			} catch (RuntimeException e) {
				throw new ParseException(path, expected(node, path) + ", " + e.getMessage(), e);
			}
		}

		private TargetSpec resolve(TargetSpec node) {
			while (node instanceof TypeRefNode ref) {
				node = scanner.typeMap().get(ref.type());
			}
			return node;
		}
	}

	private static boolean rawValueMatches(Object rawValue, TreeValue value) {
		if (rawValue == null) {
			return false;
		} else if (value instanceof NumberValue n) {
			return rawValue instanceof Number raw && n.numericallyEquals(raw);
		} else if (value instanceof StringValue s) {
			return s.value().equals(String.valueOf(rawValue));
		} else if (value instanceof BooleanValue b) {
			return rawValue.equals(b.value());
		} else {
			return false;
		}
	}

	private static String expected(TargetSpec node, ConfigPath path) {
		return "expected type " + node.dataType() + " at " + path.describe();
	}

	private static MalformedConfigException malformed(TargetSpec node, ConfigPath path, String found) {
		return new MalformedConfigException(path, expected(node, path) + ", " + found);
	}

	private static final Map<Class<?>, BigInteger[]> INTEGRAL_RANGES = Map.of(
		byte.class, range(Byte.MIN_VALUE, Byte.MAX_VALUE),
		Byte.class, range(Byte.MIN_VALUE, Byte.MAX_VALUE),
		short.class, range(Short.MIN_VALUE, Short.MAX_VALUE),
		Short.class, range(Short.MIN_VALUE, Short.MAX_VALUE),
		int.class, range(Integer.MIN_VALUE, Integer.MAX_VALUE),
		Integer.class, range(Integer.MIN_VALUE, Integer.MAX_VALUE),
		long.class, range(Long.MIN_VALUE, Long.MAX_VALUE),
		Long.class, range(Long.MIN_VALUE, Long.MAX_VALUE)
	);

	private static BigInteger[] range(long min, long max) {
		return new BigInteger[] { BigInteger.valueOf(min), BigInteger.valueOf(max) };
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SpecInterpretingDecoder.class);
}
