package works.confit.mapping;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Period;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.confit.annotations.ConfigKey;
import works.confit.annotations.Default;
import works.confit.annotations.DefaultFactory;
import works.confit.annotations.Nullable;
import works.confit.annotations.OneOf;
import works.confit.annotations.RawValue;
import works.confit.exceptions.MissingTypeException;
import works.confit.mapping.spec.BooleanNode;
import works.confit.mapping.spec.CalendarDurationNode;
import works.confit.mapping.spec.ComputedSpec;
import works.confit.mapping.spec.DefaultLiteral;
import works.confit.mapping.spec.DefaultSpec;
import works.confit.mapping.spec.DynamicNode;
import works.confit.mapping.spec.EnumNode;
import works.confit.mapping.spec.InstantNode;
import works.confit.mapping.spec.ListNode;
import works.confit.mapping.spec.MapNode;
import works.confit.mapping.spec.MaybeNullSpec;
import works.confit.mapping.spec.NumberNode;
import works.confit.mapping.spec.OptionalNode;
import works.confit.mapping.spec.OptionalSpec;
import works.confit.mapping.spec.PolymorphicSpec;
import works.confit.mapping.spec.RecordMember;
import works.confit.mapping.spec.RecordNode;
import works.confit.mapping.spec.RepresentAsSpec;
import works.confit.mapping.spec.StringNode;
import works.confit.mapping.spec.TargetSpec;
import works.confit.mapping.spec.TypeRefNode;
import works.confit.mapping.spec.UnionSpec;
import works.confit.mapping.spec.handles.TypedHandle;
import works.confit.time.CalendarDuration;
import works.confit.tree.ConfigPath;
import works.confit.tree.NumberValue;
import works.confit.tree.StringValue;
import works.confit.tree.TreeValue;
import works.confit.types.BoundType;
import works.confit.types.DataType;
import works.confit.types.KnownType;
import works.confit.types.TypeReference;

import static java.util.stream.Collectors.joining;
import static works.confit.mapping.SubclassRegistry.TYPE_TAG;
import static works.confit.mapping.spec.InstantNode.TEMPORAL_CLASSES;
import static works.confit.mapping.spec.NumberNode.NUMBER_CLASSES;

/**
 * Reflectively walks a {@link DataType} to build the {@link TargetSpec}
 * that describes how to decode it, publishing the result to a {@link TypeMap}.
 * <p>
 * Behaviour is customizable via {@link Directive}s, which are considered in order;
 * the first one that {@link Directive#appliesTo applies to} a type supplies its spec.
 * Directives added by {@link #addDirective} and {@link #specify}
 * take precedence over earlier ones, and all of them take precedence over the built-in directives.
 * <p>
 * The scan aggressively follows any types referenced in {@link TypeRefNode}s,
 * so specs returned from directives can use those freely,
 * rather than needing to recursively specify every referenced type.
 * A type and everything it references are published together,
 * only once every one of them has been specified successfully;
 * a {@link MissingTypeException} leaves the {@link TypeMap} untouched.
 * <p>
 * The exception is {@link PolymorphicSpec}: its candidate classes aren't known
 * until decoding, so they're scanned then.
 */
public class TypeScanner {
	private final TypeMap typeMap = new TypeMap();
	private final Deque<Directive> directives = new ArrayDeque<>(); // Guarded by this

	private static final TypeScanner SHARED = new TypeScanner();

	public TypeScanner() {
		directives.addAll(builtInDirectives());
	}

	/**
	 * @return the process-wide scanner, whose {@link TypeMap} serves as the global descriptor cache
	 */
	public static TypeScanner shared() {
		return SHARED;
	}

	public TypeMap typeMap() {
		return typeMap;
	}

	public TargetSpec specFor(Class<?> type) {
		return specFor(DataType.of(type));
	}

	public TargetSpec specFor(TypeReference<?> type) {
		return specFor(DataType.of(type));
	}

	/**
	 * Returns the spec for {@code type}, first scanning it and everything it references
	 * if that hasn't already happened.
	 * Each type is scanned only once, even under concurrent use.
	 *
	 * @throws MissingTypeException if {@code type} or any type it references can't be decoded into
	 */
	public TargetSpec specFor(DataType type) {
		if (!(type instanceof KnownType known) || known.hasUnresolvedParameters()) {
			throw new MissingTypeException("Can't decode into " + type + ": type arguments must be fully specified");
		}
		TargetSpec existing = typeMap.find(known);
		if (existing != null) {
			return existing;
		}
		synchronized (this) {
			existing = typeMap.find(known);
			if (existing != null) {
				return existing;
			}
			Map<KnownType, TargetSpec> pending = new LinkedHashMap<>();
			Deque<KnownType> work = new ArrayDeque<>();
			work.add(known);
			while (!work.isEmpty()) {
				KnownType next = work.removeFirst();
				if (!pending.containsKey(next) && typeMap.find(next) == null) {
					TargetSpec spec = computeSpec(next);
					pending.put(next, spec);
					forEachRef(spec, ref -> work.addLast(ref.type()));
				}
			}
			typeMap.publish(pending);
			LOGGER.debug("Scanned {} and {} referenced type(s):\n{}", known, pending.size() - 1,
				pending.entrySet().stream()
					.map(e -> "\t" + e.getKey() + " -> " + e.getValue())
					.collect(joining("\n")));
			return typeMap.get(known);
		}
	}

	/**
	 * Indicates that the given {@code type} is to be decoded according to the given {@code spec}.
	 * Must be called before the type is first scanned.
	 *
	 * @return this
	 */
	public synchronized TypeScanner specify(KnownType type, TargetSpec spec) {
		if (typeMap.find(type) != null) {
			throw new IllegalStateException("Type " + type + " has already been scanned");
		}
		assert type.equals(spec.dataType()): "Spec for " + type + " has type " + spec.dataType();
		return addDirective(Directive.exact(type, spec));
	}

	/**
	 * Adds a directive that takes precedence over all existing ones.
	 * Has no effect on types that have already been scanned.
	 *
	 * @return this
	 */
	public synchronized TypeScanner addDirective(Directive directive) {
		directives.addFirst(directive);
		return this;
	}

	/**
	 * When scanning types, uses the given {@link Lookup} object to find {@link MethodHandle}s
	 * for any class in the same package as the {@link Lookup}'s {@linkplain Lookup#lookupClass() lookup class}.
	 *
	 * @return {@code this}
	 */
	public TypeScanner useLookup(Lookup lookup) {
		typeMap.add(lookup);
		return this;
	}

	/**
	 * A rule describing what {@link TargetSpec} to associate with certain types.
	 * <p>
	 * The {@link #spec} is a function, rather than a fixed {@link TargetSpec},
	 * giving it an opportunity to customize the spec based on the particular type
	 * being handled.
	 * The {@link #exact} factory method handles the common case of a fixed spec for a single type.
	 *
	 * @param name has no significance other than for troubleshooting
	 * @param appliesTo describes the types to which the directive applies
	 * @param spec produces the {@link TargetSpec} for a particular type;
	 *             the result's {@link TargetSpec#dataType() dataType} must be that type
	 */
	public record Directive(
		String name,
		Predicate<KnownType> appliesTo,
		Function<KnownType, TargetSpec> spec
	) {
		public static Directive exact(KnownType type, TargetSpec spec) {
			return new Directive("=" + type, type::equals, t -> spec);
		}

		/**
		 * Applies to every proper subtype of {@code base}, but not to {@code base} itself.
		 */
		public static Directive subtypesOf(Class<?> base, Function<KnownType, TargetSpec> spec) {
			return new Directive(
				"<:" + base.getSimpleName(),
				t -> t.rawClass() != base && base.isAssignableFrom(t.rawClass()),
				spec);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	private List<Directive> builtInDirectives() {
		List<Directive> result = new ArrayList<>();

		result.add(Directive.exact(DataType.known(TreeValue.class), new DynamicNode()));
		result.add(Directive.exact(DataType.STRING, new StringNode()));
		result.add(Directive.exact(DataType.BOOLEAN, new BooleanNode(boolean.class)));
		result.add(Directive.exact(DataType.known(Boolean.class), new BooleanNode(Boolean.class)));
		NUMBER_CLASSES.keySet().forEach(c ->
			result.add(Directive.exact(DataType.known(c), new NumberNode(c))));
		TEMPORAL_CLASSES.forEach(c ->
			result.add(Directive.exact(DataType.known(c), new InstantNode(c))));
		result.add(Directive.exact(DataType.known(CalendarDuration.class), new CalendarDurationNode()));

		// Standard types represented by other types
		result.add(Directive.exact(DataType.known(Duration.class), RepresentAsSpec.<Duration, CalendarDuration>as(
			new CalendarDurationNode(),
			DataType.known(Duration.class),
			CalendarDuration::of,
			CalendarDuration::toDuration)));
		result.add(Directive.exact(DataType.known(Period.class), RepresentAsSpec.<Period, CalendarDuration>as(
			new CalendarDurationNode(),
			DataType.known(Period.class),
			CalendarDuration::of,
			CalendarDuration::toPeriod)));
		result.add(Directive.exact(DataType.known(URI.class), RepresentAsSpec.<URI, String>as(
			new StringNode(),
			DataType.known(URI.class),
			URI::toString,
			URI::create)));

		// Containers
		result.add(new Directive(
			"Optional",
			t -> t.rawClass() == Optional.class,
			t -> new OptionalNode(t, new TypeRefNode(typeArgument(t, 0)))));
		result.add(new Directive(
			"List",
			t -> LIST_CLASSES.contains(t.rawClass()),
			t -> new ListNode(t, new TypeRefNode(typeArgument(t, 0)))));
		result.add(new Directive(
			"Map",
			t -> t.rawClass() == Map.class,
			t -> {
				KnownType keyType = typeArgument(t, 0);
				if (!keyType.equals(DataType.STRING)) {
					throw new MissingTypeException("Map keys must be String; can't decode into " + t);
				}
				return new MapNode(t, new TypeRefNode(typeArgument(t, 1)));
			}));

		// User-defined types
		result.add(Directive.subtypesOf(Enum.class, this::scanEnum));
		result.add(new Directive(
			"record",
			t -> t.rawClass().isRecord(),
			this::scanRecord));
		result.add(new Directive(
			"sealed interface",
			t -> t.rawClass().isInterface() && t.rawClass().isSealed(),
			this::scanSealed));
		result.add(new Directive(
			"open interface",
			t -> t.rawClass().isInterface() && !t.rawClass().getName().startsWith("java."),
			PolymorphicSpec::new));

		return result;
	}

	private TargetSpec computeSpec(KnownType type) {
		for (var directive : directives) {
			if (directive.appliesTo().test(type)) {
				LOGGER.debug("Type {} matched directive {}", type, directive);
				TargetSpec spec = directive.spec().apply(type);
				assert type.equals(spec.dataType()):
					"Expected directive " + directive + " to produce a spec of type " + type
					+ "; got " + spec.dataType();
				return spec;
			}
		}
		throw new MissingTypeException("No way to decode type " + type
			+ ": expected a scalar, collection, record, enum, or interface type");
	}

	/**
	 * Calls {@code action} for each {@link TypeRefNode} in {@code spec},
	 * not descending into the referenced types.
	 */
	private static void forEachRef(TargetSpec spec, Consumer<TypeRefNode> action) {
		if (spec instanceof TypeRefNode n) {
			action.accept(n);
		} else if (spec instanceof OptionalSpec n) {
			forEachRef(n.child(), action);
		} else if (spec instanceof ListNode n) {
			forEachRef(n.elementSpec(), action);
		} else if (spec instanceof MapNode n) {
			forEachRef(n.valueSpec(), action);
		} else if (spec instanceof RecordNode n) {
			n.members().forEach(m -> forEachRef(m.valueSpec(), action));
		} else if (spec instanceof UnionSpec n) {
			n.variants().forEach(v -> forEachRef(v, action));
		} else if (spec instanceof RepresentAsSpec n) {
			forEachRef(n.representation(), action);
		}
		// Nothing else refers to other types
	}

	private static KnownType typeArgument(KnownType type, int index) {
		if (type instanceof BoundType b && b.bindings().size() > index
			&& b.typeArgument(index) instanceof KnownType arg
			&& !arg.hasUnresolvedParameters()
		) {
			return arg;
		}
		throw new MissingTypeException("Type arguments of " + type.rawClass().getSimpleName()
			+ " must be fully specified; can't decode into " + type);
	}

	@SuppressWarnings("unchecked")
	private EnumNode scanEnum(KnownType type) {
		var enumClass = (Class<? extends Enum<?>>) type.rawClass();
		TypedHandle rawValueGetter = rawValueGetter(enumClass);
		List<EnumNode.Member> members = new ArrayList<>();
		for (Enum<?> constant : enumClass.getEnumConstants()) {
			Object rawValue = (rawValueGetter == null) ? null : rawValueGetter.invoke(constant);
			members.add(new EnumNode.Member(constant.name(), rawValue, constant));
		}
		return new EnumNode(enumClass, members);
	}

	private TypedHandle rawValueGetter(Class<? extends Enum<?>> enumClass) {
		List<AccessibleObject> annotated = Stream.<AccessibleObject>concat(
				Stream.of(enumClass.getDeclaredFields()).filter(f -> !Modifier.isStatic(f.getModifiers())),
				Stream.of(enumClass.getDeclaredMethods()).filter(m -> !Modifier.isStatic(m.getModifiers())))
			.filter(member -> member.isAnnotationPresent(RawValue.class))
			.toList();
		if (annotated.isEmpty()) {
			return null;
		} else if (annotated.size() > 1) {
			throw new MissingTypeException("Enum " + enumClass.getSimpleName() + " has more than one @RawValue: " + annotated);
		}
		MethodHandle mh;
		try {
			if (annotated.get(0) instanceof Field f) {
				mh = lookupFor(enumClass).unreflectGetter(f);
			} else {
				Method m = (Method) annotated.get(0);
				if (m.getParameterCount() != 0) {
					throw new MissingTypeException("@RawValue method " + m.getName() + " of " + enumClass.getSimpleName() + " must take no arguments");
				}
				mh = lookupFor(enumClass).unreflect(m);
			}
		} catch (IllegalAccessException e) {
			throw new MissingTypeException(ConfigPath.ROOT, "Can't access @RawValue of " + enumClass.getSimpleName(), e);
		}
		return TypedHandle.adapting(mh, DataType.OBJECT, List.of(DataType.known(enumClass)));
	}

	private TargetSpec scanSealed(KnownType type) {
		if (!(type instanceof BoundType b) || !b.bindings().isEmpty()) {
			throw new MissingTypeException("Can't decode into generic sealed type " + type);
		}
		List<TargetSpec> variants = Stream.of(type.rawClass().getPermittedSubclasses())
			.map(c -> (TargetSpec) new TypeRefNode(variantType(c, type, ConfigPath.ROOT)))
			.toList();
		return new UnionSpec(type, variants);
	}

	private static KnownType variantType(Class<?> variant, KnownType unionType, ConfigPath path) {
		if (DataType.of(variant) instanceof KnownType k && !k.hasUnresolvedParameters()) {
			return k;
		}
		throw new MissingTypeException(path, "Variant " + variant.getSimpleName() + " of " + unionType
			+ " is generic; its type arguments can't be determined");
	}

	private TargetSpec scanRecord(KnownType type) {
		if (!(type instanceof BoundType recordType)) {
			throw new MissingTypeException("Type arguments of record " + type
				+ " must be fully specified");
		}
		var actualTypeArguments = recordType.actualArguments();
		Class<?> recordClass = recordType.rawClass();
		List<RecordMember> members = new ArrayList<>();
		Set<String> keys = new HashSet<>();
		for (RecordComponent c : recordClass.getRecordComponents()) {
			RecordMember member = scanRecordComponent(recordType, c, actualTypeArguments);
			if (!keys.add(member.key())) {
				throw new MissingTypeException(ConfigPath.ROOT.member(member.key()),
					"Record " + recordType + " has more than one component with key " + member.key());
			}
			members.add(member);
		}
		return new RecordNode(members, recordFinisher(recordType, members));
	}

	private TypedHandle recordFinisher(BoundType recordType, List<RecordMember> members) {
		Class<?> recordClass = recordType.rawClass();
		Class<?>[] ctorParameterTypes = Stream.of(recordClass.getRecordComponents())
			.map(RecordComponent::getType)
			.toArray(Class<?>[]::new);
		MethodHandle constructor;
		try {
			constructor = lookupFor(recordClass).unreflectConstructor(recordClass.getDeclaredConstructor(ctorParameterTypes));
		} catch (NoSuchMethodException e) {
			throw new IllegalStateException("Unexpected error accessing record constructor for " + recordClass, e);
		} catch (IllegalAccessException e) {
			throw new MissingTypeException(ConfigPath.ROOT, "Can't access the constructor of " + recordType
				+ "; make it public or supply a Lookup with useLookup", e);
		}
		return TypedHandle.adapting(
			constructor,
			recordType,
			members.stream().map(m -> m.accessor().returnType()).toList());
	}

	private RecordMember scanRecordComponent(BoundType recordType, RecordComponent c, Map<String, DataType> recordTypeArguments) {
		ConfigKey configKey = c.getAnnotation(ConfigKey.class);
		String key = (configKey == null) ? c.getName() : configKey.value();
		ConfigPath path = ConfigPath.ROOT.member(key);
		if (TYPE_TAG.equals(key)) {
			throw new MissingTypeException(path, "Record " + recordType + " can't use the reserved key " + TYPE_TAG);
		}

		DataType type = DataType.of(c.getGenericType()).substitute(recordTypeArguments);
		if (!(type instanceof KnownType componentType) || componentType.hasUnresolvedParameters()) {
			throw new MissingTypeException(path, "Component " + c.getName() + " of " + recordType
				+ " has incomplete type " + type + "; type arguments must be fully specified");
		}

		TargetSpec valueSpec;
		OneOf oneOf = c.getAnnotation(OneOf.class);
		if (oneOf != null) {
			if (!componentType.equals(DataType.OBJECT)) {
				throw new MissingTypeException(path, "@OneOf component " + c.getName() + " of " + recordType + " must have type Object");
			} else if (oneOf.value().length == 0) {
				throw new MissingTypeException(path, "@OneOf component " + c.getName() + " of " + recordType + " lists no types");
			}
			valueSpec = new UnionSpec(DataType.OBJECT, Stream.of(oneOf.value())
				.map(v -> (TargetSpec) new TypeRefNode(variantType(v, componentType, path)))
				.toList());
		} else if (componentType.equals(DataType.OBJECT)) {
			throw new MissingTypeException(path, "Component " + c.getName() + " of " + recordType
				+ " has type Object; use @OneOf to list the types it may hold");
		} else {
			valueSpec = new TypeRefNode(componentType);
		}

		if (c.isAnnotationPresent(Nullable.class)) {
			if (componentType.rawClass().isPrimitive()) {
				throw new MissingTypeException(path, "Primitive component " + c.getName() + " of " + recordType + " can't be @Nullable");
			}
			valueSpec = new MaybeNullSpec(valueSpec);
		}

		MethodHandle mh;
		try {
			mh = lookupFor(c.getDeclaringRecord()).unreflect(c.getAccessor());
		} catch (IllegalAccessException e) {
			throw new MissingTypeException(path, "Can't access component " + c.getName() + " of " + recordType, e);
		}
		var accessor = TypedHandle.adapting(mh, componentType, List.of(recordType));

		return new RecordMember(c.getName(), key, valueSpec, accessor, defaultSpec(recordType, c, componentType, path));
	}

	private DefaultSpec defaultSpec(BoundType recordType, RecordComponent c, KnownType componentType, ConfigPath path) {
		Default literal = c.getAnnotation(Default.class);
		DefaultFactory factory = c.getAnnotation(DefaultFactory.class);
		if (literal != null && factory != null) {
			throw new MissingTypeException(path, "Component " + c.getName() + " of " + recordType
				+ " can't have both @Default and @DefaultFactory");
		} else if (literal != null) {
			return new DefaultLiteral(defaultLiteral(literal.value(), componentType));
		} else if (factory != null) {
			return new ComputedSpec(defaultFactory(recordType, factory.value(), componentType, path));
		} else {
			return null;
		}
	}

	/**
	 * Literals that look numeric become numbers if the component is numeric; all others are strings.
	 */
	private static TreeValue defaultLiteral(String text, KnownType componentType) {
		Class<?> valueClass = componentType.rawClass();
		if (valueClass == Optional.class && componentType instanceof BoundType b) {
			valueClass = b.typeArgument(0).leastUpperBoundClass();
		}
		if (NUMBER_CLASSES.containsKey(valueClass)) {
			if (INTEGER_LITERAL.matcher(text).matches()) {
				return new NumberValue(new BigInteger(text));
			} else if (DECIMAL_LITERAL.matcher(text).matches()) {
				return new NumberValue(new BigDecimal(text));
			}
		}
		return new StringValue(text);
	}

	private TypedHandle defaultFactory(BoundType recordType, String methodName, KnownType componentType, ConfigPath path) {
		Class<?> recordClass = recordType.rawClass();
		Method method;
		try {
			method = recordClass.getDeclaredMethod(methodName);
		} catch (NoSuchMethodException e) {
			throw new MissingTypeException(path, "@DefaultFactory method " + methodName
				+ " not found in " + recordType + "; it must be static and take no arguments", e);
		}
		if (!Modifier.isStatic(method.getModifiers())) {
			throw new MissingTypeException(path, "@DefaultFactory method " + methodName + " of " + recordType + " must be static");
		}
		if (!componentType.rawClass().isAssignableFrom(method.getReturnType())) {
			throw new MissingTypeException(path, "@DefaultFactory method " + methodName + " of " + recordType
				+ " returns " + method.getReturnType().getSimpleName() + ", not " + componentType);
		}
		try {
			return TypedHandle.adapting(lookupFor(recordClass).unreflect(method), componentType, List.of());
		} catch (IllegalAccessException e) {
			throw new MissingTypeException(path, "Can't access @DefaultFactory method " + methodName + " of " + recordType, e);
		}
	}

	private Lookup lookupFor(Class<?> c) {
		return typeMap.lookupFor(c);
	}

	private static final Set<Class<?>> LIST_CLASSES = Set.of(
		List.class, Collection.class, Iterable.class, Set.class);
	private static final Pattern INTEGER_LITERAL = Pattern.compile("[-+]?\\d+");
	private static final Pattern DECIMAL_LITERAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeScanner.class);
}
