package works.confit.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.confit.Confit;
import works.confit.DecodeOptions;
import works.confit.annotations.ConfigKey;
import works.confit.annotations.Default;
import works.confit.annotations.DefaultFactory;
import works.confit.annotations.Nullable;
import works.confit.annotations.OneOf;
import works.confit.annotations.RawValue;
import works.confit.exceptions.AmbiguousSubclassException;
import works.confit.exceptions.MalformedConfigException;
import works.confit.exceptions.MissingTypeException;
import works.confit.exceptions.ParseException;
import works.confit.exceptions.TypeConfigException;
import works.confit.exceptions.UnexpectedKeysException;
import works.confit.mapping.SubclassRegistry;
import works.confit.time.CalendarDuration;
import works.confit.tree.ConfigPath;
import works.confit.tree.MappingValue;
import works.confit.tree.NullValue;
import works.confit.tree.TreeValue;
import works.confit.types.TypeReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.confit.codec.TreeFixtures.mapping;

class DecoderTest {
	SubclassRegistry registry;
	Confit confit;

	@BeforeEach
	void setUp() {
		registry = new SubclassRegistry()
			.register(IntImpl.class)
			.register(StringImpl.class)
			.register(AmbigImplOne.class)
			.register(AmbigImplTwo.class);
		confit = Confit.builder().registry(registry).build();
	}

	public record Simple(String a) { }

	@Test
	void testSimple() {
		assertEquals(new Simple("test"), confit.decode(mapping("a", "test"), Simple.class));
	}

	public record WithDuration(CalendarDuration a) { }

	@Test
	void testCalendarDuration() {
		assertEquals(
			new WithDuration(CalendarDuration.of(2, ChronoUnit.DAYS)),
			confit.decode(mapping("a", "2d"), WithDuration.class));
	}

	public record StandardDurations(Duration timeout, Period retention) { }

	@Test
	void testStandardDurations() {
		assertEquals(
			new StandardDurations(Duration.ofMinutes(90), Period.ofMonths(1).plusDays(14)),
			confit.decode(mapping("timeout", "1h 30m", "retention", "1mo 2w"), StandardDurations.class));
	}

	@Test
	void testDurationWithMonths_fails() {
		var e = assertThrows(ParseException.class, () ->
			confit.decode(mapping("timeout", "1mo", "retention", "1d"), StandardDurations.class));
		assertEquals(ConfigPath.ROOT.member("timeout"), e.path());
	}

	@Test
	void testBadDuration() {
		var e = assertThrows(ParseException.class, () ->
			confit.decode(mapping("a", "2 fortnights"), WithDuration.class));
		assertEquals(".a", e.path().toString());
	}

	@Test
	void testDurationOutOfRange() {
		var e = assertThrows(ParseException.class, () ->
			confit.decode(mapping("a", "3000000000d"), WithDuration.class));
		assertEquals(".a", e.path().toString());
		assertEquals("expected type CalendarDuration at .a, Duration amount out of range in \"3000000000d\"", e.getMessage());
	}

	@Test
	void testSubSecondDuration() {
		assertEquals(
			new StandardDurations(Duration.ofMillis(1500), Period.ofDays(1)),
			confit.decode(mapping("timeout", "1s 500ms", "retention", "1d"), StandardDurations.class));
	}

	public record WithList(List<String> a) { }

	@Test
	void testList() {
		assertEquals(new WithList(List.of("test")), confit.decode(mapping("a", List.of("test")), WithList.class));
	}

	public record WithSet(Set<Integer> a) { }

	@Test
	void testSet() {
		WithSet actual = confit.decode(mapping("a", List.of(3, 1, 3, 2)), WithSet.class);
		assertEquals(List.of(3, 1, 2), List.copyOf(actual.a()));
	}

	public record WithBoolean(boolean a) { }

	@Test
	void testBoolean() {
		assertEquals(new WithBoolean(false), confit.decode(mapping("a", false), WithBoolean.class));
		assertEquals(new WithBoolean(true), confit.decode(mapping("a", "TRUE"), WithBoolean.class));
		assertThrows(ParseException.class, () -> confit.decode(mapping("a", "yes"), WithBoolean.class));
		assertThrows(MalformedConfigException.class, () -> confit.decode(mapping("a", 1), WithBoolean.class));
	}

	public record WithMap(Map<String, String> a) { }

	@Test
	void testMap() {
		assertEquals(
			new WithMap(Map.of("b", "test")),
			confit.decode(mapping("a", mapping("b", "test")), WithMap.class));
	}

	@Test
	void testMapPreservesOrder() {
		WithMap actual = confit.decode(mapping("a", mapping("z", "1", "a", "2", "m", "3")), WithMap.class);
		assertEquals(List.of("z", "a", "m"), List.copyOf(actual.a().keySet()));
	}

	public record Inner(String a) { }
	public record Outer(Inner b) { }

	@Test
	void testNested() {
		assertEquals(
			new Outer(new Inner("test")),
			confit.decode(mapping("b", mapping("a", "test")), Outer.class));
	}

	@Test
	void testNestedError_reportsPath() {
		var e = assertThrows(MalformedConfigException.class, () ->
			confit.decode(mapping("b", mapping("a", 5)), Outer.class));
		assertEquals("expected type String at .b.a, found integer", e.getMessage());
	}

	public record WithUnion(@OneOf({Inner.class, String.class}) Object b) { }

	@Test
	void testUnion() {
		assertEquals(
			new WithUnion(new Inner("test")),
			confit.decode(mapping("b", mapping("a", "test")), WithUnion.class));
		assertEquals(
			new WithUnion("test"),
			confit.decode(mapping("b", "test"), WithUnion.class));
	}

	@Test
	void testUnionFailure_listsEveryVariant() {
		var e = assertThrows(TypeConfigException.class, () ->
			confit.decode(mapping("b", 12), WithUnion.class));
		assertEquals(
			"expected type Object at .b, failed variants:\n"
				+ "- expected type Inner at .b, found integer\n"
				+ "- expected type String at .b, found integer",
			e.getMessage());
		assertEquals(2, e.causes().size());
	}

	public sealed interface Shape permits Circle, Square { }
	public record Circle(double radius) implements Shape { }
	public record Square(double side) implements Shape { }
	public record Drawing(List<Shape> shapes) { }

	@Test
	void testSealedInterface_firstMatchingVariantWins() {
		Drawing actual = confit.decode(mapping("shapes", List.of(
			mapping("radius", 1.5),
			mapping("side", 2))), Drawing.class);
		assertEquals(new Drawing(List.of(new Circle(1.5), new Square(2.0))), actual);
	}

	public record WithOptional(Optional<String> b) { }
	public record WithNullable(@Nullable String b) { }

	@Test
	void testOptional() {
		assertEquals(new WithOptional(Optional.empty()), confit.decode(MappingValue.EMPTY, WithOptional.class));
		assertEquals(new WithOptional(Optional.empty()), confit.decode(mapping("b", null), WithOptional.class));
		assertEquals(new WithOptional(Optional.of("test")), confit.decode(mapping("b", "test"), WithOptional.class));
	}

	@Test
	void testNullable() {
		assertNull(confit.decode(MappingValue.EMPTY, WithNullable.class).b());
		assertNull(confit.decode(mapping("b", null), WithNullable.class).b());
		assertEquals(new WithNullable("test"), confit.decode(mapping("b", "test"), WithNullable.class));
	}

	@Test
	void testNullForRequiredComponent() {
		var e = assertThrows(MalformedConfigException.class, () ->
			confit.decode(mapping("a", null), Simple.class));
		assertEquals("expected type String at .a, found null", e.getMessage());
	}

	public enum Color {
		RED(1), GREEN(2), BLUE(3);

		@RawValue
		final int code;

		Color(int code) {
			this.code = code;
		}
	}

	public record WithColor(Color b) { }

	@Test
	void testEnum() {
		assertEquals(new WithColor(Color.RED), confit.decode(mapping("b", "RED"), WithColor.class));
		assertEquals(new WithColor(Color.GREEN), confit.decode(mapping("b", 2), WithColor.class));
		assertEquals(new WithColor(Color.GREEN), confit.decode(mapping("b", "2"), WithColor.class));
		assertEquals(new WithColor(Color.BLUE), confit.decode(mapping("b", "3"), WithColor.class));
	}

	@Test
	void testBadEnum() {
		var e = assertThrows(ParseException.class, () -> confit.decode(mapping("b", "PURPLE"), WithColor.class));
		assertEquals("expected type Color at .b, found \"PURPLE\"; valid names are RED, GREEN, BLUE", e.getMessage());
	}

	public enum Level { LOW, HIGH }
	public record WithLevel(Level level) { }

	@Test
	void testEnumWithoutRawValues_acceptsOnlyNames() {
		assertEquals(new WithLevel(Level.HIGH), confit.decode(mapping("level", "HIGH"), WithLevel.class));
		assertThrows(ParseException.class, () -> confit.decode(mapping("level", 0), WithLevel.class));
	}

	public record WithTimestamp(Instant b) { }
	public record WithOffsetTimestamp(OffsetDateTime b) { }

	@Test
	void testTimestamp() {
		assertEquals(
			new WithTimestamp(Instant.parse("1997-07-16T18:20:07Z")),
			confit.decode(mapping("b", "1997-07-16T19:20:07+01:00"), WithTimestamp.class));
		assertEquals(
			new WithOffsetTimestamp(OffsetDateTime.of(1997, 7, 16, 18, 20, 7, 0, ZoneOffset.UTC)),
			confit.decode(mapping("b", "1997-07-16T19:20:07+01:00"), WithOffsetTimestamp.class));
	}

	@Test
	void testBadTimestamp() {
		assertThrows(ParseException.class, () ->
			confit.decode(mapping("b", "1997-07-16 19:20:0701:00"), WithTimestamp.class));
	}

	@Test
	void testTimestampWithoutOffset_fails() {
		assertThrows(ParseException.class, () ->
			confit.decode(mapping("b", "1997-07-16T19:20:07"), WithTimestamp.class));
	}

	public record Numbers(int i, long l, byte b, double d, Float f, BigInteger big, BigDecimal dec) { }

	@Test
	void testNumbers() {
		Numbers actual = confit.decode(mapping(
			"i", 7,
			"l", 8_000_000_000L,
			"b", -3,
			"d", 2,
			"f", 0.5,
			"big", new BigInteger("123456789012345678901234567890"),
			"dec", 1.25
		), Numbers.class);
		assertEquals(new Numbers(
			7, 8_000_000_000L, (byte) -3, 2.0, 0.5f,
			new BigInteger("123456789012345678901234567890"),
			new BigDecimal("1.25")), actual);
	}

	public record WithInt(int value) { }

	@Test
	void testIntegerOutOfRange() {
		var e = assertThrows(ParseException.class, () -> confit.decode(mapping("value", 3_000_000_000L), WithInt.class));
		assertEquals("expected type int at .value, 3000000000 is out of range", e.getMessage());
	}

	@Test
	void testNonIntegerForInt() {
		var e = assertThrows(ParseException.class, () -> confit.decode(mapping("value", 1.5), WithInt.class));
		assertEquals("expected type int at .value, found non-integer 1.5", e.getMessage());
	}

	public record WithDefaultFactory(@DefaultFactory("defaultNames") List<String> b) {
		static List<String> defaultNames() {
			return List.of();
		}
	}

	@Test
	void testEmptyListFromFactory() {
		assertEquals(new WithDefaultFactory(List.of()), confit.decode(MappingValue.EMPTY, WithDefaultFactory.class));
	}

	public record WithFailingFactory(@DefaultFactory("explode") String b) {
		static String explode() {
			throw new IllegalStateException("no default today");
		}
	}

	@Test
	void testFailingFactory() {
		var e = assertThrows(MalformedConfigException.class, () ->
			confit.decode(MappingValue.EMPTY, WithFailingFactory.class));
		assertEquals(".b", e.path().toString());
	}

	public record WithDefaults(
		@Default("c") String b,
		@Default("42") int answer,
		@Default("0.25") double ratio,
		@Default("30s") Duration timeout,
		@Default("HIGH") Level level
	) { }

	@Test
	void testDefaultValues() {
		assertEquals(
			new WithDefaults("c", 42, 0.25, Duration.ofSeconds(30), Level.HIGH),
			confit.decode(MappingValue.EMPTY, WithDefaults.class));
		assertEquals(
			new WithDefaults("d", 42, 0.25, Duration.ofSeconds(30), Level.LOW),
			confit.decode(mapping("b", "d", "level", "LOW"), WithDefaults.class));
	}

	public record WithOptionalDefault(@Default("fallback") Optional<String> name) { }

	@Test
	void testDefaultTakesPrecedenceOverAbsent() {
		assertEquals(
			new WithOptionalDefault(Optional.of("fallback")),
			confit.decode(MappingValue.EMPTY, WithOptionalDefault.class));
		assertEquals(
			new WithOptionalDefault(Optional.empty()),
			confit.decode(mapping("name", null), WithOptionalDefault.class));
	}

	@Test
	void testRootMap() {
		Map<String, String> actual = confit.decode(mapping("b", "c"), new TypeReference<Map<String, String>>() { });
		assertEquals(Map.of("b", "c"), actual);
	}

	@Test
	void testMissingType() {
		assertThrows(MissingTypeException.class, () -> confit.decode(MappingValue.EMPTY, Map.class));
		assertThrows(MissingTypeException.class, () -> confit.decode(MappingValue.EMPTY, List.class));
	}

	@Test
	void testMissingField() {
		var e = assertThrows(MalformedConfigException.class, () ->
			confit.decode(mapping("typo", "c"), Simple.class));
		assertEquals("expected type Simple at <root>, no a found in record", e.getMessage());
		assertEquals(".a", e.path().toString());
	}

	public record Clazz(@DefaultFactory("empty") Map<String, String> f) {
		static Map<String, String> empty() {
			return Map.of();
		}
	}

	@Test
	void testMisformat() {
		TreeValue tree = mapping(
			"b", MappingValue.EMPTY,
			"c", mapping(
				"f", MappingValue.EMPTY,
				"d", MappingValue.EMPTY));
		var e = assertThrows(UnexpectedKeysException.class, () ->
			confit.decode(tree, new TypeReference<Map<String, Clazz>>() { }));
		assertEquals(List.of("d"), e.keys());
		assertEquals(".c", e.path().toString());
	}

	@Test
	void testIgnoreUnexpected() {
		TreeValue tree = mapping("a", "hello", "b", "world");
		var e = assertThrows(UnexpectedKeysException.class, () -> confit.decode(tree, Simple.class));
		assertEquals("unexpected key(s) \"b\" detected for type Simple at <root>", e.getMessage());

		Confit lenient = confit.withOptions(DecodeOptions.LENIENT);
		assertEquals(new Simple("hello"), lenient.decode(tree, Simple.class));
	}

	public record Renamed(@ConfigKey("display-name") String displayName) { }

	@Test
	void testConfigKey() {
		assertEquals(new Renamed("Foo"), confit.decode(mapping("display-name", "Foo"), Renamed.class));
		assertThrows(UnexpectedKeysException.class, () ->
			confit.decode(mapping("display-name", "Foo", "displayName", "Bar"), Renamed.class));
	}

	public interface InputType {
		String describe();
	}

	public record StringImpl(String name, String age) implements InputType {
		@Override
		public String describe() {
			return name + " is " + age + " years old.";
		}
	}

	public record IntImpl(@ConfigKey("area_code") int areaCode, @ConfigKey("phone_num") String phoneNum) implements InputType {
		@Override
		public String describe() {
			return "The area code for " + phoneNum + " is " + areaCode;
		}
	}

	public record Base(String location, @ConfigKey("input_source") InputType inputSource) { }

	@Test
	void testTraitsStringImpl() {
		Base actual = confit.decode(mapping(
			"location", "Europe",
			"input_source", mapping("name", "Thailand", "age", "12")
		), Base.class);
		assertEquals(new Base("Europe", new StringImpl("Thailand", "12")), actual);
		assertEquals("Thailand is 12 years old.", actual.inputSource().describe());
	}

	@Test
	void testTraitsIntImpl() {
		Base actual = confit.decode(mapping(
			"location", "Europe",
			"input_source", mapping("area_code", 94, "phone_num", "1234567")
		), Base.class);
		assertEquals(new Base("Europe", new IntImpl(94, "1234567")), actual);
		assertEquals("The area code for 1234567 is 94", actual.inputSource().describe());
	}

	@Test
	void testTraitsFailure() {
		TreeValue tree = mapping(
			"location", "Europe",
			"input_source", mapping("name", "Thailand", "age", "12", "city", "Paris"));
		var e = assertThrows(TypeConfigException.class, () -> confit.decode(tree, Base.class));
		assertEquals(
			"expected type InputType at .input_source, failed subclasses:\n"
				+ "- expected type IntImpl at .input_source, no area_code found in record\n"
				+ "- unexpected key(s) \"city\" detected for type StringImpl at .input_source",
			e.getMessage());
	}

	public interface AmbigImplBase { }
	public record AmbigImplOne(String bar) implements AmbigImplBase { }
	public record AmbigImplTwo(String bar) implements AmbigImplBase { }
	public record AmbigHolder(String a, AmbigImplBase foo) { }

	@Test
	void testTraitsAmbiguous() {
		var e = assertThrows(AmbiguousSubclassException.class, () -> confit.decode(mapping(
			"a", "Europe",
			"foo", mapping("bar", "Baz")
		), AmbigHolder.class));
		assertEquals(
			"multiple subtypes of AmbigImplBase matched at .foo, use '_type' to disambiguate:\n"
				+ "- AmbigImplOne\n"
				+ "- AmbigImplTwo",
			e.getMessage());

		AmbigHolder actual = confit.decode(mapping(
			"a", "Europe",
			"foo", mapping("_type", "AmbigImplTwo", "bar", "Baz")
		), AmbigHolder.class);
		assertInstanceOf(AmbigImplTwo.class, actual.foo());
	}

	@Test
	void testTypeTagAcceptsQualifiedName() {
		AmbigHolder actual = confit.decode(mapping(
			"a", "Europe",
			"foo", mapping("_type", AmbigImplOne.class.getName(), "bar", "Baz")
		), AmbigHolder.class);
		assertEquals(new AmbigImplOne("Baz"), actual.foo());
	}

	@Test
	void testUnknownTypeTag() {
		var e = assertThrows(TypeConfigException.class, () -> confit.decode(mapping(
			"a", "Europe",
			"foo", mapping("_type", "AmbigImplThree", "bar", "Baz")
		), AmbigHolder.class));
		assertEquals(
			"expected type AmbigImplBase at .foo, unknown _type \"AmbigImplThree\"; expected one of [AmbigImplOne, AmbigImplTwo]",
			e.getMessage());
	}

	public interface Unregistered { }
	public record UnregisteredHolder(Unregistered thing) { }

	@Test
	void testNoRegisteredSubclasses() {
		var e = assertThrows(TypeConfigException.class, () ->
			confit.decode(mapping("thing", MappingValue.EMPTY), UnregisteredHolder.class));
		assertEquals("expected type Unregistered at .thing, no subclasses are registered", e.getMessage());
	}

	public record WithDynamic(TreeValue foo) { }

	@Test
	void testDynamic() {
		assertEquals(TreeValue.of(List.of(1, 2)), confit.decode(mapping("foo", List.of(1, 2)), WithDynamic.class).foo());
		assertEquals(mapping("a", 1), confit.decode(mapping("foo", mapping("a", 1)), WithDynamic.class).foo());
		assertEquals(TreeValue.of(1), confit.decode(mapping("foo", 1), WithDynamic.class).foo());
		assertEquals(TreeValue.of("test"), confit.decode(mapping("foo", "test"), WithDynamic.class).foo());
	}

	@Test
	void testDynamicKeepsNulls() {
		assertSame(NullValue.INSTANCE, confit.decode(mapping("foo", null), WithDynamic.class).foo());
		assertEquals(mapping("a", null), confit.decode(mapping("foo", mapping("a", null)), WithDynamic.class).foo());
	}

	@Test
	void testNestedDynamic() {
		TreeValue inner = mapping("a", mapping("b", List.of("c", mapping("d", 1))));
		Map<String, TreeValue> actual = confit.decode(inner, new TypeReference<Map<String, TreeValue>>() { });
		assertEquals(mapping("b", List.of("c", mapping("d", 1))), actual.get("a"));
	}

	@Test
	void testListOfDynamic() {
		List<TreeValue> actual = confit.decode(
			TreeValue.of(List.of(mapping("a", 1), List.of(2))),
			new TypeReference<List<TreeValue>>() { });
		assertEquals(List.of(mapping("a", 1), TreeValue.of(List.of(2))), actual);
	}

	public record Node(String name, List<Node> children) { }

	@Test
	void testRecursiveType() {
		Node actual = confit.decode(mapping(
			"name", "root",
			"children", List.of(mapping("name", "leaf", "children", List.of()))
		), Node.class);
		assertEquals(new Node("root", List.of(new Node("leaf", List.of()))), actual);
	}

	@Test
	void testDepthLimit() {
		TreeValue tree = mapping("name", "leaf", "children", List.of());
		for (int i = 0; i < 10; i++) {
			tree = mapping("name", "n" + i, "children", List.of(tree));
		}
		TreeValue deep = tree;
		Confit shallow = confit.withOptions(DecodeOptions.DEFAULT.withMaxDepth(10));
		var e = assertThrows(MalformedConfigException.class, () -> shallow.decode(deep, Node.class));
		LOGGER.debug("Depth limit message: {}", e.getMessage());
		assertEquals(11, countLevels(confit.decode(deep, Node.class)));
	}

	private static int countLevels(Node node) {
		return node.children().isEmpty() ? 1 : 1 + countLevels(node.children().get(0));
	}

	public record Validated(int port) {
		public Validated {
			if (port <= 0) {
				throw new IllegalArgumentException("port must be positive");
			}
		}
	}

	@Test
	void testConstructorFailure() {
		var e = assertThrows(MalformedConfigException.class, () -> confit.decode(mapping("port", -1), Validated.class));
		assertEquals("expected type Validated at <root>, construction failed: port must be positive", e.getMessage());
	}

	@Test
	void testWrongShapeAtRoot() {
		var e = assertThrows(MalformedConfigException.class, () -> confit.decode(TreeValue.of("hello"), Simple.class));
		assertEquals("expected type Simple at <root>, found string", e.getMessage());
	}

	@Test
	void testFailuresAreRepeatable() {
		TreeValue bad = mapping("a", List.of("x", 5));
		var first = assertThrows(MalformedConfigException.class, () -> confit.decode(bad, WithList.class));
		var second = assertThrows(MalformedConfigException.class, () -> confit.decode(bad, WithList.class));
		assertEquals(first.getMessage(), second.getMessage());
		assertEquals(first.path(), second.path());

		TreeValue ambiguous = mapping("a", "Europe", "foo", mapping("bar", "Baz"));
		var third = assertThrows(AmbiguousSubclassException.class, () -> confit.decode(ambiguous, AmbigHolder.class));
		var fourth = assertThrows(AmbiguousSubclassException.class, () -> confit.decode(ambiguous, AmbigHolder.class));
		assertEquals(third.getMessage(), fourth.getMessage());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DecoderTest.class);
}
