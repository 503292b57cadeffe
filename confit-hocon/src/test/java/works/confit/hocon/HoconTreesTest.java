package works.confit.hocon;

import com.typesafe.config.ConfigFactory;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.confit.tree.MappingValue;
import works.confit.tree.NullValue;
import works.confit.tree.NumberValue;
import works.confit.tree.SequenceValue;
import works.confit.tree.StringValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class HoconTreesTest {

	@Test
	void testConversion() {
		var config = ConfigFactory.parseString("""
			zeta = 1
			alpha = [ x, 2.5 ]
			middle = null
			nested { b = true, a = "s" }
			""");
		MappingValue tree = (MappingValue) HoconTrees.toTree(config.root());
		assertEquals(List.of("alpha", "middle", "nested", "zeta"), List.copyOf(tree.keys()));
		assertEquals(new NumberValue(1), tree.get("zeta"));
		assertEquals(new SequenceValue(List.of(new StringValue("x"), new NumberValue(2.5))), tree.get("alpha"));
		assertSame(NullValue.INSTANCE, tree.get("middle"));
		assertEquals(List.of("a", "b"), List.copyOf(((MappingValue) tree.get("nested")).keys()));
	}

	@Test
	void testIntegersStayIntegral() {
		var config = ConfigFactory.parseString("big = 10000000000, small = 3, real = 3.0");
		MappingValue tree = (MappingValue) HoconTrees.toTree(config.root());
		assertEquals(new NumberValue(10000000000L), tree.get("big"));
		assertEquals(new NumberValue(3), tree.get("small"));
		assertFalse(((NumberValue) tree.get("real")).isIntegral());
	}
}
