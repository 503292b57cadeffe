package works.confit.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A numeric scalar.
 * The number is kept exactly as the format parser produced it;
 * whether it counts as an integer literal is determined by its class.
 */
public record NumberValue(Number value) implements TreeValue {
	public NumberValue {
		requireNonNull(value);
	}

	/**
	 * @return true if the literal was an integer, as opposed to a floating-point number
	 */
	public boolean isIntegral() {
		return INTEGRAL_CLASSES.contains(value.getClass());
	}

	public BigInteger bigIntegerValue() {
		if (value instanceof BigInteger b) {
			return b;
		} else {
			assert isIntegral();
			return BigInteger.valueOf(value.longValue());
		}
	}

	public BigDecimal bigDecimalValue() {
		if (value instanceof BigDecimal b) {
			return b;
		} else if (value instanceof BigInteger b) {
			return new BigDecimal(b);
		} else if (isIntegral()) {
			return BigDecimal.valueOf(value.longValue());
		} else {
			return new BigDecimal(value.toString());
		}
	}

	/**
	 * Numeric equality that ignores the class of the number,
	 * so {@code 2}, {@code 2L} and {@code 2.0} are all equal.
	 */
	public boolean numericallyEquals(Number other) {
		try {
			return bigDecimalValue().compareTo(new NumberValue(other).bigDecimalValue()) == 0;
		} catch (NumberFormatException e) {
			// NaN and infinities
			return value.equals(other);
		}
	}

	@Override
	public String shape() {
		return isIntegral() ? "integer" : "number";
	}

	@Override
	public String toString() {
		return value.toString();
	}

	private static final Set<Class<?>> INTEGRAL_CLASSES = Set.of(
		Byte.class, Short.class, Integer.class, Long.class, BigInteger.class);
}
