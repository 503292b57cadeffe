package works.confit.time;

import java.time.Duration;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;
import static java.util.Objects.requireNonNull;

/**
 * A relative span of time mixing calendar units (years, months, days)
 * with clock units (hours, minutes, seconds).
 * <p>
 * Unlike {@link Duration}, a month or a year here is not a fixed number of seconds;
 * its length depends on the {@link Temporal} it is {@link #addTo added to}.
 * Weeks are kept as seven days.
 *
 * @param datePart the years, months and days
 * @param timePart the hours, minutes and seconds
 */
public record CalendarDuration(Period datePart, Duration timePart) {
	public static final CalendarDuration ZERO = new CalendarDuration(Period.ZERO, Duration.ZERO);

	public CalendarDuration {
		requireNonNull(datePart);
		requireNonNull(timePart);
	}

	public static CalendarDuration of(long amount, ChronoUnit unit) {
		return switch (unit) {
			case YEARS -> new CalendarDuration(Period.ofYears(Math.toIntExact(amount)), Duration.ZERO);
			case MONTHS -> new CalendarDuration(Period.ofMonths(Math.toIntExact(amount)), Duration.ZERO);
			case WEEKS -> new CalendarDuration(Period.ofWeeks(Math.toIntExact(amount)), Duration.ZERO);
			case DAYS -> new CalendarDuration(Period.ofDays(Math.toIntExact(amount)), Duration.ZERO);
			case HOURS, MINUTES, SECONDS, MILLIS, MICROS, NANOS -> new CalendarDuration(Period.ZERO, Duration.of(amount, unit));
			default -> throw new IllegalArgumentException("Unsupported unit for a calendar duration: " + unit);
		};
	}

	public static CalendarDuration of(Duration duration) {
		return new CalendarDuration(Period.ZERO, duration);
	}

	public static CalendarDuration of(Period period) {
		return new CalendarDuration(period, Duration.ZERO);
	}

	/**
	 * Parses one or more {@code <integer><unit>} groups, like {@code 2d} or {@code 1y 6mo}.
	 * Any group may be preceded by a sign, which applies to that group and every later
	 * unsigned group, so {@code -1d 6h} is minus thirty hours while {@code -1d+6h} is minus eighteen.
	 *
	 * @throws IllegalArgumentException if {@code text} isn't in that form,
	 * or an amount is too large for its unit
	 */
	public static CalendarDuration parse(CharSequence text) {
		String s = text.toString().strip();
		if (s.isEmpty()) {
			throw new IllegalArgumentException("Empty duration");
		}
		if (!WHOLE.matcher(s).matches()) {
			throw new IllegalArgumentException("Unrecognized duration \"" + text + "\"; expected something like \"2d\" or \"1h 30m\"");
		}
		CalendarDuration result = ZERO;
		boolean negative = false;
		Matcher m = GROUP.matcher(s);
		while (m.find()) {
			if (m.group(1) != null) {
				negative = m.group(1).equals("-");
			}
			String unitName = m.group(3).toLowerCase(Locale.ROOT);
			ChronoUnit unit = UNITS.get(unitName);
			if (unit == null) {
				throw new IllegalArgumentException("Unrecognized duration unit \"" + m.group(3) + "\" in \"" + text + "\"");
			}
			try {
				long amount = Long.parseLong(m.group(2));
				result = result.plus(of(negative ? -amount : amount, unit));
			} catch (NumberFormatException | ArithmeticException e) {
				throw new IllegalArgumentException("Duration amount out of range in \"" + text + "\"", e);
			}
		}
		return result;
	}

	public CalendarDuration plus(CalendarDuration other) {
		return new CalendarDuration(datePart.plus(other.datePart), timePart.plus(other.timePart));
	}

	public CalendarDuration negated() {
		return new CalendarDuration(datePart.negated(), timePart.negated());
	}

	public boolean isZero() {
		return datePart.isZero() && timePart.isZero();
	}

	/**
	 * Date part first, then time part, as {@link java.time.LocalDateTime#plus} would do it.
	 */
	public Temporal addTo(Temporal temporal) {
		return temporal.plus(datePart).plus(timePart);
	}

	public Temporal subtractFrom(Temporal temporal) {
		return temporal.minus(datePart).minus(timePart);
	}

	/**
	 * @throws ArithmeticException if there's a nonzero month or year component,
	 * which has no fixed length; days are taken as 24 hours
	 */
	public Duration toDuration() {
		if (datePart.getYears() != 0 || datePart.getMonths() != 0) {
			throw new ArithmeticException("Can't convert " + this + " to a Duration: months and years have no fixed length");
		}
		return Duration.ofDays(datePart.getDays()).plus(timePart);
	}

	/**
	 * @throws ArithmeticException if the time part is not a whole number of days
	 */
	public Period toPeriod() {
		if (!timePart.equals(Duration.ofDays(timePart.toDays()))) {
			throw new ArithmeticException("Can't convert " + this + " to a Period: time part is not a whole number of days");
		}
		return datePart.plusDays(timePart.toDays());
	}

	/**
	 * @return the compact form accepted by {@link #parse}, such as {@code 1y2mo3d4h5m6s250ms};
	 * zero is {@code 0s}. A sign is written only where it differs from the previous group's.
	 */
	@Override
	public String toString() {
		if (isZero()) {
			return "0s";
		}
		LiteralBuilder literal = new LiteralBuilder();
		literal.append(datePart.getYears(), "y");
		literal.append(datePart.getMonths(), "mo");
		literal.append(datePart.getDays(), "d");
		int timeSign = timePart.isNegative() ? -1 : 1;
		Duration magnitude = timePart.abs();
		literal.append(timeSign * magnitude.toHours(), "h");
		literal.append(timeSign * magnitude.toMinutesPart(), "m");
		literal.append(timeSign * magnitude.toSecondsPart(), "s");
		long nanos = timeSign * magnitude.toNanosPart();
		if (nanos % 1_000_000 == 0) {
			literal.append(nanos / 1_000_000, "ms");
		} else if (nanos % 1_000 == 0) {
			literal.append(nanos / 1_000, "us");
		} else {
			literal.append(nanos, "ns");
		}
		return literal.toString();
	}

	private static final class LiteralBuilder {
		private final StringBuilder sb = new StringBuilder();
		private boolean negative = false;

		void append(long amount, String unit) {
			if (amount == 0) {
				return;
			}
			if (amount < 0 != negative) {
				negative = amount < 0;
				sb.append(negative ? '-' : '+');
			}
			sb.append(Math.abs(amount)).append(unit);
		}

		@Override
		public String toString() {
			return sb.toString();
		}
	}

	private static final Pattern GROUP = Pattern.compile("([+-])?\\s*(\\d+)\\s*([a-zA-Z]+)");
	private static final Pattern WHOLE = Pattern.compile("(([+-]\\s*)?\\d+\\s*[a-zA-Z]+\\s*)+");

	private static final Map<String, ChronoUnit> UNITS = Map.ofEntries(
		entry("ns", ChronoUnit.NANOS),
		entry("nanos", ChronoUnit.NANOS),
		entry("nanosecond", ChronoUnit.NANOS),
		entry("nanoseconds", ChronoUnit.NANOS),
		entry("us", ChronoUnit.MICROS),
		entry("micros", ChronoUnit.MICROS),
		entry("microsecond", ChronoUnit.MICROS),
		entry("microseconds", ChronoUnit.MICROS),
		entry("ms", ChronoUnit.MILLIS),
		entry("millis", ChronoUnit.MILLIS),
		entry("millisecond", ChronoUnit.MILLIS),
		entry("milliseconds", ChronoUnit.MILLIS),
		entry("s", ChronoUnit.SECONDS),
		entry("sec", ChronoUnit.SECONDS),
		entry("secs", ChronoUnit.SECONDS),
		entry("second", ChronoUnit.SECONDS),
		entry("seconds", ChronoUnit.SECONDS),
		entry("m", ChronoUnit.MINUTES),
		entry("min", ChronoUnit.MINUTES),
		entry("mins", ChronoUnit.MINUTES),
		entry("minute", ChronoUnit.MINUTES),
		entry("minutes", ChronoUnit.MINUTES),
		entry("h", ChronoUnit.HOURS),
		entry("hr", ChronoUnit.HOURS),
		entry("hrs", ChronoUnit.HOURS),
		entry("hour", ChronoUnit.HOURS),
		entry("hours", ChronoUnit.HOURS),
		entry("d", ChronoUnit.DAYS),
		entry("day", ChronoUnit.DAYS),
		entry("days", ChronoUnit.DAYS),
		entry("w", ChronoUnit.WEEKS),
		entry("wk", ChronoUnit.WEEKS),
		entry("wks", ChronoUnit.WEEKS),
		entry("week", ChronoUnit.WEEKS),
		entry("weeks", ChronoUnit.WEEKS),
		entry("mo", ChronoUnit.MONTHS),
		entry("mon", ChronoUnit.MONTHS),
		entry("month", ChronoUnit.MONTHS),
		entry("months", ChronoUnit.MONTHS),
		entry("y", ChronoUnit.YEARS),
		entry("yr", ChronoUnit.YEARS),
		entry("yrs", ChronoUnit.YEARS),
		entry("year", ChronoUnit.YEARS),
		entry("years", ChronoUnit.YEARS)
	);
}
