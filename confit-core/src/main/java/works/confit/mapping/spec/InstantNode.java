package works.confit.mapping.spec;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.Set;
import works.confit.types.DataType;
import works.confit.types.KnownType;

/**
 * An absolute timestamp written as an ISO-8601 string with an explicit offset or zone.
 * Decoded values are normalized to UTC.
 */
public record InstantNode(Class<? extends Temporal> temporalClass) implements ScalarSpec {
	public InstantNode {
		assert TEMPORAL_CLASSES.contains(temporalClass): "Not a supported timestamp class: " + temporalClass;
	}

	@Override
	public KnownType dataType() {
		return DataType.known(temporalClass);
	}

	@Override
	public String toString() {
		return temporalClass.getSimpleName();
	}

	public static final Set<Class<? extends Temporal>> TEMPORAL_CLASSES = Set.of(
		Instant.class, OffsetDateTime.class, ZonedDateTime.class);
}
