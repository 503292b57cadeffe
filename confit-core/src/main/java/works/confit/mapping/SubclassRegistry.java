package works.confit.mapping;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers the concrete record classes that implement each open
 * (that is, non-sealed) interface,
 * so that values declared with the base type can be decoded.
 * <p>
 * Registration is thread-safe and may happen at any time;
 * a decode sees the candidates registered before it looked them up.
 * Registrations are never removed.
 */
public final class SubclassRegistry {
	/**
	 * The reserved key naming the concrete class of an open-polymorphic value.
	 */
	public static final String TYPE_TAG = "_type";

	private final Map<Class<?>, CopyOnWriteArrayList<Class<?>>> candidatesByBase = new ConcurrentHashMap<>();

	private static final SubclassRegistry GLOBAL = new SubclassRegistry();

	public static SubclassRegistry global() {
		return GLOBAL;
	}

	/**
	 * Registers {@code impl} as a candidate for {@code base}.
	 * Candidates are tried in the order they were first registered;
	 * registering the same pair again has no effect.
	 *
	 * @return this
	 */
	public SubclassRegistry register(Class<?> base, Class<? extends Record> impl) {
		if (!base.isAssignableFrom(impl)) {
			throw new IllegalArgumentException(impl.getSimpleName() + " is not a subtype of " + base.getSimpleName());
		}
		if (!impl.isRecord()) {
			throw new IllegalArgumentException("Only records can be registered as subclasses: " + impl);
		}
		var candidates = candidatesByBase.computeIfAbsent(base, b -> new CopyOnWriteArrayList<>());
		if (candidates.addIfAbsent(impl)) {
			LOGGER.debug("Registered {} as a candidate for {}", impl.getSimpleName(), base.getSimpleName());
		}
		return this;
	}

	/**
	 * Registers {@code impl} under each of its open supertypes:
	 * every non-sealed interface it implements, directly or indirectly.
	 *
	 * @return this
	 */
	public SubclassRegistry register(Class<? extends Record> impl) {
		Set<Class<?>> visited = new HashSet<>();
		Deque<Class<?>> work = new ArrayDeque<>(List.of(impl.getInterfaces()));
		while (!work.isEmpty()) {
			Class<?> next = work.removeFirst();
			if (visited.add(next)) {
				if (isOpen(next)) {
					register(next, impl);
				}
				work.addAll(List.of(next.getInterfaces()));
			}
		}
		return this;
	}

	/**
	 * @return a snapshot of the candidates for {@code base}, in registration order
	 */
	public List<Class<?>> candidatesFor(Class<?> base) {
		var candidates = candidatesByBase.get(base);
		return candidates == null ? List.of() : List.copyOf(candidates);
	}

	private static boolean isOpen(Class<?> c) {
		return c.isInterface() && !c.isSealed() && !c.getName().startsWith("java.");
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SubclassRegistry.class);
}
