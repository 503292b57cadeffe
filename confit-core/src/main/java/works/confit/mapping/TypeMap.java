package works.confit.mapping;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.confit.mapping.spec.TargetSpec;
import works.confit.mapping.spec.TypeRefNode;
import works.confit.types.KnownType;

import static java.util.Objects.requireNonNull;

/**
 * The product of a {@link TypeScanner}.
 * Gives a mapping from {@link KnownType} to {@link TargetSpec}.
 * <p>
 * Entries are only ever added, never replaced or removed,
 * so a spec obtained from here stays valid for the life of the map.
 * Reads take no locks.
 * <p>
 * Also tells the {@link Lookup} to use for accessing members of a given class,
 * since users of this often need to do reflection,
 * and there's no other obvious home for the lookups.
 */
public class TypeMap {
	private final Map<KnownType, TargetSpec> memo = new ConcurrentHashMap<>();
	private final Map<Package, Lookup> lookups = new ConcurrentHashMap<>();

	public Set<KnownType> knownTypes() {
		return Set.copyOf(memo.keySet());
	}

	/**
	 * @throws IllegalArgumentException if there's no spec for the given type
	 */
	public TargetSpec get(KnownType type) {
		var result = memo.get(type);
		if (result == null) {
			throw new IllegalArgumentException("No spec for type " + type);
		}
		return result;
	}

	/**
	 * @return the spec for {@code type}, or null if it hasn't been published
	 */
	public TargetSpec find(KnownType type) {
		return memo.get(type);
	}

	/**
	 * Adds all the given specs at once.
	 * Types already present keep their existing spec.
	 */
	void publish(Map<KnownType, TargetSpec> specs) {
		specs.forEach((type, spec) -> {
			if (spec instanceof TypeRefNode ref && ref.type().equals(type)) {
				throw new IllegalArgumentException("Attempting to map a type " + type + " to a self-referential TypeRefNode");
			}
			memo.putIfAbsent(type, requireNonNull(spec));
		});
	}

	/**
	 * @return true if {@code lookup} wasn't already registered
	 */
	public boolean add(Lookup lookup) {
		var old = lookups.put(requireNonNull(lookup.lookupClass().getPackage()), lookup);
		return old != lookup;
	}

	/**
	 * @return a {@link Lookup} suitable for accessing members of the given class:
	 * one registered for its package if any; otherwise a private lookup into the class,
	 * if this module can get one; otherwise {@link MethodHandles#publicLookup()}
	 */
	public Lookup lookupFor(Class<?> c) {
		Lookup registered = lookups.get(c.getPackage());
		if (registered != null) {
			return registered;
		}
		try {
			return MethodHandles.privateLookupIn(c, MethodHandles.lookup());
		} catch (IllegalAccessException e) {
			LOGGER.debug("No private access to {}; falling back to public lookup", c, e);
			return MethodHandles.publicLookup();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeMap.class);
}
