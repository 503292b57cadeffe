package works.confit.tree;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The location of a value within a configuration document,
 * relative to the root of the tree being decoded.
 * <p>
 * Renders as the concatenation of its segments:
 * {@code .name} for mapping members and {@code [i]} for sequence elements,
 * so the root is the empty string and a nested element looks like {@code .servers[2].host}.
 */
public record ConfigPath(List<Segment> segments) {
	public static final ConfigPath ROOT = new ConfigPath(List.of());

	public ConfigPath {
		segments = List.copyOf(segments);
	}

	public sealed interface Segment permits Member, Index { }

	public record Member(String key) implements Segment {
		public Member {
			requireNonNull(key);
		}

		@Override
		public String toString() {
			return "." + key;
		}
	}

	public record Index(int index) implements Segment {
		@Override
		public String toString() {
			return "[" + index + "]";
		}
	}

	/**
	 * @return the path of the member {@code key} of the mapping at this path
	 */
	public ConfigPath member(String key) {
		return then(new Member(key));
	}

	/**
	 * @return the path of element {@code index} of the sequence at this path
	 */
	public ConfigPath index(int index) {
		return then(new Index(index));
	}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	/**
	 * @return this path, or {@code <root>} if it is empty; for use in messages
	 */
	public String describe() {
		return isRoot() ? "<root>" : toString();
	}

	private ConfigPath then(Segment segment) {
		List<Segment> result = new ArrayList<>(segments.size() + 1);
		result.addAll(segments);
		result.add(segment);
		return new ConfigPath(result);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		segments.forEach(sb::append);
		return sb.toString();
	}
}
