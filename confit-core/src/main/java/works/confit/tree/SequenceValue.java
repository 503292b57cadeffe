package works.confit.tree;

import java.util.List;

import static java.util.stream.Collectors.joining;

public record SequenceValue(List<TreeValue> elements) implements TreeValue {
	public static final SequenceValue EMPTY = new SequenceValue(List.of());

	public SequenceValue {
		elements = List.copyOf(elements);
	}

	public int size() {
		return elements.size();
	}

	public TreeValue get(int index) {
		return elements.get(index);
	}

	@Override
	public String shape() {
		return "sequence";
	}

	@Override
	public String toString() {
		return elements.stream()
			.map(Object::toString)
			.collect(joining(", ", "[", "]"));
	}
}
