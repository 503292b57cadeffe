package works.confit.tree;

import static java.util.Objects.requireNonNull;

public record StringValue(String value) implements TreeValue {
	public StringValue {
		requireNonNull(value);
	}

	@Override
	public String shape() {
		return "string";
	}

	@Override
	public String toString() {
		return "\"" + value + "\"";
	}
}
