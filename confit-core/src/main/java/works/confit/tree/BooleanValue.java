package works.confit.tree;

public record BooleanValue(boolean value) implements TreeValue {
	public static final BooleanValue TRUE = new BooleanValue(true);
	public static final BooleanValue FALSE = new BooleanValue(false);

	@Override
	public String shape() {
		return "boolean";
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
