package works.polyfail;

/**
 * The payload of a label that has nothing to say beyond its own name,
 * like a division-by-zero failure.
 */
public final class Unit {
	private Unit() {}

	public static Unit unit() {
		return INSTANCE;
	}

	@Override
	public String toString() {
		return "()";
	}

	private static final Unit INSTANCE = new Unit();
}
