package works.polyfail.testing;

import works.polyfail.Label;
import works.polyfail.Schema;
import works.polyfail.Unit;

/**
 * Small label sets for generator tests.
 */
public final class TestSchemas {
	private TestSchemas() {}

	public interface Errors {}
	public interface WithoutA {}
	public interface OnlyC {}
	public interface Opaque {}

	public static final Label<String> A = Label.of("a", String.class);
	public static final Label<Integer> B = Label.of("b", Integer.class);
	public static final Label<Unit> C = Label.of("c", Unit.class);

	public static final Schema<Errors> ERRORS = Schema.of(Errors.class, A, B, C);
	public static final Schema<WithoutA> WITHOUT_A = ERRORS.without(WithoutA.class, A);
	public static final Schema<OnlyC> ONLY_C = ERRORS.without(OnlyC.class, A, B);

	/**
	 * A payload type with no default arbitrary.
	 */
	public record Location(int line, int column) { }

	public static final Label<Location> AT = Label.of("at", Location.class);
	public static final Schema<Opaque> OPAQUE = Schema.of(Opaque.class, A, AT);
}
