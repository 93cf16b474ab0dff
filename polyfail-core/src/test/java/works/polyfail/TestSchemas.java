package works.polyfail;

/**
 * Label sets shared by the tests.
 * <code>PARSE</code> has three labels; the others are what's left after resolving some of them.
 */
public final class TestSchemas {
	private TestSchemas() {}

	public interface ParseErrors {}
	public interface WithoutSyntax {}
	public interface WithoutOverflow {}
	public interface OnlyEmpty {}
	public interface OnlySyntax {}
	public interface IoErrors {}
	public interface ParseOrIoErrors {}

	public static final Label<String> SYNTAX = Label.of("syntax", String.class);
	public static final Label<Integer> OVERFLOW = Label.of("overflow", Integer.class);
	public static final Label<Unit> EMPTY = Label.of("empty", Unit.class);
	public static final Label<String> NOT_FOUND = Label.of("notFound", String.class);

	public static final Schema<ParseErrors> PARSE = Schema.of(ParseErrors.class, SYNTAX, OVERFLOW, EMPTY);
	public static final Schema<WithoutSyntax> WITHOUT_SYNTAX = PARSE.without(WithoutSyntax.class, SYNTAX);
	public static final Schema<WithoutOverflow> WITHOUT_OVERFLOW = PARSE.without(WithoutOverflow.class, OVERFLOW);
	public static final Schema<OnlyEmpty> ONLY_EMPTY = PARSE.without(OnlyEmpty.class, SYNTAX, OVERFLOW);
	public static final Schema<OnlySyntax> ONLY_SYNTAX = Schema.of(OnlySyntax.class, SYNTAX);
	public static final Schema<IoErrors> IO = Schema.of(IoErrors.class, NOT_FOUND);
	public static final Schema<ParseOrIoErrors> PARSE_OR_IO = PARSE.with(ParseOrIoErrors.class, NOT_FOUND);

	/**
	 * A stand-in for a real parser: blank is {@link #EMPTY}, more than nine digits is
	 * {@link #OVERFLOW}, anything else that isn't a number is {@link #SYNTAX}.
	 */
	public static Fallible<ParseErrors, Integer> parse(String text) {
		if (text.isBlank()) {
			return PARSE.failure(EMPTY, Unit.unit());
		} else if (!text.matches("-?[0-9]+")) {
			return PARSE.failure(SYNTAX, text);
		} else if (text.replace("-", "").length() > 9) {
			return PARSE.failure(OVERFLOW, text.length());
		} else {
			return PARSE.success(Integer.parseInt(text));
		}
	}
}
