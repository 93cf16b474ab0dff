package works.polyfail;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import works.polyfail.TestSchemas.IoErrors;
import works.polyfail.exceptions.UnknownLabelException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.polyfail.TestSchemas.IO;
import static works.polyfail.TestSchemas.NOT_FOUND;
import static works.polyfail.TestSchemas.OVERFLOW;
import static works.polyfail.TestSchemas.PARSE;
import static works.polyfail.TestSchemas.SYNTAX;
import static works.polyfail.TestSchemas.parse;

class ConversionsTest {

	@Test
	void fromEither_rightIsSuccess() {
		assertEquals(IO.success("contents"), Fallible.fromEither(IO, NOT_FOUND, Either.right("contents")));
	}

	@Test
	void fromEither_leftIsFailure() {
		Fallible<IoErrors, String> result = Fallible.fromEither(IO, NOT_FOUND, Either.left("a.txt"));
		assertEquals(IO.failure(NOT_FOUND, "a.txt"), result);
		assertEquals(Optional.empty(), result.toOptional());
	}

	@Test
	void fromEither_undeclaredLabel_throws() {
		assertThrows(UnknownLabelException.class, () -> Fallible.fromEither(PARSE, NOT_FOUND, Either.right(1)));
	}

	@Test
	void toOptional_success() {
		assertEquals(Optional.of(5), parse("5").toOptional());
	}

	@Test
	void note_emptyOptionalBecomesFailure() {
		assertEquals(IO.failure(NOT_FOUND, "b.txt"), Fallible.note(IO, NOT_FOUND, "b.txt", Optional.empty()));
		assertEquals(IO.success(3), Fallible.note(IO, NOT_FOUND, "b.txt", Optional.of(3)));
	}

	@Test
	void noteGet_payloadComputedOnlyWhenAbsent() {
		AtomicInteger calls = new AtomicInteger();
		Fallible<IoErrors, Integer> present = Fallible.noteGet(IO, NOT_FOUND, () -> "c" + calls.incrementAndGet(), Optional.of(1));
		assertEquals(0, calls.get());
		assertTrue(present.isSuccess());
		Fallible<IoErrors, Integer> absent = Fallible.noteGet(IO, NOT_FOUND, () -> "c" + calls.incrementAndGet(), Optional.empty());
		assertEquals(1, calls.get());
		assertEquals(IO.failure(NOT_FOUND, "c1"), absent);
	}

	@Test
	void getOrElse() {
		assertEquals(5, parse("5").getOrElse(-1));
		assertEquals(-1, parse("five").getOrElse(-1));
		assertEquals(-2, parse("").getOrElseGet(() -> -2));
	}

	@Test
	void failureOr() {
		assertEquals("fine", parse("5").failureOr("fine", f -> f.label().name()));
		assertEquals("syntax", parse("five").failureOr("fine", f -> f.label().name()));
		assertEquals(11, parse("12345678901").failureOr(0, f -> f.payload(OVERFLOW).orElse(-1)));
		assertEquals("lazy", parse("5").failureOrElseGet(() -> "lazy", f -> "eager"));
	}

	@Test
	void failure_payloadLookup() {
		Failure<TestSchemas.ParseErrors> failure = Failure.of(SYNTAX, "q");
		assertEquals(Optional.of("q"), failure.payload(SYNTAX));
		assertEquals(Optional.empty(), failure.payload(OVERFLOW));
		assertEquals(Optional.of(1), failure.on(SYNTAX, String::length));
		assertEquals(PARSE.failure(SYNTAX, "q"), failure.toFallible(PARSE));
	}
}
