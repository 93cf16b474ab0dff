package works.polyfail;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import works.polyfail.exceptions.PayloadTypeException;
import works.polyfail.exceptions.SchemaMismatchException;
import works.polyfail.exceptions.UnknownLabelException;

import static java.util.Collections.singletonList;
import static java.util.Objects.requireNonNull;
import static lombok.AccessLevel.PRIVATE;

/**
 * Either a success value of type <code>A</code>, or exactly one of the
 * failures declared by the {@link Schema} of <code>S</code>.
 *
 * <p>
 * Like a two-outcome result, except the failure side is a set of independently
 * labelled cases, each with its own payload type. Failures are data: nothing here
 * throws for a failed computation. Exceptions are reserved for misuse, like a label
 * the schema doesn't declare, and are thrown as early as possible.
 *
 * <p>
 * Every operation is defined in terms of {@link #fold}.
 * Resolving a label with {@link #resolve} or a {@link Resolver} removes it from
 * the label set, and once none remain, {@link #extract} unwraps the plain value.
 *
 * <p>
 * Equality considers only the active label and its payload.
 *
 * @param <S> marker type of the failure label set
 * @param <A> the success type
 */
@RequiredArgsConstructor(access = PRIVATE)
@EqualsAndHashCode
public final class Fallible<S, A> {
	@EqualsAndHashCode.Exclude
	private final Schema<S> schema;
	private final Label<?> label;
	private final Object payload;

	public static <SS, AA> Fallible<SS, AA> success(Schema<SS> schema, AA value) {
		return new Fallible<>(requireNonNull(schema), Label.success(), requireNonNull(value, "Success value can't be null"));
	}

	/**
	 * @throws UnknownLabelException if <code>schema</code> doesn't declare <code>label</code>
	 * @throws PayloadTypeException if <code>payload</code> doesn't match the label's declared type
	 */
	public static <SS, AA, P> Fallible<SS, AA> failure(Schema<SS> schema, Label<P> label, P payload) {
		schema.require(label);
		return new Fallible<>(schema, label, label.cast(requireNonNull(payload, "Failure payload can't be null")));
	}

	public static <SS, AA> Fallible<SS, AA> failure(Schema<SS> schema, Failure<SS> failure) {
		schema.require(failure.label());
		return new Fallible<>(schema, failure.label(), failure.payload());
	}

	public Schema<S> schema() {
		return schema;
	}

	/**
	 * Total elimination: exactly one of the two functions is called.
	 * For a handler that is checked to cover every label, see {@link Cases}.
	 */
	@SuppressWarnings("unchecked")
	public <B> B fold(Function<? super Failure<S>, ? extends B> onFailure, Function<? super A, ? extends B> onSuccess) {
		if (label.isSuccess()) {
			return onSuccess.apply((A) payload);
		} else {
			return onFailure.apply(new Failure<>(label, payload));
		}
	}

	public boolean isSuccess() {
		return fold(f -> false, a -> true);
	}

	public boolean isFailure() {
		return !isSuccess();
	}

	/**
	 * @return the name of the active label; {@link Label#SUCCESS_NAME} for a success.
	 */
	public String activeLabel() {
		return fold(f -> f.label().name(), a -> Label.SUCCESS_NAME);
	}

	//
	// Combinators
	//

	public <B> Fallible<S, B> map(Function<? super A, ? extends B> f) {
		return fold(this::passThrough, a -> success(schema, f.apply(a)));
	}

	/**
	 * Sequential composition: a success feeds <code>f</code>, a failure short-circuits.
	 * The result of <code>f</code> must have this value's label set; use {@link #expand}
	 * to bring values from narrower label sets in.
	 *
	 * @throws SchemaMismatchException if <code>f</code> returns a value of a different label set
	 */
	public <B> Fallible<S, B> flatMap(Function<? super A, Fallible<S, B>> f) {
		return fold(this::passThrough, a -> {
			Fallible<S, B> result = f.apply(a);
			if (result.schema != schema && !result.schema.sameLabelsAs(schema)) {
				throw new SchemaMismatchException("Expected a result in " + schema + "; got " + result.schema);
			}
			return result;
		});
	}

	/**
	 * A failure on the left wins regardless of <code>fa</code>.
	 */
	public static <SS, AA, B> Fallible<SS, B> apply(Fallible<SS, ? extends Function<? super AA, ? extends B>> ff, Fallible<SS, AA> fa) {
		return ff.flatMap(f -> fa.map(f));
	}

	/**
	 * @return <code>other</code> if this is a failure and <code>other</code> is a success; otherwise this.
	 * Two failures give the left one.
	 */
	public Fallible<S, A> alt(Fallible<S, A> other) {
		return fold(
			f -> other.fold(g -> this, b -> other),
			a -> this);
	}

	public static <SS, AA> Fallible<SS, AA> alt(Fallible<SS, AA> left, Fallible<SS, AA> right) {
		return left.alt(right);
	}

	/**
	 * @return a success holding <code>f</code> applied to this whole value, whatever its state.
	 */
	public <B> Fallible<S, B> extend(Function<? super Fallible<S, A>, ? extends B> f) {
		return success(schema, f.apply(this));
	}

	/**
	 * Re-types this value into a label set containing every label of its own.
	 *
	 * @throws SchemaMismatchException if <code>wider</code> lacks any of this value's labels
	 */
	public <T> Fallible<T, A> expand(Schema<T> wider) {
		if (!schema.isSubsetOf(wider)) {
			throw new SchemaMismatchException("Can't expand " + schema + " into " + wider);
		}
		return retag(wider);
	}

	//
	// Resolution
	//

	/**
	 * Turns the failure <code>resolved</code> into a success, if it's the active one,
	 * and otherwise forwards this value unchanged into the narrowed label set.
	 *
	 * @param narrowed this value's schema without <code>resolved</code>, as from {@link Schema#without}
	 * @throws UnknownLabelException if this value's schema doesn't declare <code>resolved</code>
	 * @throws SchemaMismatchException if <code>narrowed</code> isn't exactly this value's schema without <code>resolved</code>
	 */
	public <T, P> Fallible<T, A> resolve(Label<P> resolved, Function<? super P, ? extends A> f, Schema<T> narrowed) {
		schema.requireNarrowing(narrowed, singletonList(resolved));
		return fold(
			failure -> failure.payload(resolved)
				.<Fallible<T, A>>map(p -> success(narrowed, f.apply(p)))
				.orElseGet(() -> retag(narrowed)),
			a -> retag(narrowed));
	}

	/**
	 * The terminal step once every failure has been resolved.
	 */
	public static <AA> AA extract(Fallible<NoFailures, AA> fallible) {
		return fallible.fold(
			f -> { throw new AssertionError("Unexpected failure with no failure labels: " + f); },
			a -> a);
	}

	//
	// Conversions
	//

	public static <SS, E, AA> Fallible<SS, AA> fromEither(Schema<SS> schema, Label<E> label, Either<? extends E, ? extends AA> either) {
		schema.require(label);
		return either.fold(
			e -> failure(schema, label, e),
			a -> success(schema, a));
	}

	/**
	 * @return a success if <code>optional</code> is present; otherwise a failure under <code>label</code>.
	 */
	public static <SS, E, AA> Fallible<SS, AA> note(Schema<SS> schema, Label<E> label, E payload, Optional<? extends AA> optional) {
		schema.require(label);
		label.cast(requireNonNull(payload));
		return noteGet(schema, label, () -> payload, optional);
	}

	/**
	 * Like {@link #note}, but the failure payload is computed only if <code>optional</code> is empty.
	 */
	public static <SS, E, AA> Fallible<SS, AA> noteGet(Schema<SS> schema, Label<E> label, Supplier<? extends E> payload, Optional<? extends AA> optional) {
		schema.require(label);
		if (optional.isPresent()) {
			return success(schema, optional.get());
		} else {
			return failure(schema, label, payload.get());
		}
	}

	/**
	 * Discards any failure.
	 */
	public Optional<A> toOptional() {
		return fold(f -> Optional.empty(), Optional::of);
	}

	public A getOrElse(A defaultValue) {
		return fold(f -> defaultValue, a -> a);
	}

	public A getOrElseGet(Supplier<? extends A> defaultValue) {
		return fold(f -> defaultValue.get(), a -> a);
	}

	public <B> B failureOr(B defaultValue, Function<? super Failure<S>, ? extends B> onFailure) {
		return fold(onFailure, a -> defaultValue);
	}

	public <B> B failureOrElseGet(Supplier<? extends B> defaultValue, Function<? super Failure<S>, ? extends B> onFailure) {
		return fold(onFailure, a -> defaultValue.get());
	}

	public void ifSuccess(Consumer<? super A> action) {
		fold(f -> null, a -> {
			action.accept(a);
			return null;
		});
	}

	/**
	 * @return a stream of the success value, or an empty stream for a failure.
	 */
	public Stream<A> stream() {
		return fold(f -> Stream.empty(), Stream::of);
	}

	/**
	 * Same label and payload under another label set; the payload is not copied.
	 * Callers are responsible for checking the active label is declared by <code>target</code>.
	 */
	@SuppressWarnings("unchecked")
	<T, B> Fallible<T, B> retag(Schema<T> target) {
		if (target == schema) {
			return (Fallible<T, B>) this;
		}
		return new Fallible<>(target, label, payload);
	}

	private <B> Fallible<S, B> passThrough(Failure<S> failure) {
		return retag(schema);
	}

	@Override
	public String toString() {
		return fold(
			f -> "failure(" + f + ")",
			a -> "success(" + a + ")");
	}
}
