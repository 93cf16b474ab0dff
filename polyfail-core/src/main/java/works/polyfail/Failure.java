package works.polyfail;

import java.util.Optional;
import java.util.function.Function;
import works.polyfail.exceptions.PayloadTypeException;

import static java.util.Objects.requireNonNull;

/**
 * The failure portion of a {@link Fallible}: one failure label of <code>S</code> and its payload.
 * This is what a failure handler sees; it can never be the success slot.
 *
 * @param <S> marker type of the label set
 */
public record Failure<S>(Label<?> label, Object payload) {
	public Failure {
		requireNonNull(label);
		requireNonNull(payload);
		if (label.isSuccess()) {
			throw new IllegalArgumentException("A failure can't be labelled as success");
		}
		label.cast(payload);
	}

	/**
	 * @throws PayloadTypeException if the payload doesn't match the label
	 */
	public static <SS> Failure<SS> of(Label<?> label, Object payload) {
		return new Failure<>(label, payload);
	}

	public boolean is(Label<?> candidate) {
		return label.equals(candidate);
	}

	/**
	 * @return the payload if <code>candidate</code> is the active label; otherwise empty.
	 */
	public <P> Optional<P> payload(Label<P> candidate) {
		if (is(candidate)) {
			return Optional.of(candidate.cast(payload));
		} else {
			return Optional.empty();
		}
	}

	/**
	 * Applies <code>handler</code> to the payload if <code>candidate</code> is active.
	 */
	public <P, B> Optional<B> on(Label<P> candidate, Function<? super P, ? extends B> handler) {
		return payload(candidate).map(handler);
	}

	public <A> Fallible<S, A> toFallible(Schema<S> schema) {
		return Fallible.failure(schema, this);
	}

	@Override
	public String toString() {
		return label.name() + ", " + payload;
	}
}
