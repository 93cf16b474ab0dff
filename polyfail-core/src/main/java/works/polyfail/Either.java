package works.polyfail;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * The familiar two-outcome result: a {@link Left} failure or a {@link Right} success.
 * Use {@link Fallible#fromEither} to give the failure side a label.
 */
public sealed interface Either<L, R> permits Either.Left, Either.Right {
	<T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight);

	default boolean isRight() {
		return fold(l -> false, r -> true);
	}

	static <LL, RR> Either<LL, RR> left(LL value) {
		return new Left<>(value);
	}

	static <LL, RR> Either<LL, RR> right(RR value) {
		return new Right<>(value);
	}

	record Left<L, R>(L value) implements Either<L, R> {
		public Left {
			requireNonNull(value);
		}

		@Override
		public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
			return onLeft.apply(value);
		}
	}

	record Right<L, R>(R value) implements Either<L, R> {
		public Right {
			requireNonNull(value);
		}

		@Override
		public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
			return onRight.apply(value);
		}
	}
}
