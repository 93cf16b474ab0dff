package works.polyfail.testing;

import static java.util.Objects.requireNonNull;

/**
 * The default random-value capability of one payload type:
 * how to generate its values and how its values perturb a seed.
 */
public record Arbitrary<T>(
	Class<T> type,
	Gen<T> gen,
	Coarbitrary<T> coarbitrary
) {
	public Arbitrary {
		requireNonNull(type);
		requireNonNull(gen);
		requireNonNull(coarbitrary);
	}

	public static <TT> Arbitrary<TT> of(Class<TT> type, Gen<TT> gen, Coarbitrary<? super TT> coarbitrary) {
		return new Arbitrary<>(type, gen, coarbitrary::perturb);
	}
}
