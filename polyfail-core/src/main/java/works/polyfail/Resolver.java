package works.polyfail;

import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.polyfail.exceptions.ReservedLabelException;
import works.polyfail.exceptions.SchemaMismatchException;
import works.polyfail.exceptions.UnknownLabelException;

import static lombok.AccessLevel.PRIVATE;

/**
 * Resolves several failure labels at once, narrowing the label set from <code>S</code> to <code>T</code>.
 * The labels and the target schema are checked when the resolver is built.
 * Applying it checks only that the value belongs to the source label set,
 * and that handlers return non-null results.
 *
 * <pre>
 * Resolver&lt;ParseErrors, NoFailures, Integer> fallback = Resolver.&lt;ParseErrors, Integer>over(PARSE)
 *     .handle(SYNTAX, message -> 0)
 *     .handle(OVERFLOW, digits -> Integer.MAX_VALUE)
 *     .into(Schema.none());
 * int n = Fallible.extract(fallback.apply(result));
 * </pre>
 *
 * Resolving every label and extracting gives the same answer as resolving them one at a time
 * with {@link Fallible#resolve}, in any order.
 *
 * @param <S> marker type of the label set being resolved
 * @param <T> marker type of the labels left over
 * @param <A> the success type
 */
@RequiredArgsConstructor(access = PRIVATE)
public final class Resolver<S, T, A> implements Function<Fallible<S, A>, Fallible<T, A>> {
	private final Schema<S> source;
	private final Schema<T> target;
	private final PMap<String, Function<Object, ? extends A>> handlers;

	public static <SS, AA> Builder<SS, AA> over(Schema<SS> source) {
		return new Builder<>(source, HashTreePMap.empty(), TreePVector.empty());
	}

	public Schema<S> source() {
		return source;
	}

	public Schema<T> target() {
		return target;
	}

	/**
	 * @throws SchemaMismatchException if <code>fallible</code> comes from a label set other than {@link #source()}
	 * @throws NullPointerException if the handler for the active label returns null
	 */
	@Override
	public Fallible<T, A> apply(Fallible<S, A> fallible) {
		Schema<S> actual = fallible.schema();
		if (actual != source && !actual.sameLabelsAs(source)) {
			throw new SchemaMismatchException("Resolver over " + source + " can't apply to a value from " + actual);
		}
		return fallible.fold(
			failure -> {
				Function<Object, ? extends A> handler = handlers.get(failure.label().name());
				if (handler == null) {
					return fallible.retag(target);
				} else {
					return Fallible.success(target, handler.apply(failure.payload()));
				}
			},
			a -> fallible.retag(target));
	}

	@RequiredArgsConstructor(access = PRIVATE)
	public static final class Builder<S, A> {
		private final Schema<S> source;
		private final PMap<String, Function<Object, ? extends A>> handlers;
		private final PVector<Label<?>> handled;

		/**
		 * @throws ReservedLabelException if <code>label</code> is the success label
		 * @throws UnknownLabelException if the source schema doesn't declare <code>label</code>
		 * @throws IllegalArgumentException if <code>label</code> is already handled
		 */
		public <P> Builder<S, A> handle(Label<P> label, Function<? super P, ? extends A> handler) {
			if (label.isSuccess()) {
				throw new ReservedLabelException("Success is not a failure label and can't be resolved");
			}
			source.require(label);
			if (handlers.containsKey(label.name())) {
				throw new IllegalArgumentException("Multiple handlers for label \"" + label.name() + "\"");
			}
			Function<Object, ? extends A> erased = payload -> handler.apply(label.cast(payload));
			return new Builder<>(source, handlers.plus(label.name(), erased), handled.plus(label));
		}

		/**
		 * @param target the source schema minus every handled label, as from {@link Schema#without}
		 * @throws SchemaMismatchException if <code>target</code> declares any other labels
		 */
		public <T> Resolver<S, T, A> into(Schema<T> target) {
			source.requireNarrowing(target, handled);
			LOGGER.debug("Built resolver for {} from {} into {}", handled, source, target);
			return new Resolver<>(source, target, handlers);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Resolver.class);
}
