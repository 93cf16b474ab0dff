package works.polyfail;

import java.util.List;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.polyfail.exceptions.MissingLabelException;
import works.polyfail.exceptions.UnknownLabelException;

import static java.util.stream.Collectors.toList;
import static lombok.AccessLevel.PRIVATE;

/**
 * A failure handler with one case per label, checked when it's built to cover
 * every label of its schema. Pass it as the failure side of {@link Fallible#fold}:
 *
 * <pre>
 * Cases&lt;ParseErrors, String> describe = Cases.&lt;ParseErrors, String>over(PARSE)
 *     .on(SYNTAX, message -> "Syntax error: " + message)
 *     .on(OVERFLOW, digits -> "Too many digits: " + digits)
 *     .build();
 * String text = result.fold(describe, n -> "Parsed " + n);
 * </pre>
 */
@RequiredArgsConstructor(access = PRIVATE)
public final class Cases<S, B> implements Function<Failure<S>, B> {
	private final Schema<S> schema;
	private final PMap<String, Function<Object, ? extends B>> handlers;
	private final @Nullable Function<? super Failure<S>, ? extends B> otherwise;

	public static <SS, BB> Builder<SS, BB> over(Schema<SS> schema) {
		return new Builder<>(schema, HashTreePMap.empty(), null);
	}

	public Schema<S> schema() {
		return schema;
	}

	@Override
	public B apply(Failure<S> failure) {
		Function<Object, ? extends B> handler = handlers.get(failure.label().name());
		if (handler != null) {
			return handler.apply(failure.payload());
		} else if (otherwise != null) {
			return otherwise.apply(failure);
		} else {
			throw new UnknownLabelException("No case for \"" + failure.label() + "\" in " + schema);
		}
	}

	@RequiredArgsConstructor(access = PRIVATE)
	public static final class Builder<S, B> {
		private final Schema<S> schema;
		private final PMap<String, Function<Object, ? extends B>> handlers;
		private final @Nullable Function<? super Failure<S>, ? extends B> otherwise;

		/**
		 * @throws UnknownLabelException if the schema doesn't declare <code>label</code>
		 * @throws IllegalArgumentException if <code>label</code> already has a case
		 */
		public <P> Builder<S, B> on(Label<P> label, Function<? super P, ? extends B> handler) {
			schema.require(label);
			if (handlers.containsKey(label.name())) {
				throw new IllegalArgumentException("Multiple cases for label \"" + label.name() + "\"");
			}
			Function<Object, ? extends B> erased = payload -> handler.apply(label.cast(payload));
			return new Builder<>(schema, handlers.plus(label.name(), erased), otherwise);
		}

		/**
		 * Handles every label that has no case of its own.
		 */
		public Builder<S, B> otherwise(Function<? super Failure<S>, ? extends B> handler) {
			return new Builder<>(schema, handlers, handler);
		}

		/**
		 * @throws MissingLabelException if some label has no case and there's no {@link #otherwise}
		 */
		public Cases<S, B> build() {
			if (otherwise == null) {
				List<String> missing = schema.stream()
					.map(Label::name)
					.filter(name -> !handlers.containsKey(name))
					.collect(toList());
				if (!missing.isEmpty()) {
					throw new MissingLabelException("No case for " + missing + " in " + schema);
				}
			}
			LOGGER.debug("Built {} cases over {}", handlers.size(), schema);
			return new Cases<>(schema, handlers, otherwise);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Cases.class);
}
