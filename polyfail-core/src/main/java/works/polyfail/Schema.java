package works.polyfail;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.OrderedPSet;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.polyfail.exceptions.PayloadTypeException;
import works.polyfail.exceptions.SchemaMismatchException;
import works.polyfail.exceptions.UnknownLabelException;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;
import static lombok.AccessLevel.PRIVATE;

/**
 * The failure labels a {@link Fallible} may carry, in declaration order.
 * The success slot is implicit and is not one of the {@link #labels()}.
 *
 * <p>
 * The marker type <code>S</code> names the label set at the type level.
 * It can be any type; an otherwise empty interface is typical:
 *
 * <pre>
 * interface ParseErrors {}
 * static final Label&lt;String> SYNTAX = Label.of("syntax", String.class);
 * static final Label&lt;Integer> OVERFLOW = Label.of("overflow", Integer.class);
 * static final Schema&lt;ParseErrors> PARSE = Schema.of(ParseErrors.class, SYNTAX, OVERFLOW);
 * </pre>
 *
 * A schema whose marker is {@link NoFailures} is always empty.
 *
 * @param <S> marker type of this label set
 */
@RequiredArgsConstructor(access = PRIVATE)
@EqualsAndHashCode
public final class Schema<S> {
	private final Class<S> marker;
	private final PMap<String, Label<?>> labelsByName;
	private final OrderedPSet<String> names; // Preserves declaration order

	public static Schema<NoFailures> none() {
		return NONE;
	}

	public static <SS> Schema<SS> of(Class<SS> marker, Label<?>... labels) {
		return of(marker, asList(labels));
	}

	public static <SS> Schema<SS> of(Class<SS> marker, Collection<? extends Label<?>> labels) {
		requireNonNull(marker);
		PMap<String, Label<?>> byName = HashTreePMap.empty();
		for (Label<?> label: labels) {
			if (byName.containsKey(label.name())) {
				throw new IllegalArgumentException("Multiple labels named \"" + label.name() + "\"");
			}
			byName = byName.plus(label.name(), label);
		}
		if (marker == NoFailures.class && !byName.isEmpty()) {
			throw new SchemaMismatchException("A schema marked " + NoFailures.class.getSimpleName() + " can't declare labels: " + byName.keySet());
		}
		return new Schema<>(marker, byName, OrderedPSet.from(labels.stream().map(Label::name).collect(toList())));
	}

	public Class<S> marker() {
		return marker;
	}

	public List<Label<?>> labels() {
		return unmodifiableList(stream().collect(toList()));
	}

	public Stream<Label<?>> stream() {
		return names.stream().map(labelsByName::get);
	}

	public int size() {
		return names.size();
	}

	public boolean isEmpty() {
		return names.isEmpty();
	}

	public boolean contains(Label<?> label) {
		return label.equals(labelsByName.get(label.name()));
	}

	public @Nullable Label<?> label(String name) {
		return labelsByName.get(name);
	}

	/**
	 * @return the position of <code>label</code> in declaration order, or -1 if it isn't declared.
	 */
	public int indexOf(Label<?> label) {
		int i = 0;
		for (String name: names) {
			if (name.equals(label.name())) {
				return contains(label)? i : -1;
			}
			i++;
		}
		return -1;
	}

	/**
	 * @throws UnknownLabelException if <code>label</code> is not declared by this schema
	 * @throws PayloadTypeException if this schema declares a label of the same name with a different payload type
	 */
	public <P> Label<P> require(Label<P> label) {
		Label<?> declared = labelsByName.get(label.name());
		if (declared == null) {
			throw new UnknownLabelException("Label \"" + label.name() + "\" is not declared by " + this);
		} else if (!declared.equals(label)) {
			throw new PayloadTypeException("Label \"" + label.name() + "\" carries " + declared.payloadType().getSimpleName()
				+ " in " + this + ", not " + label.payloadType().getSimpleName());
		}
		return label;
	}

	/**
	 * @return the schema left over once the given labels have been resolved.
	 * @throws UnknownLabelException if any of <code>removed</code> is not declared by this schema
	 */
	public <T> Schema<T> without(Class<T> newMarker, Label<?>... removed) {
		return without(newMarker, asList(removed));
	}

	public <T> Schema<T> without(Class<T> newMarker, Collection<? extends Label<?>> removed) {
		removed.forEach(this::require);
		List<Label<?>> remaining = new ArrayList<>(labels());
		remaining.removeAll(removed);
		LOGGER.trace("Narrowing {} by {}", this, removed);
		return Schema.of(newMarker, remaining);
	}

	/**
	 * @return a schema declaring all of this schema's labels followed by <code>added</code>.
	 * A label already declared here is not repeated.
	 */
	public <T> Schema<T> with(Class<T> newMarker, Label<?>... added) {
		List<Label<?>> all = new ArrayList<>(labels());
		for (Label<?> label: added) {
			if (!contains(label)) {
				all.add(label);
			}
		}
		LOGGER.trace("Widening {} by {}", this, asList(added));
		return Schema.of(newMarker, all);
	}

	/**
	 * @return true if both schemas declare the same labels, regardless of order or marker.
	 */
	public boolean sameLabelsAs(Schema<?> other) {
		return labelsByName.equals(other.labelsByName);
	}

	/**
	 * @return true if every label declared here is also declared by <code>other</code>.
	 */
	public boolean isSubsetOf(Schema<?> other) {
		return stream().allMatch(other::contains);
	}

	/**
	 * Checks that <code>target</code> is exactly this schema with <code>resolved</code> removed.
	 *
	 * @throws UnknownLabelException if any of <code>resolved</code> is not declared here
	 * @throws SchemaMismatchException if <code>target</code> has any other labels than the ones expected
	 */
	void requireNarrowing(Schema<?> target, Collection<? extends Label<?>> resolved) {
		resolved.forEach(this::require);
		PMap<String, Label<?>> expected = labelsByName.minusAll(resolved.stream().map(Label::name).collect(toList()));
		if (!expected.equals(target.labelsByName)) {
			throw new SchemaMismatchException("Resolving " + resolved + " from " + this
				+ " leaves " + expected.keySet() + "; target schema is " + target);
		}
	}

	public <A> Fallible<S, A> success(A value) {
		return Fallible.success(this, value);
	}

	public <A, P> Fallible<S, A> failure(Label<P> label, P payload) {
		return Fallible.failure(this, label, payload);
	}

	@Override
	public String toString() {
		return marker.getSimpleName() + names.stream().collect(joining(", ", "{", "}"));
	}

	private static final Schema<NoFailures> NONE = new Schema<>(NoFailures.class, HashTreePMap.empty(), OrderedPSet.empty());
	private static final Logger LOGGER = LoggerFactory.getLogger(Schema.class);
}
