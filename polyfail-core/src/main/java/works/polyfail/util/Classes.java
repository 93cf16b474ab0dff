package works.polyfail.util;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.polyfail.Either;
import works.polyfail.Label;

/**
 * An imperfect, non-idiomatic way to describe parameterized payload types.
 *
 * <p>
 * To declare a {@link Label} whose payload is a <code>List&lt;String></code>, for example,
 * write <code>Label.of("invalidFields", list(String.class))</code>.
 * Only the raw class is checked at runtime.
 */
@SuppressWarnings({"unchecked","rawtypes","unused"})
public final class Classes {
	private Classes() {}

	public static <E> Class<List<E>> list(Class<E> entryClass) {
		return (Class)List.class;
	}

	public static <E> Class<Set<E>> set(Class<E> entryClass) {
		return (Class)Set.class;
	}

	public static <K,V> Class<Map<K,V>> map(Class<K> keyClass, Class<V> valueClass) {
		return (Class)Map.class;
	}

	public static <T> Class<Optional<T>> optional(Class<T> valueClass) {
		return (Class)Optional.class;
	}

	public static <L,R> Class<Either<L,R>> either(Class<L> leftClass, Class<R> rightClass) {
		return (Class)Either.class;
	}
}
