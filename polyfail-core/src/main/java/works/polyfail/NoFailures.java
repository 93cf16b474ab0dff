package works.polyfail;

/**
 * Marker type of the empty label set.
 * A <code>Fallible&lt;NoFailures, A></code> can only be a success,
 * so {@link Fallible#extract} can unwrap it.
 * <p>
 * Never instantiated.
 */
public final class NoFailures {
	private NoFailures() {}
}
