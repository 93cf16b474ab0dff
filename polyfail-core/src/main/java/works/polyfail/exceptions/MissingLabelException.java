package works.polyfail.exceptions;

/**
 * Thrown when a table keyed by label, like {@link works.polyfail.Cases},
 * is built without an entry for one of its schema's labels.
 */
public class MissingLabelException extends IllegalArgumentException {
	public MissingLabelException(String message) {
		super(message);
	}
}
