package works.polyfail.exceptions;

import works.polyfail.Label;
import works.polyfail.Schema;

/**
 * Thrown when a {@link Label} is used with a {@link Schema} that doesn't declare it.
 */
public class UnknownLabelException extends IllegalArgumentException {
	public UnknownLabelException(String message) { super(message); }
	public UnknownLabelException(Throwable cause) { super(cause); }
	public UnknownLabelException(String message, Throwable cause) { super(message, cause); }
}
