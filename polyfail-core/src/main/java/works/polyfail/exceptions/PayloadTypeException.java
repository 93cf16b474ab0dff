package works.polyfail.exceptions;

import works.polyfail.Label;

/**
 * Indicates a payload that doesn't match the type its {@link Label} declares,
 * or a payload type that can't be declared at all.
 */
public class PayloadTypeException extends IllegalArgumentException {
	public PayloadTypeException(String message) { super(message); }
	public PayloadTypeException(Throwable cause) { super(cause); }
	public PayloadTypeException(String message, Throwable cause) { super(message, cause); }
}
