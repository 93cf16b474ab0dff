package works.polyfail.exceptions;

/**
 * Thrown when a failure label would use the name reserved for the success slot.
 */
public class ReservedLabelException extends IllegalArgumentException {
	public ReservedLabelException(String message) {
		super(message);
	}
}
