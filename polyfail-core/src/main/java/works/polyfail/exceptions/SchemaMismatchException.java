package works.polyfail.exceptions;

import works.polyfail.Schema;

/**
 * Indicates a {@link Schema} that doesn't have the labels an operation requires,
 * such as a narrowed schema that isn't exactly the original minus the resolved labels.
 */
public class SchemaMismatchException extends IllegalArgumentException {
	public SchemaMismatchException(String message) { super(message); }
	public SchemaMismatchException(String message, Throwable cause) { super(message, cause); }
}
