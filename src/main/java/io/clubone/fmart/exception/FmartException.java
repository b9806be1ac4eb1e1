package io.clubone.fmart.exception;

/**
 * Base class of every failure raised by the FamilyMart invoice client.
 */
public class FmartException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public FmartException(String message) {
		super(message);
	}

	public FmartException(String message, Throwable cause) {
		super(message, cause);
	}
}
