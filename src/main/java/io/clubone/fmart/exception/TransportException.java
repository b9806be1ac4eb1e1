package io.clubone.fmart.exception;

public class TransportException extends FmartException {

	private static final long serialVersionUID = 1L;

	public TransportException(String message, Throwable cause) {
		super("fmart: " + message, cause);
	}
}
