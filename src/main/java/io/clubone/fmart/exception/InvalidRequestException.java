package io.clubone.fmart.exception;

public class InvalidRequestException extends FmartException {

	private static final long serialVersionUID = 1L;

	public InvalidRequestException(String message) {
		super("fmart: invalid request, " + message);
	}

	public InvalidRequestException(String message, Throwable cause) {
		super("fmart: invalid request, " + message, cause);
	}
}
