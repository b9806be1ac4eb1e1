package io.clubone.fmart.exception;

public class EncodingException extends FmartException {

	private static final long serialVersionUID = 1L;

	public EncodingException(String message, Throwable cause) {
		super("fmart: " + message, cause);
	}
}
