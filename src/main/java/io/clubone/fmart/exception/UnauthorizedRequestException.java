package io.clubone.fmart.exception;

/**
 * An inbound notification carried a user id or password that does not match the configured account.
 */
public class UnauthorizedRequestException extends FmartException {

	private static final long serialVersionUID = 1L;

	public UnauthorizedRequestException() {
		super("fmart: unauthorized request");
	}
}
