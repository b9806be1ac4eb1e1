package io.clubone.fmart.exception;

import lombok.Getter;

/**
 * The API answered with a status other than 200, or with a multi-line error body.
 */
@Getter
public class ServerErrorException extends FmartException {

	private static final long serialVersionUID = 1L;

	private final int statusCode;

	private final String body;

	public ServerErrorException(int statusCode, String body) {
		super(statusCode == 200 ? "fmart: " + body : "fmart: server returned " + statusCode + " " + body);
		this.statusCode = statusCode;
		this.body = body;
	}
}
