package io.clubone.fmart.exception;

public enum ExceptionType {

	ERROR("error"),
	VALIDATION("validation"),
	UNAUTHORIZED("unauthorized");

	private String type;

	public String getType() {
		return type;
	}

	private ExceptionType(String type) {
		this.type = type;
	}
}
