package io.clubone.fmart.request;

/**
 * Value of the {@code regist_type} form field, telling the API which operation a request performs.
 */
public enum RegistType {

	ISSUE("1"),
	MODIFY("2"),
	CANCEL("9");

	private final String code;

	private RegistType(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}
}
