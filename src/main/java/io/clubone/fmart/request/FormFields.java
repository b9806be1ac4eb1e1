package io.clubone.fmart.request;

import java.time.format.DateTimeFormatter;

/**
 * Form field names of the invoice API.
 */
public final class FormFields {

	public static final String LOGIN_USER_ID = "login_user_id";
	public static final String LOGIN_PASSWORD = "login_password";
	public static final String REGIST_TYPE = "regist_type";
	public static final String RECEIPT_NO = "receipt_no";
	public static final String NAME = "name";
	public static final String KANA = "kana";
	public static final String PHONE_NO = "phone_no";
	public static final String PAYMENT = "payment";
	public static final String DATE_OF_EXPIRY = "date_of_expiry";

	public static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd");

	private FormFields() {
	}
}
