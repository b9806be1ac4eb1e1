package io.clubone.fmart.request;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import io.clubone.fmart.config.FmartProperties;
import io.clubone.fmart.validator.RequestValidator;
import io.clubone.fmart.validator.ValidationErrors;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Fields shared by the issue and modify requests.
 */
@Getter
@ToString
@SuperBuilder
@NoArgsConstructor
public abstract class InvoiceParams {

	private String name;

	private String nameKatakana;

	private String phoneNumber;

	private Integer amount;

	private LocalDateTime expiry;

	/**
	 * Kind of request these params are sent as.
	 */
	public abstract RegistType getRegistType();

	public boolean isValid(Clock clock) {
		return errors(clock).isEmpty();
	}

	/**
	 * Map of errors where the key is the invalid field and the value holds its messages.
	 * Expiry bounds are taken relative to {@code clock} at the moment of the call.
	 */
	public ValidationErrors errors(Clock clock) {
		LocalDateTime now = LocalDateTime.now(clock);
		ValidationErrors errors = new ValidationErrors();
		validateKey(errors, now);
		return errors
			.apply(RequestValidator.NAME, name, RequestValidator.NAME_RULES, now)
			.apply(RequestValidator.NAME_KATAKANA, nameKatakana, RequestValidator.NAME_KATAKANA_RULES, now)
			.apply(RequestValidator.PHONE_NUMBER, phoneNumber, RequestValidator.PHONE_NUMBER_RULES, now)
			.apply(RequestValidator.AMOUNT, amount, RequestValidator.AMOUNT_RULES, now)
			.apply(RequestValidator.EXPIRY, expiry, RequestValidator.EXPIRY_RULES, now);
	}

	/**
	 * Form representation of the request, credentials of {@code account} included.
	 */
	public Map<String, String> toFormParams(FmartProperties account) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put(FormFields.LOGIN_USER_ID, account.getUserId());
		params.put(FormFields.LOGIN_PASSWORD, account.getUserPassword());
		params.put(FormFields.REGIST_TYPE, getRegistType().getCode());
		putKey(params);
		params.put(FormFields.NAME, name);
		params.put(FormFields.KANA, nameKatakana);
		params.put(FormFields.PHONE_NO, phoneNumber);
		params.put(FormFields.PAYMENT, amount == null ? "" : Integer.toString(amount));
		params.put(FormFields.DATE_OF_EXPIRY, expiry == null ? "" : FormFields.EXPIRY_FORMAT.format(expiry));
		return params;
	}

	protected void validateKey(ValidationErrors errors, LocalDateTime now) {
	}

	protected void putKey(Map<String, String> params) {
	}
}
