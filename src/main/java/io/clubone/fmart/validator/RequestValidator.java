package io.clubone.fmart.validator;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Rule lists of the invoice API fields.
 */
public final class RequestValidator {

	public static final String ID = "id";

	public static final String NAME = "name";

	public static final String NAME_KATAKANA = "name_katakana";

	public static final String PHONE_NUMBER = "phone_number";

	public static final String AMOUNT = "amount";

	public static final String EXPIRY = "expiry";

	public static final String IDS = "ids";

	private static final String PHONE_NUMBER_REGEX = "\\d{2,5}-\\d{2,5}-\\d{3,4}";

	public static final int MAX_AMOUNT = 999999;

	public static final Duration MAX_EXPIRY_AHEAD = Duration.ofDays(60);

	public static final List<FieldRule<String>> ID_RULES = List.of(
		FieldRules.minLength(1),
		FieldRules.maxLength(18));

	public static final List<FieldRule<String>> NAME_RULES = List.of(
		FieldRules.minLength(1),
		FieldRules.maxLength(40));

	public static final List<FieldRule<String>> NAME_KATAKANA_RULES = List.of(
		FieldRules.minLength(1),
		FieldRules.maxLength(30));

	public static final List<FieldRule<String>> PHONE_NUMBER_RULES = List.of(
		FieldRules.minLength(1),
		FieldRules.maxLength(13),
		FieldRules.format(PHONE_NUMBER_REGEX));

	public static final List<FieldRule<Integer>> AMOUNT_RULES = List.of(
		FieldRules.min(1),
		FieldRules.max(MAX_AMOUNT));

	public static final List<FieldRule<LocalDateTime>> EXPIRY_RULES = List.of(
		FieldRules.after(Duration.ZERO),
		FieldRules.notAfter(MAX_EXPIRY_AHEAD));

	public static final List<FieldRule<String>> ACK_ID_RULES = List.of(
		FieldRules.minLength(1),
		FieldRules.maxLength(18),
		FieldRules.singleLine());

	public static final List<FieldRule<List<String>>> IDS_RULES = List.of(
		FieldRules.<String>minSize(1));

	private RequestValidator() {
	}

	public static ValidationErrors validateId(String id, LocalDateTime now) {
		return new ValidationErrors().apply(ID, id, ID_RULES, now);
	}

	public static ValidationErrors validateIds(List<String> ids, LocalDateTime now) {
		ValidationErrors errors = new ValidationErrors().apply(IDS, ids, IDS_RULES, now);
		if (ids != null) {
			for (int i = 0; i < ids.size(); i++) {
				errors.apply(IDS + "[" + i + "]", ids.get(i), ACK_ID_RULES, now);
			}
		}
		return errors;
	}
}
