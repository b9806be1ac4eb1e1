package io.clubone.fmart.validator;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Factory of the rule kinds used by the request parameter models.
 */
public final class FieldRules {

	private static final DateTimeFormatter BOUND_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

	private FieldRules() {
	}

	public static FieldRule<String> minLength(int n) {
		return FieldRule.of((v, now) -> length(v) >= n,
			(v, now) -> String.format("must be at least %d characters", n));
	}

	public static FieldRule<String> maxLength(int n) {
		return FieldRule.of((v, now) -> length(v) <= n,
			(v, now) -> String.format("must be at most %d characters", n));
	}

	public static FieldRule<Integer> min(int n) {
		return FieldRule.of((v, now) -> v != null && v >= n,
			(v, now) -> String.format("must be greater than or equal to %d", n));
	}

	public static FieldRule<Integer> max(int n) {
		return FieldRule.of((v, now) -> v == null || v <= n,
			(v, now) -> String.format("must be less than or equal to %d", n));
	}

	/**
	 * The value must be strictly after {@code now + offset}.
	 */
	public static FieldRule<LocalDateTime> after(Duration offset) {
		return FieldRule.of((v, now) -> v != null && v.isAfter(now.plus(offset)),
			(v, now) -> "must be after " + BOUND_FORMAT.format(now.plus(offset)));
	}

	/**
	 * The value must not be later than {@code now + offset}.
	 */
	public static FieldRule<LocalDateTime> notAfter(Duration offset) {
		return FieldRule.of((v, now) -> v == null || !v.isAfter(now.plus(offset)),
			(v, now) -> "must not be after " + BOUND_FORMAT.format(now.plus(offset)));
	}

	public static FieldRule<String> singleLine() {
		return FieldRule.of((v, now) -> v == null || (v.indexOf('\r') < 0 && v.indexOf('\n') < 0),
			(v, now) -> "must not contain line breaks");
	}

	public static <E> FieldRule<List<E>> minSize(int n) {
		return FieldRule.of((v, now) -> v != null && v.size() >= n,
			(v, now) -> String.format("must contain at least %d elements", n));
	}

	/**
	 * The whole value must match {@code regex}.
	 */
	public static FieldRule<String> format(String regex) {
		Pattern pattern = Pattern.compile(regex);
		return FieldRule.of((v, now) -> v != null && pattern.matcher(v).matches(), (v, now) -> "invalid format");
	}

	// code points, so a kanji counts once
	private static int length(String value) {
		return StringUtils.isEmpty(value) ? 0 : value.codePointCount(0, value.length());
	}
}
