package io.clubone.fmart.validator;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * A single check on a field value: a predicate that accepts valid values and
 * a formatter producing the violation message. Both receive the time at which
 * validation runs.
 *
 * @param <T> type of the checked value
 */
public final class FieldRule<T> {

	private final BiPredicate<T, LocalDateTime> accepts;

	private final BiFunction<T, LocalDateTime, String> message;

	private FieldRule(BiPredicate<T, LocalDateTime> accepts, BiFunction<T, LocalDateTime, String> message) {
		this.accepts = accepts;
		this.message = message;
	}

	public static <T> FieldRule<T> of(BiPredicate<T, LocalDateTime> accepts,
		BiFunction<T, LocalDateTime, String> message) {
		return new FieldRule<>(accepts, message);
	}

	/**
	 * @return the violation message, or empty when {@code value} passes
	 */
	public Optional<String> check(T value, LocalDateTime now) {
		if (accepts.test(value, now)) {
			return Optional.empty();
		}
		return Optional.of(message.apply(value, now));
	}
}
