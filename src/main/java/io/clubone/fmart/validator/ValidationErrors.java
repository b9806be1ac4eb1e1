package io.clubone.fmart.validator;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field name to ordered violation messages. Fields without violations have no entry,
 * so an empty instance means the validated object is valid.
 */
public class ValidationErrors {

	private final Map<String, List<String>> errors = new LinkedHashMap<>();

	/**
	 * Runs every rule against {@code value} in order and records each violation under {@code field}.
	 */
	public <T> ValidationErrors apply(String field, T value, List<FieldRule<T>> rules, LocalDateTime now) {
		for (FieldRule<T> rule : rules) {
			rule.check(value, now).ifPresent(msg -> errors.computeIfAbsent(field, k -> new ArrayList<>()).add(msg));
		}
		return this;
	}

	public boolean isEmpty() {
		return errors.isEmpty();
	}

	public List<String> get(String field) {
		List<String> messages = errors.get(field);
		return messages == null ? Collections.emptyList() : Collections.unmodifiableList(messages);
	}

	public Map<String, List<String>> asMap() {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		errors.forEach((k, v) -> copy.put(k, List.copyOf(v)));
		return Collections.unmodifiableMap(copy);
	}

	@Override
	public String toString() {
		return errors.toString();
	}
}
