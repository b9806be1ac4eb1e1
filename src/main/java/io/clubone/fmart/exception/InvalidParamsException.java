package io.clubone.fmart.exception;

import io.clubone.fmart.validator.ValidationErrors;
import lombok.Getter;

/**
 * Raised before any network call when request parameters fail local validation.
 */
@Getter
public class InvalidParamsException extends FmartException {

	private static final long serialVersionUID = 1L;

	private final transient ValidationErrors errors;

	public InvalidParamsException(ValidationErrors errors) {
		super("fmart: invalid params " + errors);
		this.errors = errors;
	}
}
