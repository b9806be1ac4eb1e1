package io.clubone.fmart.request;

import java.time.LocalDateTime;
import java.util.Map;

import io.clubone.fmart.validator.RequestValidator;
import io.clubone.fmart.validator.ValidationErrors;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Params replacing the contents of an existing invoice, identified by {@link #getId()}.
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class ModifyInvoiceParams extends InvoiceParams {

	private String id;

	@Override
	public RegistType getRegistType() {
		return RegistType.MODIFY;
	}

	@Override
	protected void validateKey(ValidationErrors errors, LocalDateTime now) {
		errors.apply(RequestValidator.ID, id, RequestValidator.ID_RULES, now);
	}

	@Override
	protected void putKey(Map<String, String> params) {
		params.put(FormFields.RECEIPT_NO, id);
	}
}
