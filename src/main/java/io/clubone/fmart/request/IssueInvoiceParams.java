package io.clubone.fmart.request;

import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Params of a new invoice.
 */
@ToString(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class IssueInvoiceParams extends InvoiceParams {

	@Override
	public RegistType getRegistType() {
		return RegistType.ISSUE;
	}
}
