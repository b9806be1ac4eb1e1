package io.clubone.fmart.service;

import java.util.List;

import io.clubone.fmart.request.IssueInvoiceParams;
import io.clubone.fmart.request.ModifyInvoiceParams;

/**
 * Lifecycle operations on FamilyMart invoices. Every call is a single blocking
 * POST; failures surface as {@link io.clubone.fmart.exception.FmartException} subclasses.
 */
public interface InvoiceIssuanceService {

	/**
	 * Issues a new invoice.
	 *
	 * @return identifier of the new invoice
	 */
	String issueInvoice(IssueInvoiceParams params);

	/**
	 * Replaces the contents of an existing invoice.
	 *
	 * @return identifier confirmed by the API
	 */
	String modifyInvoice(ModifyInvoiceParams params);

	/**
	 * Cancels an existing invoice.
	 *
	 * @return identifier confirmed by the API
	 */
	String cancelInvoice(String id);

	/**
	 * Tells the API that status notifications for {@code ids} were received.
	 */
	void acknowledgeInvoiceStatuses(List<String> ids);
}
