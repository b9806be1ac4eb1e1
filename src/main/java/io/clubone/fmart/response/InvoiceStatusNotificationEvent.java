package io.clubone.fmart.response;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * Published once per accepted status notification, carrying every status it reported.
 */
@Getter
@ToString
public class InvoiceStatusNotificationEvent {

	private final List<InvoiceStatus> statuses;

	public InvoiceStatusNotificationEvent(List<InvoiceStatus> statuses) {
		this.statuses = List.copyOf(statuses);
	}
}
