package io.clubone.fmart.response;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * State of one invoice as reported by a status notification.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class InvoiceStatus {

	private final String id;

	private final int amount;

	private final DepositStatus status;

	private final LocalDateTime updatedAt;
}
