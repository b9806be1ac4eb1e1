package io.clubone.fmart.response;

import java.util.Optional;

public enum DepositStatus {

	/** Customer deposited but can still cancel. */
	DEPOSIT_MADE(1),
	/** Customer deposited and canceled. */
	DEPOSIT_CANCELED(2),
	/** Customer deposited and can no longer cancel. */
	DEPOSIT_FINALIZED(3);

	private int code;

	public int getCode() {
		return code;
	}

	private DepositStatus(int code) {
		this.code = code;
	}

	public static Optional<DepositStatus> fromCode(String code) {
		DepositStatus[] statuses = values();
		for (DepositStatus status : statuses) {
			if (String.valueOf(status.getCode()).equals(code)) {
				return Optional.of(status);
			}
		}
		return Optional.empty();
	}
}
