package io.clubone.donation.exception;

/**
 * Base of the typed failures surfaced by the ledger, the registry and the orchestrator.
 */
public abstract class DonationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final DonationErrorCode errorCode;

	protected DonationException(DonationErrorCode errorCode, String message) {
		super(message);
		this.errorCode = errorCode;
	}

	protected DonationException(DonationErrorCode errorCode, String message, Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}

	public DonationErrorCode getErrorCode() {
		return errorCode;
	}
}
