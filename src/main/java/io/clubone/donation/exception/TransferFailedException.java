package io.clubone.donation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.PAYMENT_REQUIRED)
public class TransferFailedException extends DonationException {

	private static final long serialVersionUID = 1L;

	public TransferFailedException(String message) {
		super(DonationErrorCode.TRANSFER_FAILED, message);
	}

	public TransferFailedException(String message, Throwable cause) {
		super(DonationErrorCode.TRANSFER_FAILED, message, cause);
	}
}
