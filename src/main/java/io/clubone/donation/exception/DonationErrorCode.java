package io.clubone.donation.exception;

import org.springframework.http.HttpStatus;

public enum DonationErrorCode {
	INVALID_AMOUNT(30001, HttpStatus.BAD_REQUEST),
	TRANSFER_FAILED(30002, HttpStatus.PAYMENT_REQUIRED),
	PROOF_VERIFICATION_FAILED(30003, HttpStatus.UNPROCESSABLE_ENTITY),
	TOKEN_NOT_FOUND(30004, HttpStatus.NOT_FOUND),
	UNAUTHORIZED(30005, HttpStatus.FORBIDDEN);

	private int code;

	private HttpStatus status;

	public int getCode() {
		return code;
	}

	public HttpStatus getStatus() {
		return status;
	}

	private DonationErrorCode(int code, HttpStatus status) {
		this.code = code;
		this.status = status;
	}
}
