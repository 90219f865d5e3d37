package io.clubone.donation.exception;

import java.math.BigInteger;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidAmountException extends DonationException {

	private static final long serialVersionUID = 1L;

	public InvalidAmountException(BigInteger amount) {
		super(DonationErrorCode.INVALID_AMOUNT, "Invalid donation amount: " + amount);
	}

	public InvalidAmountException(String message) {
		super(DonationErrorCode.INVALID_AMOUNT, message);
	}
}
