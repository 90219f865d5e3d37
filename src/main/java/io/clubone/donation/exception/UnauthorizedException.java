package io.clubone.donation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.FORBIDDEN)
public class UnauthorizedException extends DonationException {

	private static final long serialVersionUID = 1L;

	public UnauthorizedException(String message) {
		super(DonationErrorCode.UNAUTHORIZED, message);
	}
}
