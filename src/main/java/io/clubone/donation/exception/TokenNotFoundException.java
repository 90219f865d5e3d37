package io.clubone.donation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class TokenNotFoundException extends DonationException {

	private static final long serialVersionUID = 1L;

	public TokenNotFoundException(long tokenId) {
		super(DonationErrorCode.TOKEN_NOT_FOUND, String.format("Token not found with tokenId:%s", tokenId));
	}

	public TokenNotFoundException(String message) {
		super(DonationErrorCode.TOKEN_NOT_FOUND, message);
	}
}
