package io.clubone.donation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class ProofVerificationFailedException extends DonationException {

	private static final long serialVersionUID = 1L;

	public ProofVerificationFailedException(String message) {
		super(DonationErrorCode.PROOF_VERIFICATION_FAILED, message);
	}
}
