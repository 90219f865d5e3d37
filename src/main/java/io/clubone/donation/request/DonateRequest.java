package io.clubone.donation.request;

import java.math.BigInteger;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DonateRequest {

	/** Smallest unit of the payment asset. */
	@NotNull
	private BigInteger amount;
}
