package io.clubone.donation.request;

import io.clubone.donation.util.ConstantUtility;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class VerifyDonationRequest {

	/** Hex encoded, with or without 0x. */
	@NotBlank
	private String proof;

	@NotBlank
	@Size(max = ConstantUtility.MAX_INVOICE_ID_LENGTH)
	private String invoiceId;
}
