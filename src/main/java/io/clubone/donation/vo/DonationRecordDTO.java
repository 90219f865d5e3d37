package io.clubone.donation.vo;

import java.math.BigInteger;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Latest donation of one donor. Overwritten by each new donation; see the cumulative total on the
 * token registry for the running sum.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DonationRecordDTO {
	private Address donor;
	private BigInteger amount;
	private boolean verified;
	private String invoiceId;
}
