package io.clubone.donation.vo;

import java.math.BigInteger;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parallel lists in roster order: {@code amounts.get(i)} and {@code verified.get(i)} belong to
 * {@code donors.get(i)}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DonationsSummaryDTO {
	private List<Address> donors;
	private List<BigInteger> amounts;
	private List<Boolean> verified;
}
