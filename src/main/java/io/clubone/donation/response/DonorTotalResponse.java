package io.clubone.donation.response;

import java.math.BigInteger;

import io.clubone.donation.vo.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DonorTotalResponse {
	private Address donor;
	private BigInteger total;
}
