package io.clubone.donation.vo;

import java.math.BigInteger;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequestDTO {
	private Address payer;
	private Address payee;
	private BigInteger amount; // smallest unit of the asset
}
