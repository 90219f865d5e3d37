package io.clubone.donation.util;

import java.math.BigInteger;

import io.clubone.donation.exception.InvalidAmountException;

/**
 * Amounts are unsigned 256-bit integers in the smallest unit of the payment asset.
 */
public final class Amounts {

	public static final BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

	private Amounts() {
	}

	/**
	 * @throws InvalidAmountException unless {@code 0 < amount <= 2^256-1}
	 */
	public static BigInteger requirePositive(BigInteger amount) {
		if (amount == null || amount.signum() <= 0 || amount.compareTo(MAX_AMOUNT) > 0) {
			throw new InvalidAmountException(amount);
		}
		return amount;
	}

	public static BigInteger checkedAdd(BigInteger total, BigInteger amount) {
		BigInteger sum = total.add(amount);
		if (sum.compareTo(MAX_AMOUNT) > 0) {
			throw new InvalidAmountException("Cumulative donation total would overflow");
		}
		return sum;
	}
}
