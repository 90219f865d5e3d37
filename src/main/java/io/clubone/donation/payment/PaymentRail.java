package io.clubone.donation.payment;

import java.math.BigInteger;

import io.clubone.donation.vo.Address;

/**
 * Moves the donated asset from donor to charity. The payer must have authorized the payee on the
 * rail beforehand; this service never does that on the payer's behalf.
 */
public interface PaymentRail {

	/**
	 * @return true only if the full amount was moved
	 */
	boolean transferFrom(Address payer, Address payee, BigInteger amount);
}
