package io.clubone.donation.service;

import java.math.BigInteger;

import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.TokenKind;

/**
 * Write side of the token registry. Only the donation orchestrator holds this capability; the
 * HTTP layer sees {@link TokenRegistryService} alone.
 */
public interface TokenMinter {

	/**
	 * Allocates the next sequential id and binds it to {@code owner}. The locator of the new token
	 * is {@code <base><id>.json?<metadataQuery>}, with the base resolved at query time.
	 *
	 * @return the new token id, one greater than the previous one, starting at 0
	 */
	long mint(Address owner, TokenKind kind, String metadataQuery);

	/**
	 * Adds {@code amount} to the donor's cumulative total.
	 */
	void recordDonation(Address donor, BigInteger amount);
}
