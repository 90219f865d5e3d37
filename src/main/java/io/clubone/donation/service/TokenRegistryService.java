package io.clubone.donation.service;

import java.math.BigInteger;

import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.TokenDTO;

public interface TokenRegistryService {

	/**
	 * Re-points the locator of every token, minted or not yet minted.
	 *
	 * @throws io.clubone.donation.exception.UnauthorizedException if {@code caller} is not the
	 *         registry administrator
	 */
	void setBaseLocator(Address caller, String newBase);

	String getBaseLocator();

	String locatorOf(long tokenId);

	Address ownerOf(long tokenId);

	TokenDTO getToken(long tokenId);

	long balanceOf(Address owner);

	long totalMinted();

	/** Running sum of every donation recorded for {@code donor}; zero if none. */
	BigInteger getDonations(Address donor);
}
