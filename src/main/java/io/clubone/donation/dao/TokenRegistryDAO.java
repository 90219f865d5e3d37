package io.clubone.donation.dao;

import java.math.BigInteger;
import java.util.Optional;

import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.TokenRow;

public interface TokenRegistryDAO {

	/**
	 * Claims the next token id from the shared counter. Must run inside the transaction that
	 * inserts the token, so a rollback gives the id back.
	 */
	long allocateTokenId();

	long nextTokenId();

	int insertToken(TokenRow row);

	Optional<TokenRow> findToken(long tokenId);

	long countByOwner(Address owner);

	Optional<String> findBaseLocator();

	int saveBaseLocator(String baseLocator, Address modifiedBy);

	BigInteger findDonationTotal(Address donor);

	int saveDonationTotal(Address donor, BigInteger total);
}
