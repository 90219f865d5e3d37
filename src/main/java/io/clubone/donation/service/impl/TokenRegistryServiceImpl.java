package io.clubone.donation.service.impl;

import java.math.BigInteger;
import java.time.Instant;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.clubone.donation.dao.TokenRegistryDAO;
import io.clubone.donation.exception.NotValidException;
import io.clubone.donation.exception.TokenNotFoundException;
import io.clubone.donation.exception.UnauthorizedException;
import io.clubone.donation.service.TokenMinter;
import io.clubone.donation.service.TokenRegistryService;
import io.clubone.donation.util.Amounts;
import io.clubone.donation.util.ConstantUtility;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.TokenDTO;
import io.clubone.donation.vo.TokenKind;
import io.clubone.donation.vo.TokenRow;

@Service
public class TokenRegistryServiceImpl implements TokenRegistryService, TokenMinter {

	@Autowired
	private TokenRegistryDAO dao;

	@Value("${donation.registry.admin-address}")
	private String adminAddress;

	@Value("${donation.registry.base-locator}")
	private String defaultBaseLocator;

	private static final Logger log = LoggerFactory.getLogger(TokenRegistryServiceImpl.class);

	@Override
	@Transactional
	public long mint(Address owner, TokenKind kind, String metadataQuery) {
		if (owner == null || owner.isZero()) {
			throw new NotValidException("Cannot mint to the zero address");
		}
		if (kind == null || StringUtils.isBlank(metadataQuery)) {
			throw new NotValidException("Token kind and metadata are required");
		}
		long tokenId = dao.allocateTokenId();
		dao.insertToken(new TokenRow(tokenId, owner, kind, metadataQuery, Instant.now()));
		log.info("Minted {} tokenId={} owner={}", kind, tokenId, owner);
		return tokenId;
	}

	@Override
	@Transactional
	public void recordDonation(Address donor, BigInteger amount) {
		Amounts.requirePositive(amount);
		BigInteger total = Amounts.checkedAdd(dao.findDonationTotal(donor), amount);
		dao.saveDonationTotal(donor, total);
		log.debug("Cumulative donations for donor={} now {}", donor, total);
	}

	@Override
	@Transactional
	public void setBaseLocator(Address caller, String newBase) {
		if (caller == null || !caller.equals(Address.of(adminAddress))) {
			log.warn("Rejected base locator change from caller={}", caller);
			throw new UnauthorizedException("Only the registry administrator may change the base locator");
		}
		if (StringUtils.isBlank(newBase)) {
			throw new NotValidException("Base locator is required");
		}
		dao.saveBaseLocator(newBase, caller);
		log.info("Base locator changed to {}", newBase);
	}

	@Override
	public String getBaseLocator() {
		return dao.findBaseLocator().orElse(defaultBaseLocator);
	}

	@Override
	public String locatorOf(long tokenId) {
		TokenRow row = findToken(tokenId);
		return locator(row);
	}

	@Override
	public Address ownerOf(long tokenId) {
		return findToken(tokenId).getOwner();
	}

	@Override
	public TokenDTO getToken(long tokenId) {
		TokenRow row = findToken(tokenId);
		return TokenDTO.builder()
				.tokenId(row.getTokenId())
				.owner(row.getOwner())
				.kind(row.getKind())
				.locator(locator(row))
				.mintedOn(row.getMintedOn())
				.build();
	}

	@Override
	public long balanceOf(Address owner) {
		return dao.countByOwner(owner);
	}

	@Override
	public long totalMinted() {
		return dao.nextTokenId();
	}

	@Override
	public BigInteger getDonations(Address donor) {
		return dao.findDonationTotal(donor);
	}

	private TokenRow findToken(long tokenId) {
		if (tokenId < 0 || tokenId >= dao.nextTokenId()) {
			throw new TokenNotFoundException(tokenId);
		}
		return dao.findToken(tokenId).orElseThrow(() -> new TokenNotFoundException(tokenId));
	}

	// base is read on every call, never cached on the token
	private String locator(TokenRow row) {
		return getBaseLocator() + row.getTokenId() + ConstantUtility.METADATA_EXTENSION + row.getMetadataQuery();
	}
}
