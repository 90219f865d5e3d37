package io.clubone.donation.service.impl;

import java.math.BigInteger;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import io.clubone.donation.config.CharityProperties;
import io.clubone.donation.dao.InvoiceTokenDAO;
import io.clubone.donation.event.DonationReceivedEvent;
import io.clubone.donation.event.DonationVerifiedEvent;
import io.clubone.donation.exception.NotValidException;
import io.clubone.donation.exception.ProofVerificationFailedException;
import io.clubone.donation.exception.TokenNotFoundException;
import io.clubone.donation.exception.TransferFailedException;
import io.clubone.donation.helper.DonorLocks;
import io.clubone.donation.payment.PaymentRail;
import io.clubone.donation.service.DonationLedgerService;
import io.clubone.donation.service.DonationOrchestrator;
import io.clubone.donation.service.TokenMinter;
import io.clubone.donation.service.TokenRegistryService;
import io.clubone.donation.util.Amounts;
import io.clubone.donation.util.ConstantUtility;
import io.clubone.donation.verifier.ProofData;
import io.clubone.donation.verifier.ProofVerifier;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.CharityDescriptorDTO;
import io.clubone.donation.vo.DonationRecordDTO;
import io.clubone.donation.vo.DonationsSummaryDTO;
import io.clubone.donation.vo.TokenKind;

@Service
public class DonationOrchestratorImpl implements DonationOrchestrator {

	@Autowired
	private TokenMinter tokenMinter;

	@Autowired
	private TokenRegistryService tokenRegistryService;

	@Autowired
	private DonationLedgerService ledgerService;

	@Autowired
	private InvoiceTokenDAO invoiceTokenDAO;

	@Autowired
	private ProofVerifier proofVerifier;

	@Autowired
	private PaymentRail paymentRail;

	@Autowired
	private CharityProperties charity;

	@Autowired
	private DonorLocks donorLocks;

	@Autowired
	private ApplicationEventPublisher eventPublisher;

	@Autowired
	private PlatformTransactionManager txm;

	private static final Logger log = LoggerFactory.getLogger(DonationOrchestratorImpl.class);

	@Override
	public long donate(Address donor, BigInteger amount) {
		Amounts.requirePositive(amount);
		requireDonor(donor);
		return donorLocks.withLock(donor, () -> {
			// reject an overflowing total before any funds move
			Amounts.checkedAdd(tokenRegistryService.getDonations(donor), amount);
			Address payout = Address.of(charity.getPayoutAddress());

			// the transfer is the last step, so a failed write never leaves the donor charged
			return new TransactionTemplate(txm).execute(status -> {
				ledgerService.record(donor, amount);
				tokenMinter.recordDonation(donor, amount);
				long tokenId = tokenMinter.mint(donor, TokenKind.DONATION,
						TokenKind.DONATION.metadataQuery(amount.toString()));
				transfer(donor, payout, amount);
				eventPublisher.publishEvent(new DonationReceivedEvent(donor, amount, tokenId));
				return tokenId;
			});
		});
	}

	private void transfer(Address donor, Address payout, BigInteger amount) {
		boolean transferred;
		try {
			transferred = paymentRail.transferFrom(donor, payout, amount);
		} catch (RuntimeException e) {
			log.error("Payment rail error for donor={} amount={}", donor, amount, e);
			throw new TransferFailedException("Payment transfer failed for donor " + donor, e);
		}
		if (!transferred) {
			log.warn("Payment rail declined donor={} amount={}", donor, amount);
			throw new TransferFailedException("Payment transfer declined for donor " + donor);
		}
	}

	@Override
	public long verifyDonation(Address donor, ProofData proof, String invoiceId) {
		if (StringUtils.isBlank(invoiceId)) {
			throw new NotValidException("Invoice id is required");
		}
		if (invoiceId.length() > ConstantUtility.MAX_INVOICE_ID_LENGTH) {
			throw new NotValidException(
					"Invoice id longer than " + ConstantUtility.MAX_INVOICE_ID_LENGTH + " characters");
		}
		// a null or zero claimant is the verifier's call, not a validation error
		Address lockKey = donor == null ? Address.ZERO : donor;
		return donorLocks.withLock(lockKey, () -> {
			if (!proofVerifier.verify(proof, donor)) {
				log.warn("Proof rejected for donor={} invoiceId={}", donor, invoiceId);
				throw new ProofVerificationFailedException("Proof verification failed for donor " + donor);
			}

			return new TransactionTemplate(txm).execute(status -> {
				ledgerService.markVerified(donor, invoiceId);
				long tokenId = tokenMinter.mint(donor, TokenKind.INVOICE, TokenKind.INVOICE.metadataQuery(invoiceId));
				invoiceTokenDAO.saveInvoiceToken(donor, tokenId);
				eventPublisher.publishEvent(new DonationVerifiedEvent(donor, invoiceId, tokenId));
				return tokenId;
			});
		});
	}

	@Override
	public DonationsSummaryDTO getAllDonations() {
		return ledgerService.allDonations();
	}

	@Override
	public CharityDescriptorDTO getCharityInfo() {
		return CharityDescriptorDTO.builder()
				.link(charity.getLink())
				.registeredAt(charity.getRegisteredAt())
				.name(charity.getName())
				.foundation(charity.getFoundation())
				.source(charity.getSource())
				.suggestedPrice(charity.getSuggestedPrice())
				.imageLocator(charity.getImageLocator())
				.build();
	}

	@Override
	public BigInteger getDonations(Address donor) {
		return tokenRegistryService.getDonations(donor);
	}

	@Override
	public long getInvoiceToken(Address donor) {
		return invoiceTokenDAO.findInvoiceToken(donor)
				.orElseThrow(() -> new TokenNotFoundException("No invoice token for donor " + donor));
	}

	@Override
	public DonationRecordDTO getDonationRecord(Address donor) {
		return ledgerService.getRecord(donor);
	}

	private static void requireDonor(Address donor) {
		if (donor == null || donor.isZero()) {
			throw new NotValidException("Donor address is required");
		}
	}
}
