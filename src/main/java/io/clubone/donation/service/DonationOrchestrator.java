package io.clubone.donation.service;

import java.math.BigInteger;

import io.clubone.donation.verifier.ProofData;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.CharityDescriptorDTO;
import io.clubone.donation.vo.DonationRecordDTO;
import io.clubone.donation.vo.DonationsSummaryDTO;

public interface DonationOrchestrator {

	/**
	 * Pulls {@code amount} from the donor to the charity, records it and mints a donation token.
	 *
	 * @return id of the donation token
	 */
	long donate(Address donor, BigInteger amount);

	/**
	 * Checks the proof, marks the donor's record verified and mints an invoice token.
	 *
	 * @return id of the invoice token
	 */
	long verifyDonation(Address donor, ProofData proof, String invoiceId);

	DonationsSummaryDTO getAllDonations();

	CharityDescriptorDTO getCharityInfo();

	BigInteger getDonations(Address donor);

	long getInvoiceToken(Address donor);

	DonationRecordDTO getDonationRecord(Address donor);
}
