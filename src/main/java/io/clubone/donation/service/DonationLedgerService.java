package io.clubone.donation.service;

import java.math.BigInteger;

import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.DonationRecordDTO;
import io.clubone.donation.vo.DonationsSummaryDTO;

public interface DonationLedgerService {

	void record(Address donor, BigInteger amount);

	void markVerified(Address donor, String invoiceId);

	DonationsSummaryDTO allDonations();

	DonationRecordDTO getRecord(Address donor);
}
