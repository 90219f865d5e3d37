package io.clubone.donation.dao;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.DonationRecordDTO;

public interface DonationLedgerDAO {

	Optional<DonationRecordDTO> findRecord(Address donor);

	/** Replaces amount, verified flag and invoice id; inserts the record if the donor has none. */
	int saveRecord(Address donor, BigInteger amount, boolean verified, String invoiceId);

	/** Sets verified and invoice id; inserts a zero-amount record if the donor has none. */
	int markVerified(Address donor, String invoiceId);

	/**
	 * @return true if the donor was appended, false if already on the roster
	 */
	boolean appendToRoster(Address donor);

	/** Records of every roster member, in roster order. */
	List<DonationRecordDTO> findRosterRecords();
}
