package io.clubone.donation.service.impl;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.clubone.donation.dao.DonationLedgerDAO;
import io.clubone.donation.exception.NotValidException;
import io.clubone.donation.exception.ResourceNotFoundException;
import io.clubone.donation.service.DonationLedgerService;
import io.clubone.donation.util.Amounts;
import io.clubone.donation.util.ConstantUtility;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.DonationRecordDTO;
import io.clubone.donation.vo.DonationsSummaryDTO;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class DonationLedgerServiceImpl implements DonationLedgerService {

	@Autowired
	private DonationLedgerDAO dao;

	/**
	 * Overwrites the donor's record with this donation alone (verified cleared) and puts the donor
	 * on the roster the first time round.
	 */
	@Override
	@Transactional
	public void record(Address donor, BigInteger amount) {
		Amounts.requirePositive(amount);
		requireDonor(donor);
		dao.saveRecord(donor, amount, false, null);
		if (dao.appendToRoster(donor)) {
			log.info("Donor {} added to roster", donor);
		}
	}

	/**
	 * A donor with no record gets a zero-amount verified record. The roster is left alone.
	 */
	@Override
	@Transactional
	public void markVerified(Address donor, String invoiceId) {
		requireDonor(donor);
		dao.markVerified(donor, invoiceId);
	}

	@Override
	public DonationsSummaryDTO allDonations() {
		List<DonationRecordDTO> records = dao.findRosterRecords();
		List<Address> donors = new ArrayList<>(records.size());
		List<BigInteger> amounts = new ArrayList<>(records.size());
		List<Boolean> verified = new ArrayList<>(records.size());
		for (DonationRecordDTO record : records) {
			donors.add(record.getDonor());
			amounts.add(record.getAmount());
			verified.add(record.isVerified());
		}
		return new DonationsSummaryDTO(donors, amounts, verified);
	}

	@Override
	public DonationRecordDTO getRecord(Address donor) {
		return dao.findRecord(donor).orElseThrow(
				() -> new ResourceNotFoundException(ConstantUtility.DONATION_RECORD, "donor", donor.getValue()));
	}

	private static void requireDonor(Address donor) {
		if (donor == null || donor.isZero()) {
			throw new NotValidException("Donor address is required");
		}
	}
}
