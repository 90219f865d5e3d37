package io.clubone.donation.dao.impl;

import java.math.BigInteger;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import io.clubone.donation.dao.DonationLedgerDAO;
import io.clubone.donation.dao.utils.DaoUtils;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.DonationRecordDTO;

@Repository
public class DonationLedgerDAOImpl implements DonationLedgerDAO {

	@Autowired
	@Qualifier("donationJdbcTemplate")
	private JdbcTemplate donationJdbcTemplate;

	private static final Logger log = LoggerFactory.getLogger(DonationLedgerDAOImpl.class);

	private static final String SQL_FIND_RECORD = """
			SELECT donor_address, amount, is_verified, invoice_id
			FROM donation_record
			WHERE donor_address = ?
			""";

	private static final String SQL_UPDATE_RECORD = """
			UPDATE donation_record
			SET amount = ?, is_verified = ?, invoice_id = ?, modified_on = ?
			WHERE donor_address = ?
			""";

	private static final String SQL_INSERT_RECORD = """
			INSERT INTO donation_record (donor_address, amount, is_verified, invoice_id, modified_on)
			VALUES (?, ?, ?, ?, ?)
			""";

	private static final String SQL_MARK_VERIFIED = """
			UPDATE donation_record
			SET is_verified = TRUE, invoice_id = ?, modified_on = ?
			WHERE donor_address = ?
			""";

	private static final String SQL_APPEND_ROSTER = """
			INSERT INTO donor_roster (donor_address, added_on)
			SELECT CAST(? AS VARCHAR(42)), CAST(? AS TIMESTAMP)
			WHERE NOT EXISTS (SELECT 1 FROM donor_roster WHERE donor_address = ?)
			""";

	private static final String SQL_ROSTER_RECORDS = """
			SELECT r.donor_address, COALESCE(d.amount, 0) AS amount,
			       COALESCE(d.is_verified, FALSE) AS is_verified, d.invoice_id
			FROM donor_roster r
			LEFT JOIN donation_record d ON d.donor_address = r.donor_address
			ORDER BY r.roster_position
			""";

	private static final RowMapper<DonationRecordDTO> RECORD_ROW_MAPPER = (rs, rowNum) -> DonationRecordDTO.builder()
			.donor(DaoUtils.getAddress(rs, "donor_address"))
			.amount(DaoUtils.getAmount(rs, "amount"))
			.verified(rs.getBoolean("is_verified"))
			.invoiceId(rs.getString("invoice_id"))
			.build();

	@Override
	public Optional<DonationRecordDTO> findRecord(Address donor) {
		return donationJdbcTemplate.query(SQL_FIND_RECORD, RECORD_ROW_MAPPER, donor.getValue()).stream().findFirst();
	}

	@Override
	public int saveRecord(Address donor, BigInteger amount, boolean verified, String invoiceId) {
		Timestamp now = DaoUtils.now();
		int updated = donationJdbcTemplate.update(SQL_UPDATE_RECORD, DaoUtils.toNumeric(amount), verified, invoiceId,
				now, donor.getValue());
		if (updated == 0) {
			updated = donationJdbcTemplate.update(SQL_INSERT_RECORD, donor.getValue(), DaoUtils.toNumeric(amount),
					verified, invoiceId, now);
		}
		return updated;
	}

	@Override
	public int markVerified(Address donor, String invoiceId) {
		Timestamp now = DaoUtils.now();
		int updated = donationJdbcTemplate.update(SQL_MARK_VERIFIED, invoiceId, now, donor.getValue());
		if (updated == 0) {
			log.warn("No donation record for donor={}, verifying a zero-amount record", donor);
			updated = donationJdbcTemplate.update(SQL_INSERT_RECORD, donor.getValue(),
					DaoUtils.toNumeric(BigInteger.ZERO), true, invoiceId, now);
		}
		return updated;
	}

	@Override
	public boolean appendToRoster(Address donor) {
		return donationJdbcTemplate.update(SQL_APPEND_ROSTER, donor.getValue(), DaoUtils.now(), donor.getValue()) == 1;
	}

	@Override
	public List<DonationRecordDTO> findRosterRecords() {
		return donationJdbcTemplate.query(SQL_ROSTER_RECORDS, RECORD_ROW_MAPPER);
	}
}
