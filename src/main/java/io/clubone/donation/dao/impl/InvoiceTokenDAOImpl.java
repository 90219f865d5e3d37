package io.clubone.donation.dao.impl;

import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import io.clubone.donation.dao.InvoiceTokenDAO;
import io.clubone.donation.dao.utils.DaoUtils;
import io.clubone.donation.vo.Address;

@Repository
public class InvoiceTokenDAOImpl implements InvoiceTokenDAO {

	@Autowired
	@Qualifier("donationJdbcTemplate")
	private JdbcTemplate donationJdbcTemplate;

	private static final String SQL_UPDATE = """
			UPDATE invoice_token
			SET token_id = ?
			WHERE donor_address = ?
			""";

	private static final String SQL_INSERT = """
			INSERT INTO invoice_token (donor_address, token_id)
			VALUES (?, ?)
			""";

	private static final String SQL_FIND = """
			SELECT token_id
			FROM invoice_token
			WHERE donor_address = ?
			""";

	@Override
	public int saveInvoiceToken(Address donor, long tokenId) {
		int updated = donationJdbcTemplate.update(SQL_UPDATE, tokenId, donor.getValue());
		if (updated == 0) {
			updated = donationJdbcTemplate.update(SQL_INSERT, donor.getValue(), tokenId);
		}
		return updated;
	}

	@Override
	public Optional<Long> findInvoiceToken(Address donor) {
		return Optional.ofNullable(DaoUtils.queryForLong(donationJdbcTemplate, SQL_FIND, donor.getValue()));
	}
}
