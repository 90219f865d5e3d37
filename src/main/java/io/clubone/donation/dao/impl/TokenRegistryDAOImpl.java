package io.clubone.donation.dao.impl;

import java.math.BigInteger;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import io.clubone.donation.dao.TokenRegistryDAO;
import io.clubone.donation.dao.utils.DaoUtils;
import io.clubone.donation.util.ConstantUtility;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.TokenKind;
import io.clubone.donation.vo.TokenRow;

@Repository
public class TokenRegistryDAOImpl implements TokenRegistryDAO {

	@Autowired
	@Qualifier("donationJdbcTemplate")
	private JdbcTemplate donationJdbcTemplate;

	private static final Logger log = LoggerFactory.getLogger(TokenRegistryDAOImpl.class);

	// The UPDATE takes the row lock first, so concurrent mints queue here until commit.
	private static final String SQL_BUMP_SEQUENCE = """
			UPDATE token_sequence
			SET next_token_id = next_token_id + 1
			WHERE sequence_id = 1
			""";

	private static final String SQL_NEXT_TOKEN_ID = """
			SELECT next_token_id
			FROM token_sequence
			WHERE sequence_id = 1
			""";

	private static final String SQL_INSERT_TOKEN = """
			INSERT INTO token (token_id, owner_address, token_kind, metadata_query, minted_on)
			VALUES (?, ?, ?, ?, ?)
			""";

	private static final String SQL_FIND_TOKEN = """
			SELECT token_id, owner_address, token_kind, metadata_query, minted_on
			FROM token
			WHERE token_id = ?
			""";

	private static final String SQL_COUNT_BY_OWNER = """
			SELECT COUNT(*)
			FROM token
			WHERE owner_address = ?
			""";

	private static final String SQL_FIND_SETTING = """
			SELECT setting_value
			FROM registry_setting
			WHERE setting_key = ?
			""";

	private static final String SQL_UPDATE_SETTING = """
			UPDATE registry_setting
			SET setting_value = ?, modified_by = ?, modified_on = ?
			WHERE setting_key = ?
			""";

	private static final String SQL_INSERT_SETTING = """
			INSERT INTO registry_setting (setting_key, setting_value, modified_by, modified_on)
			VALUES (?, ?, ?, ?)
			""";

	private static final String SQL_FIND_TOTAL = """
			SELECT total_amount
			FROM donor_total
			WHERE donor_address = ?
			""";

	private static final String SQL_UPDATE_TOTAL = """
			UPDATE donor_total
			SET total_amount = ?
			WHERE donor_address = ?
			""";

	private static final String SQL_INSERT_TOTAL = """
			INSERT INTO donor_total (donor_address, total_amount)
			VALUES (?, ?)
			""";

	private static final RowMapper<TokenRow> TOKEN_ROW_MAPPER = (rs, rowNum) -> new TokenRow(
			rs.getLong("token_id"),
			DaoUtils.getAddress(rs, "owner_address"),
			TokenKind.valueOf(rs.getString("token_kind")),
			rs.getString("metadata_query"),
			DaoUtils.getInstant(rs, "minted_on"));

	@Override
	public long allocateTokenId() {
		int updated = donationJdbcTemplate.update(SQL_BUMP_SEQUENCE);
		if (updated != 1) {
			throw new IncorrectResultSizeDataAccessException("token_sequence row missing", 1, updated);
		}
		long allocated = nextTokenId() - 1;
		log.debug("Allocated tokenId={}", allocated);
		return allocated;
	}

	@Override
	public long nextTokenId() {
		Long next = DaoUtils.queryForLong(donationJdbcTemplate, SQL_NEXT_TOKEN_ID);
		return next == null ? 0L : next;
	}

	@Override
	public int insertToken(TokenRow row) {
		return donationJdbcTemplate.update(SQL_INSERT_TOKEN, row.getTokenId(), row.getOwner().getValue(),
				row.getKind().name(), row.getMetadataQuery(), Timestamp.from(row.getMintedOn()));
	}

	@Override
	public Optional<TokenRow> findToken(long tokenId) {
		List<TokenRow> rows = donationJdbcTemplate.query(SQL_FIND_TOKEN, TOKEN_ROW_MAPPER, tokenId);
		return rows.stream().findFirst();
	}

	@Override
	public long countByOwner(Address owner) {
		Long count = DaoUtils.queryForLong(donationJdbcTemplate, SQL_COUNT_BY_OWNER, owner.getValue());
		return count == null ? 0L : count;
	}

	@Override
	public Optional<String> findBaseLocator() {
		return Optional.ofNullable(
				DaoUtils.queryForString(donationJdbcTemplate, SQL_FIND_SETTING, ConstantUtility.BASE_LOCATOR_KEY));
	}

	@Override
	public int saveBaseLocator(String baseLocator, Address modifiedBy) {
		Timestamp now = DaoUtils.now();
		int updated = donationJdbcTemplate.update(SQL_UPDATE_SETTING, baseLocator, modifiedBy.getValue(), now,
				ConstantUtility.BASE_LOCATOR_KEY);
		if (updated == 0) {
			updated = donationJdbcTemplate.update(SQL_INSERT_SETTING, ConstantUtility.BASE_LOCATOR_KEY, baseLocator,
					modifiedBy.getValue(), now);
		}
		return updated;
	}

	@Override
	public BigInteger findDonationTotal(Address donor) {
		List<BigInteger> totals = donationJdbcTemplate.query(SQL_FIND_TOTAL,
				(rs, rowNum) -> DaoUtils.getAmount(rs, "total_amount"), donor.getValue());
		return totals.isEmpty() ? BigInteger.ZERO : totals.get(0);
	}

	@Override
	public int saveDonationTotal(Address donor, BigInteger total) {
		int updated = donationJdbcTemplate.update(SQL_UPDATE_TOTAL, DaoUtils.toNumeric(total), donor.getValue());
		if (updated == 0) {
			updated = donationJdbcTemplate.update(SQL_INSERT_TOTAL, donor.getValue(), DaoUtils.toNumeric(total));
		}
		return updated;
	}
}
