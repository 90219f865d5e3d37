package io.clubone.donation.dao.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import io.clubone.donation.vo.Address;

public final class DaoUtils {
	private DaoUtils() {
	}

	public static Long queryForLong(JdbcTemplate jdbc, String sql, Object... args) {
		try {
			return jdbc.queryForObject(sql, Long.class, args);
		} catch (EmptyResultDataAccessException e) {
			return null;
		}
	}

	public static String queryForString(JdbcTemplate jdbc, String sql, Object... args) {
		try {
			return jdbc.queryForObject(sql, String.class, args);
		} catch (EmptyResultDataAccessException e) {
			return null;
		}
	}

	/** Amounts are stored as NUMERIC(78,0); a u256 always fits. */
	public static BigDecimal toNumeric(BigInteger amount) {
		return amount == null ? null : new BigDecimal(amount);
	}

	public static BigInteger getAmount(ResultSet rs, String column) throws SQLException {
		BigDecimal value = rs.getBigDecimal(column);
		return value == null ? BigInteger.ZERO : value.toBigIntegerExact();
	}

	public static Address getAddress(ResultSet rs, String column) throws SQLException {
		return Address.of(rs.getString(column));
	}

	public static Instant getInstant(ResultSet rs, String column) throws SQLException {
		Timestamp ts = rs.getTimestamp(column);
		return ts == null ? null : ts.toInstant();
	}

	public static Timestamp now() {
		return Timestamp.from(Instant.now());
	}
}
