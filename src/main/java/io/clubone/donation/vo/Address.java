package io.clubone.donation.vo;

import java.io.Serializable;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import io.clubone.donation.exception.NotValidException;
import lombok.EqualsAndHashCode;

/**
 * A 20-byte account identifier, held in canonical form: {@code 0x} followed by 40 lowercase hex
 * digits. The all-zero address is the "no account" sentinel.
 */
@EqualsAndHashCode
public final class Address implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{40}$");

	public static final Address ZERO = new Address("0x" + "0".repeat(40));

	private final String value;

	private Address(String value) {
		this.value = value;
	}

	@JsonCreator
	public static Address of(String raw) {
		if (StringUtils.isBlank(raw)) {
			throw new NotValidException("Address is required");
		}
		String canonical = raw.trim().toLowerCase();
		if (!canonical.startsWith("0x")) {
			canonical = "0x" + canonical;
		}
		if (!FORMAT.matcher(canonical).matches()) {
			throw new NotValidException("Not a valid address: " + raw);
		}
		return new Address(canonical);
	}

	public boolean isZero() {
		return ZERO.value.equals(value);
	}

	@JsonValue
	public String getValue() {
		return value;
	}

	@Override
	public String toString() {
		return value;
	}
}
