package io.clubone.donation.verifier;

import java.util.Arrays;
import java.util.HexFormat;

import org.apache.commons.lang3.StringUtils;

/**
 * Opaque proof-of-payment payload handed to a {@link ProofVerifier}.
 */
public final class ProofData {

	public static final ProofData EMPTY = new ProofData(new byte[0]);

	private final byte[] bytes;

	private ProofData(byte[] bytes) {
		this.bytes = bytes;
	}

	public static ProofData of(byte[] bytes) {
		return bytes == null || bytes.length == 0 ? EMPTY : new ProofData(bytes.clone());
	}

	/**
	 * Parses {@code 0x}-prefixed or bare hex. Anything that is not even-length hex comes back as
	 * {@link #EMPTY}, which no verifier accepts.
	 */
	public static ProofData fromHex(String hex) {
		if (StringUtils.isBlank(hex)) {
			return EMPTY;
		}
		String digits = StringUtils.removeStartIgnoreCase(hex.trim(), "0x");
		try {
			return of(HexFormat.of().parseHex(digits));
		} catch (IllegalArgumentException e) {
			return EMPTY;
		}
	}

	/** True for the empty payload and for payloads of only zero bytes. */
	public boolean isZero() {
		for (byte b : bytes) {
			if (b != 0) {
				return false;
			}
		}
		return true;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ProofData other && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "ProofData[" + bytes.length + " bytes]";
	}
}
