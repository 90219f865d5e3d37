package io.clubone.donation.vo;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A minted token as stored. The locator is not stored; only the per-token query suffix is.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenRow {
	private long tokenId;
	private Address owner;
	private TokenKind kind;
	private String metadataQuery;
	private Instant mintedOn;
}
