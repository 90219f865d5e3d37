package io.clubone.donation.vo;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenDTO {
	private long tokenId;
	private Address owner;
	private TokenKind kind;
	private String locator;
	private Instant mintedOn;
}
