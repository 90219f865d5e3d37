package io.clubone.donation.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenIssuedResponse {
	private long tokenId;
	private String locator;
}
