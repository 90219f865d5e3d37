package io.clubone.donation.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BaseLocatorResponse {
	private String baseLocator;
	private long totalMinted;
}
