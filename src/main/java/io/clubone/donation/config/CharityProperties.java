package io.clubone.donation.config;

import java.math.BigInteger;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Static descriptor of the single charity this ledger collects for. Loaded once at startup.
 */
@Data
@ConfigurationProperties(prefix = "donation.charity")
public class CharityProperties {

	private String link;

	private String registeredAt;

	private String name;

	private String foundation;

	private String source;

	/** Suggested donation in the smallest unit of the payment asset. */
	private BigInteger suggestedPrice;

	private String imageLocator;

	/** Account that receives every donation transfer. */
	private String payoutAddress;
}
