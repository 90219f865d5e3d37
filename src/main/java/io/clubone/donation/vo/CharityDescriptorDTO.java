package io.clubone.donation.vo;

import java.math.BigInteger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CharityDescriptorDTO {
	private String link;
	private String registeredAt;
	private String name;
	private String foundation;
	private String source;
	private BigInteger suggestedPrice;
	private String imageLocator;
}
