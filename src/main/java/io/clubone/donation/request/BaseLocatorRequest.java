package io.clubone.donation.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class BaseLocatorRequest {

	@NotBlank
	@Size(max = 1024)
	private String baseLocator;
}
