package io.clubone.donation.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransferResponseDTO {
	private boolean success;
	private String transferId;
	private String message;
}
