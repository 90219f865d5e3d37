package io.clubone.donation.payment;

import java.math.BigInteger;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import io.clubone.donation.response.TransferResponseDTO;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.TransferRequestDTO;
import lombok.extern.slf4j.Slf4j;

/**
 * Delegates transfers to the external payment API.
 */
@Component
@ConditionalOnProperty(name = "payment.rail.type", havingValue = "rest")
@Slf4j
public class RestPaymentRail implements PaymentRail {

	@Autowired
	@Qualifier("paymentRailRestTemplate")
	private RestTemplate restTemplate;

	@Value("${payment.rail.url}")
	private String paymentRailUrl;

	@Override
	public boolean transferFrom(Address payer, Address payee, BigInteger amount) {
		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_JSON);

		HttpEntity<TransferRequestDTO> entity = new HttpEntity<>(new TransferRequestDTO(payer, payee, amount), headers);
		log.debug("Requesting transfer payer={} payee={} amount={}", payer, payee, amount);

		ResponseEntity<TransferResponseDTO> response;
		try {
			response = restTemplate.exchange(paymentRailUrl, HttpMethod.POST, entity, TransferResponseDTO.class);
		} catch (RestClientException e) {
			log.error("Payment rail call failed for payer={}: {}", payer, e.getMessage());
			return false;
		}

		if (response.getStatusCode().is2xxSuccessful() && response.getBody() != null
				&& response.getBody().isSuccess()) {
			log.info("Transfer {} accepted for payer={}", response.getBody().getTransferId(), payer);
			return true;
		}
		log.warn("Transfer declined for payer={}. Status: {}", payer, response.getStatusCode());
		return false;
	}
}
