package io.clubone.donation.controller;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.donation.request.DonateRequest;
import io.clubone.donation.request.VerifyDonationRequest;
import io.clubone.donation.response.DonorTotalResponse;
import io.clubone.donation.response.TokenIssuedResponse;
import io.clubone.donation.service.DonationOrchestrator;
import io.clubone.donation.service.TokenRegistryService;
import io.clubone.donation.util.ConstantUtility;
import io.clubone.donation.verifier.ProofData;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.CharityDescriptorDTO;
import io.clubone.donation.vo.DonationRecordDTO;
import io.clubone.donation.vo.DonationsSummaryDTO;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/donations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Donations", description = "Donate, verify proof of payment, read the ledger")
public class DonationController {

	private final DonationOrchestrator donationOrchestrator;

	private final TokenRegistryService tokenRegistryService;

	@Operation(summary = "Donate from the calling account and mint a donation token")
	@PostMapping
	public ResponseEntity<TokenIssuedResponse> donate(@RequestHeader(ConstantUtility.CALLER_HEADER) String caller,
			@Valid @RequestBody DonateRequest request) {
		Address donor = Address.of(caller);
		log.debug("donate donor={} amount={}", donor, request.getAmount());
		long tokenId = donationOrchestrator.donate(donor, request.getAmount());
		return ResponseEntity.ok(new TokenIssuedResponse(tokenId, tokenRegistryService.locatorOf(tokenId)));
	}

	@Operation(summary = "Verify a proof of payment and mint an invoice token")
	@PostMapping("/verify")
	public ResponseEntity<TokenIssuedResponse> verifyDonation(
			@RequestHeader(ConstantUtility.CALLER_HEADER) String caller,
			@Valid @RequestBody VerifyDonationRequest request) {
		Address donor = Address.of(caller);
		long tokenId = donationOrchestrator.verifyDonation(donor, ProofData.fromHex(request.getProof()),
				request.getInvoiceId());
		return ResponseEntity.ok(new TokenIssuedResponse(tokenId, tokenRegistryService.locatorOf(tokenId)));
	}

	@GetMapping
	public ResponseEntity<DonationsSummaryDTO> getAllDonations() {
		return ResponseEntity.ok(donationOrchestrator.getAllDonations());
	}

	@GetMapping("/charity")
	public ResponseEntity<CharityDescriptorDTO> getCharityInfo() {
		return ResponseEntity.ok(donationOrchestrator.getCharityInfo());
	}

	@GetMapping("/donors/{donor}")
	public ResponseEntity<DonationRecordDTO> getDonationRecord(@PathVariable String donor) {
		return ResponseEntity.ok(donationOrchestrator.getDonationRecord(Address.of(donor)));
	}

	@GetMapping("/donors/{donor}/total")
	public ResponseEntity<DonorTotalResponse> getDonations(@PathVariable String donor) {
		Address address = Address.of(donor);
		return ResponseEntity.ok(new DonorTotalResponse(address, donationOrchestrator.getDonations(address)));
	}

	@GetMapping("/donors/{donor}/invoice-token")
	public ResponseEntity<TokenIssuedResponse> getInvoiceToken(@PathVariable String donor) {
		long tokenId = donationOrchestrator.getInvoiceToken(Address.of(donor));
		return ResponseEntity.ok(new TokenIssuedResponse(tokenId, tokenRegistryService.locatorOf(tokenId)));
	}
}
