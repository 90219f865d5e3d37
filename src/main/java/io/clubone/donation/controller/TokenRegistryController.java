package io.clubone.donation.controller;

import java.util.Map;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.donation.request.BaseLocatorRequest;
import io.clubone.donation.response.BaseLocatorResponse;
import io.clubone.donation.service.TokenRegistryService;
import io.clubone.donation.util.ConstantUtility;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.TokenDTO;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
@Tag(name = "Token Registry", description = "Token lookup and metadata base administration")
public class TokenRegistryController {

	private final TokenRegistryService tokenRegistryService;

	@GetMapping("/{tokenId}")
	public ResponseEntity<TokenDTO> getToken(@PathVariable long tokenId) {
		return ResponseEntity.ok(tokenRegistryService.getToken(tokenId));
	}

	@GetMapping("/{tokenId}/owner")
	public ResponseEntity<Map<String, Object>> ownerOf(@PathVariable long tokenId) {
		return ResponseEntity.ok(Map.of("tokenId", tokenId, "owner", tokenRegistryService.ownerOf(tokenId)));
	}

	@GetMapping("/{tokenId}/locator")
	public ResponseEntity<Map<String, Object>> locatorOf(@PathVariable long tokenId) {
		return ResponseEntity.ok(Map.of("tokenId", tokenId, "locator", tokenRegistryService.locatorOf(tokenId)));
	}

	@GetMapping("/owners/{owner}/balance")
	public ResponseEntity<Map<String, Object>> balanceOf(@PathVariable String owner) {
		Address address = Address.of(owner);
		return ResponseEntity.ok(Map.of("owner", address, "balance", tokenRegistryService.balanceOf(address)));
	}

	@GetMapping("/base-locator")
	public ResponseEntity<BaseLocatorResponse> getBaseLocator() {
		return ResponseEntity.ok(
				new BaseLocatorResponse(tokenRegistryService.getBaseLocator(), tokenRegistryService.totalMinted()));
	}

	@PutMapping("/base-locator")
	public ResponseEntity<BaseLocatorResponse> setBaseLocator(
			@RequestHeader(ConstantUtility.CALLER_HEADER) String caller,
			@Valid @RequestBody BaseLocatorRequest request) {
		tokenRegistryService.setBaseLocator(Address.of(caller), request.getBaseLocator());
		return getBaseLocator();
	}
}
