package io.clubone.donation.verifier;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import io.clubone.donation.vo.Address;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts any non-zero proof from any non-zero claimant. Stand-in until a real proof system is
 * wired behind {@link ProofVerifier}.
 */
@Component
@ConditionalOnProperty(name = "donation.verifier.type", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class MockProofVerifier implements ProofVerifier {

	@Override
	public boolean verify(ProofData proof, Address claimant) {
		if (proof == null || proof.isZero()) {
			log.debug("Rejecting empty proof for claimant={}", claimant);
			return false;
		}
		if (claimant == null || claimant.isZero()) {
			log.debug("Rejecting proof from zero claimant");
			return false;
		}
		return true;
	}
}
