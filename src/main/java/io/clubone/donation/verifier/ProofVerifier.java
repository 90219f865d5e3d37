package io.clubone.donation.verifier;

import io.clubone.donation.vo.Address;

/**
 * Gate for the verified/invoice path.
 *
 * <p>Implementations never throw on malformed input: a null, empty or all-zero proof, or a null or
 * zero claimant, is simply {@code false}. Callers treat every failure the same way.
 */
public interface ProofVerifier {

	boolean verify(ProofData proof, Address claimant);
}
