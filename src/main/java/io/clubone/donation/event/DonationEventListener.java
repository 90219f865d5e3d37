package io.clubone.donation.event;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs donation and verification events once the transaction that produced them has committed.
 * Rolled back calls never reach here.
 */
@Component
@Slf4j
public class DonationEventListener {

	@TransactionalEventListener
	public void onDonationReceived(DonationReceivedEvent event) {
		log.info("DonationReceived donor={} amount={} tokenId={}", event.donor(), event.amount(), event.tokenId());
	}

	@TransactionalEventListener
	public void onDonationVerified(DonationVerifiedEvent event) {
		log.info("DonationVerified donor={} invoiceId={} tokenId={}", event.donor(), event.invoiceId(),
				event.tokenId());
	}
}
