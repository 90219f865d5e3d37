package io.clubone.donation.event;

import io.clubone.donation.vo.Address;

public record DonationVerifiedEvent(Address donor, String invoiceId, long tokenId) {
}
