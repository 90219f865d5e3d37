package io.clubone.donation.event;

import java.math.BigInteger;

import io.clubone.donation.vo.Address;

public record DonationReceivedEvent(Address donor, BigInteger amount, long tokenId) {
}
