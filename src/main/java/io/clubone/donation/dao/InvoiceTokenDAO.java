package io.clubone.donation.dao;

import java.util.Optional;

import io.clubone.donation.vo.Address;

public interface InvoiceTokenDAO {

	int saveInvoiceToken(Address donor, long tokenId);

	Optional<Long> findInvoiceToken(Address donor);
}
