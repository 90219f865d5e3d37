package io.clubone.donation.vo;

public enum TokenKind {

	DONATION("donation"),
	INVOICE("invoiceId");

	private final String queryKey;

	private TokenKind(String queryKey) {
		this.queryKey = queryKey;
	}

	/**
	 * @return the per-token locator query, e.g. {@code donation=5000} or {@code invoiceId=INV-1}
	 */
	public String metadataQuery(String value) {
		return queryKey + "=" + value;
	}
}
