package io.clubone.donation.util;

public class ConstantUtility {

	public static final String CALLER_HEADER = "X-Caller";

	public static final String BASE_LOCATOR_KEY = "base_locator";

	public static final String METADATA_EXTENSION = ".json?";

	public static final String DONATION_RECORD = "DonationRecord";

	public static final int MAX_INVOICE_ID_LENGTH = 256;
}
