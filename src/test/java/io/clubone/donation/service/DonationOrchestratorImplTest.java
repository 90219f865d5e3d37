package io.clubone.donation.service;

import static io.clubone.donation.DonationTestSupport.ADMIN;
import static io.clubone.donation.DonationTestSupport.ALICE;
import static io.clubone.donation.DonationTestSupport.BOB;
import static io.clubone.donation.DonationTestSupport.CAROL;
import static io.clubone.donation.DonationTestSupport.PAYOUT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import io.clubone.donation.DonationTestSupport;
import io.clubone.donation.event.DonationReceivedEvent;
import io.clubone.donation.event.DonationVerifiedEvent;
import io.clubone.donation.exception.InvalidAmountException;
import io.clubone.donation.exception.NotValidException;
import io.clubone.donation.exception.ProofVerificationFailedException;
import io.clubone.donation.exception.TokenNotFoundException;
import io.clubone.donation.exception.TransferFailedException;
import io.clubone.donation.payment.AllowancePaymentRail;
import io.clubone.donation.util.Amounts;
import io.clubone.donation.verifier.ProofData;
import io.clubone.donation.vo.Address;
import io.clubone.donation.vo.CharityDescriptorDTO;
import io.clubone.donation.vo.DonationRecordDTO;
import io.clubone.donation.vo.DonationsSummaryDTO;
import io.clubone.donation.vo.TokenKind;

@SpringBootTest
@RecordApplicationEvents
class DonationOrchestratorImplTest {

	private static final ProofData VALID_PROOF = ProofData.fromHex("0xdeadbeef");

	@Autowired
	private DonationOrchestrator orchestrator;

	@Autowired
	private TokenRegistryService tokenRegistryService;

	@Autowired
	private AllowancePaymentRail paymentRail;

	@Autowired
	private ApplicationEvents events;

	@Autowired
	@Qualifier("donationJdbcTemplate")
	private JdbcTemplate jdbc;

	@BeforeEach
	void setUp() {
		DonationTestSupport.resetDatabase(jdbc);
		paymentRail.reset();
	}

	private void fund(Address donor, BigInteger amount) {
		paymentRail.credit(donor, amount);
		paymentRail.approve(donor, PAYOUT, amount);
	}

	@Test
	void donationMintsTokenAndMovesFunds() {
		fund(ALICE, BigInteger.valueOf(1_000));

		long tokenId = orchestrator.donate(ALICE, BigInteger.valueOf(250));

		assertThat(tokenId).isZero();
		assertThat(tokenRegistryService.ownerOf(tokenId)).isEqualTo(ALICE);
		assertThat(tokenRegistryService.getToken(tokenId).getKind()).isEqualTo(TokenKind.DONATION);
		assertThat(paymentRail.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(750));
		assertThat(paymentRail.balanceOf(PAYOUT)).isEqualTo(BigInteger.valueOf(250));
	}

	@Test
	void donationLocatorIsBitExact() {
		BigInteger amount = new BigInteger("5000000000000000000");
		fund(ALICE, amount);
		tokenRegistryService.setBaseLocator(ADMIN, "https://x/");

		long tokenId = orchestrator.donate(ALICE, amount);

		assertThat(tokenRegistryService.locatorOf(tokenId)).isEqualTo("https://x/0.json?donation=5000000000000000000");

		tokenRegistryService.setBaseLocator(ADMIN, "https://y/");
		assertThat(tokenRegistryService.locatorOf(tokenId)).isEqualTo("https://y/0.json?donation=5000000000000000000");
	}

	@Test
	void tokenIdsFollowCallOrderAcrossDonationsAndInvoices() {
		fund(ALICE, BigInteger.valueOf(100));
		fund(BOB, BigInteger.valueOf(100));

		assertThat(orchestrator.donate(ALICE, BigInteger.ONE)).isEqualTo(0);
		assertThat(orchestrator.donate(BOB, BigInteger.ONE)).isEqualTo(1);
		assertThat(orchestrator.verifyDonation(ALICE, VALID_PROOF, "INV-1")).isEqualTo(2);
		assertThat(orchestrator.donate(ALICE, BigInteger.ONE)).isEqualTo(3);
		assertThat(tokenRegistryService.totalMinted()).isEqualTo(4);
	}

	@Test
	void repeatDonorAppearsOnceInRoster() {
		fund(ALICE, BigInteger.valueOf(100));
		fund(BOB, BigInteger.valueOf(100));

		orchestrator.donate(ALICE, BigInteger.valueOf(5));
		orchestrator.donate(BOB, BigInteger.valueOf(6));
		orchestrator.donate(ALICE, BigInteger.valueOf(7));

		DonationsSummaryDTO all = orchestrator.getAllDonations();
		assertThat(all.getDonors()).containsExactly(ALICE, BOB);
		assertThat(all.getAmounts()).containsExactly(BigInteger.valueOf(7), BigInteger.valueOf(6));
		assertThat(all.getVerified()).containsExactly(false, false);
	}

	@Test
	void cumulativeTotalDivergesFromLatestRecord() {
		fund(ALICE, BigInteger.valueOf(100));

		orchestrator.donate(ALICE, BigInteger.ONE);
		orchestrator.donate(ALICE, BigInteger.TWO);

		assertThat(orchestrator.getDonations(ALICE)).isEqualTo(BigInteger.valueOf(3));
		assertThat(orchestrator.getDonationRecord(ALICE).getAmount()).isEqualTo(BigInteger.TWO);
	}

	@Test
	void declinedTransferLeavesNoTrace() {
		paymentRail.credit(CAROL, BigInteger.valueOf(1_000));

		assertThatThrownBy(() -> orchestrator.donate(CAROL, BigInteger.valueOf(100)))
				.isInstanceOf(TransferFailedException.class);

		assertThat(tokenRegistryService.totalMinted()).isZero();
		assertThat(orchestrator.getDonations(CAROL)).isEqualTo(BigInteger.ZERO);
		assertThat(orchestrator.getAllDonations().getDonors()).doesNotContain(CAROL);
		assertThat(events.stream(DonationReceivedEvent.class)).isEmpty();
	}

	@Test
	void declinedTransferKeepsEarlierDonationIntact() {
		fund(ALICE, BigInteger.valueOf(10));
		orchestrator.donate(ALICE, BigInteger.valueOf(10));

		assertThatThrownBy(() -> orchestrator.donate(ALICE, BigInteger.valueOf(100)))
				.isInstanceOf(TransferFailedException.class);

		assertThat(orchestrator.getDonations(ALICE)).isEqualTo(BigInteger.TEN);
		assertThat(orchestrator.getDonationRecord(ALICE).getAmount()).isEqualTo(BigInteger.TEN);
		assertThat(tokenRegistryService.totalMinted()).isEqualTo(1);
	}

	@Test
	void invalidAmountsAreRejectedBeforePayment() {
		fund(ALICE, BigInteger.valueOf(100));

		assertThatThrownBy(() -> orchestrator.donate(ALICE, BigInteger.ZERO))
				.isInstanceOf(InvalidAmountException.class);
		assertThatThrownBy(() -> orchestrator.donate(ALICE, BigInteger.valueOf(-1)))
				.isInstanceOf(InvalidAmountException.class);
		assertThatThrownBy(() -> orchestrator.donate(ALICE, Amounts.MAX_AMOUNT.add(BigInteger.ONE)))
				.isInstanceOf(InvalidAmountException.class);

		assertThat(paymentRail.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(100));
		assertThat(tokenRegistryService.totalMinted()).isZero();
	}

	@Test
	void overflowingTotalIsRejectedBeforePayment() {
		fund(ALICE, Amounts.MAX_AMOUNT);
		orchestrator.donate(ALICE, Amounts.MAX_AMOUNT.subtract(BigInteger.ONE));

		assertThatThrownBy(() -> orchestrator.donate(ALICE, BigInteger.TWO))
				.isInstanceOf(InvalidAmountException.class);

		assertThat(paymentRail.balanceOf(ALICE)).isEqualTo(BigInteger.ONE);
		assertThat(tokenRegistryService.totalMinted()).isEqualTo(1);
	}

	@Test
	void verificationMintsInvoiceTokenAndIndexesIt() {
		fund(ALICE, BigInteger.valueOf(100));
		tokenRegistryService.setBaseLocator(ADMIN, "https://x/");
		orchestrator.donate(ALICE, BigInteger.valueOf(100));

		long invoiceToken = orchestrator.verifyDonation(ALICE, VALID_PROOF, "INV-1");

		assertThat(invoiceToken).isEqualTo(1);
		assertThat(orchestrator.getInvoiceToken(ALICE)).isEqualTo(1);
		assertThat(tokenRegistryService.locatorOf(invoiceToken)).isEqualTo("https://x/1.json?invoiceId=INV-1");
		DonationRecordDTO record = orchestrator.getDonationRecord(ALICE);
		assertThat(record.isVerified()).isTrue();
		assertThat(record.getInvoiceId()).isEqualTo("INV-1");
	}

	@Test
	void laterInvoiceReplacesIndexButNotEarlierToken() {
		fund(ALICE, BigInteger.valueOf(100));
		orchestrator.donate(ALICE, BigInteger.TEN);

		long first = orchestrator.verifyDonation(ALICE, VALID_PROOF, "INV-1");
		long second = orchestrator.verifyDonation(ALICE, VALID_PROOF, "INV-2");

		assertThat(orchestrator.getInvoiceToken(ALICE)).isEqualTo(second);
		assertThat(tokenRegistryService.ownerOf(first)).isEqualTo(ALICE);
		assertThat(orchestrator.getDonationRecord(ALICE).getInvoiceId()).isEqualTo("INV-2");
	}

	@Test
	void newDonationResetsVerifiedState() {
		fund(ALICE, BigInteger.valueOf(100));
		orchestrator.donate(ALICE, BigInteger.TEN);
		orchestrator.verifyDonation(ALICE, VALID_PROOF, "INV-1");

		orchestrator.donate(ALICE, BigInteger.ONE);

		DonationRecordDTO record = orchestrator.getDonationRecord(ALICE);
		assertThat(record.isVerified()).isFalse();
		assertThat(record.getInvoiceId()).isNull();
		assertThat(orchestrator.getInvoiceToken(ALICE)).isEqualTo(1);
	}

	@Test
	void rejectedProofMutatesNothing() {
		fund(ALICE, BigInteger.valueOf(100));
		orchestrator.donate(ALICE, BigInteger.TEN);

		assertThatThrownBy(() -> orchestrator.verifyDonation(ALICE, ProofData.EMPTY, "INV-1"))
				.isInstanceOf(ProofVerificationFailedException.class);

		assertThat(orchestrator.getDonationRecord(ALICE).isVerified()).isFalse();
		assertThat(tokenRegistryService.totalMinted()).isEqualTo(1);
		assertThatThrownBy(() -> orchestrator.getInvoiceToken(ALICE)).isInstanceOf(TokenNotFoundException.class);
		assertThat(events.stream(DonationVerifiedEvent.class)).isEmpty();
	}

	@Test
	void verificationBeforeAnyDonationIsPermitted() {
		long tokenId = orchestrator.verifyDonation(BOB, VALID_PROOF, "INV-1");

		assertThat(tokenId).isZero();
		DonationRecordDTO record = orchestrator.getDonationRecord(BOB);
		assertThat(record.getAmount()).isEqualTo(BigInteger.ZERO);
		assertThat(record.isVerified()).isTrue();
		assertThat(orchestrator.getAllDonations().getDonors()).isEmpty();
		assertThat(orchestrator.getDonations(BOB)).isEqualTo(BigInteger.ZERO);
	}

	@Test
	void blankInvoiceIdIsRejected() {
		assertThatThrownBy(() -> orchestrator.verifyDonation(ALICE, VALID_PROOF, " "))
				.isInstanceOf(NotValidException.class);
		assertThat(tokenRegistryService.totalMinted()).isZero();
	}

	@Test
	void zeroClaimantFailsVerificationRatherThanValidation() {
		assertThatThrownBy(() -> orchestrator.verifyDonation(Address.ZERO, VALID_PROOF, "INV-1"))
				.isInstanceOf(ProofVerificationFailedException.class);
		assertThatThrownBy(() -> orchestrator.verifyDonation(null, VALID_PROOF, "INV-1"))
				.isInstanceOf(ProofVerificationFailedException.class);

		assertThat(tokenRegistryService.totalMinted()).isZero();
	}

	@Test
	void overlongInvoiceIdIsRejected() {
		fund(ALICE, BigInteger.TEN);
		orchestrator.donate(ALICE, BigInteger.TEN);

		assertThatThrownBy(() -> orchestrator.verifyDonation(ALICE, VALID_PROOF, "I".repeat(257)))
				.isInstanceOf(NotValidException.class);

		assertThat(orchestrator.getDonationRecord(ALICE).isVerified()).isFalse();
		assertThat(tokenRegistryService.totalMinted()).isEqualTo(1);
		assertThat(orchestrator.verifyDonation(ALICE, VALID_PROOF, "I".repeat(256))).isEqualTo(1);
	}

	@Test
	void eventsCarryDonorAmountAndToken() {
		fund(ALICE, BigInteger.valueOf(100));

		long donationToken = orchestrator.donate(ALICE, BigInteger.valueOf(42));
		long invoiceToken = orchestrator.verifyDonation(ALICE, VALID_PROOF, "INV-42");

		assertThat(events.stream(DonationReceivedEvent.class))
				.containsExactly(new DonationReceivedEvent(ALICE, BigInteger.valueOf(42), donationToken));
		assertThat(events.stream(DonationVerifiedEvent.class))
				.containsExactly(new DonationVerifiedEvent(ALICE, "INV-42", invoiceToken));
	}

	@Test
	void charityDescriptorComesFromConfiguration() {
		CharityDescriptorDTO charity = orchestrator.getCharityInfo();

		assertThat(charity.getName()).isEqualTo("Clubone Community Fund");
		assertThat(charity.getSuggestedPrice()).isEqualTo(new BigInteger("5000000000000000000"));
		assertThat(charity.getRegisteredAt()).isEqualTo("2023-11-01");
	}

	@Test
	void concurrentDonationsKeepIdsDense() throws Exception {
		int donors = 4;
		int perDonor = 10;
		for (int d = 1; d <= donors; d++) {
			fund(DonationTestSupport.donor(d), BigInteger.valueOf(perDonor));
		}

		ExecutorService pool = Executors.newFixedThreadPool(8);
		List<Future<Long>> results = new ArrayList<>();
		try {
			for (int i = 0; i < perDonor; i++) {
				for (int d = 1; d <= donors; d++) {
					Address donor = DonationTestSupport.donor(d);
					Callable<Long> call = () -> orchestrator.donate(donor, BigInteger.ONE);
					results.add(pool.submit(call));
				}
			}
			List<Long> ids = new ArrayList<>();
			for (Future<Long> result : results) {
				ids.add(result.get(30, TimeUnit.SECONDS));
			}

			assertThat(ids).containsExactlyInAnyOrderElementsOf(
					LongStream.range(0, donors * perDonor).boxed().collect(Collectors.toList()));
		} finally {
			pool.shutdownNow();
		}

		assertThat(orchestrator.getAllDonations().getDonors()).hasSize(donors);
		for (int d = 1; d <= donors; d++) {
			assertThat(orchestrator.getDonations(DonationTestSupport.donor(d))).isEqualTo(BigInteger.valueOf(perDonor));
		}
	}
}
