package io.clubone.donation.service;

import static io.clubone.donation.DonationTestSupport.ALICE;
import static io.clubone.donation.DonationTestSupport.PAYOUT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

import java.math.BigInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import io.clubone.donation.DonationTestSupport;
import io.clubone.donation.payment.AllowancePaymentRail;

/**
 * A donation whose ledger write fails must not move the donor's funds.
 */
@SpringBootTest
class DonationChargeRollbackTest {

	@MockBean
	private DonationLedgerService ledgerService;

	@Autowired
	private DonationOrchestrator orchestrator;

	@Autowired
	private TokenRegistryService tokenRegistryService;

	@Autowired
	private AllowancePaymentRail paymentRail;

	@Autowired
	@Qualifier("donationJdbcTemplate")
	private JdbcTemplate jdbc;

	@BeforeEach
	void setUp() {
		DonationTestSupport.resetDatabase(jdbc);
		paymentRail.reset();
	}

	@Test
	void failedLedgerWriteLeavesDonorUncharged() {
		paymentRail.credit(ALICE, BigInteger.valueOf(100));
		paymentRail.approve(ALICE, PAYOUT, BigInteger.valueOf(100));
		doThrow(new DataAccessResourceFailureException("donation_record unavailable")).when(ledgerService)
				.record(any(), any());

		assertThatThrownBy(() -> orchestrator.donate(ALICE, BigInteger.valueOf(100)))
				.isInstanceOf(DataAccessResourceFailureException.class);

		assertThat(paymentRail.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(100));
		assertThat(paymentRail.balanceOf(PAYOUT)).isEqualTo(BigInteger.ZERO);
		assertThat(paymentRail.allowance(ALICE, PAYOUT)).isEqualTo(BigInteger.valueOf(100));
		assertThat(tokenRegistryService.totalMinted()).isZero();
		assertThat(tokenRegistryService.getDonations(ALICE)).isEqualTo(BigInteger.ZERO);
	}
}
