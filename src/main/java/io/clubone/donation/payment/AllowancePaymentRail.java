package io.clubone.donation.payment;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import io.clubone.donation.util.Amounts;
import io.clubone.donation.vo.Address;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory token rail with balances and owner-to-spender allowances. Used for local runs and
 * tests; a transfer succeeds only when both the payer's balance and the allowance granted to the
 * payee cover the amount.
 */
@Component
@ConditionalOnProperty(name = "payment.rail.type", havingValue = "allowance", matchIfMissing = true)
@Slf4j
public class AllowancePaymentRail implements PaymentRail {

	private final Map<Address, BigInteger> balances = new HashMap<>();

	private final Map<Address, Map<Address, BigInteger>> allowances = new HashMap<>();

	public synchronized void credit(Address account, BigInteger amount) {
		Amounts.requirePositive(amount);
		balances.merge(account, amount, BigInteger::add);
	}

	public synchronized void approve(Address owner, Address spender, BigInteger amount) {
		if (amount == null || amount.signum() < 0) {
			throw new IllegalArgumentException("Allowance must be non-negative");
		}
		allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
	}

	public synchronized BigInteger balanceOf(Address account) {
		return balances.getOrDefault(account, BigInteger.ZERO);
	}

	public synchronized BigInteger allowance(Address owner, Address spender) {
		return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
	}

	@Override
	public synchronized boolean transferFrom(Address payer, Address payee, BigInteger amount) {
		if (payer == null || payee == null || amount == null || amount.signum() <= 0) {
			return false;
		}
		BigInteger balance = balanceOf(payer);
		BigInteger allowed = allowance(payer, payee);
		if (balance.compareTo(amount) < 0 || allowed.compareTo(amount) < 0) {
			log.info("Transfer declined payer={} amount={} balance={} allowance={}", payer, amount, balance, allowed);
			return false;
		}
		balances.put(payer, balance.subtract(amount));
		balances.merge(payee, amount, BigInteger::add);
		allowances.get(payer).put(payee, allowed.subtract(amount));
		return true;
	}

	/** Drops every balance and allowance. */
	public synchronized void reset() {
		balances.clear();
		allowances.clear();
	}
}
