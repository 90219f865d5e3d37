package io.clubone.donation.helper;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import io.clubone.donation.vo.Address;

/**
 * Striped per-donor critical sections. Calls for the same donor run one at a time, from before
 * the external payment or proof call until the ledger transaction has committed. Different donors
 * only contend when they hash to the same stripe.
 */
@Component
public class DonorLocks {

	private final ReentrantLock[] stripes;

	public DonorLocks(@Value("${donation.lock.stripes:64}") int stripeCount) {
		if (stripeCount <= 0) {
			throw new IllegalArgumentException("donation.lock.stripes must be positive: " + stripeCount);
		}
		this.stripes = new ReentrantLock[stripeCount];
		for (int i = 0; i < stripeCount; i++) {
			stripes[i] = new ReentrantLock();
		}
	}

	public <T> T withLock(Address donor, Supplier<T> work) {
		ReentrantLock lock = stripeFor(donor);
		lock.lock();
		try {
			return work.get();
		} finally {
			lock.unlock();
		}
	}

	private ReentrantLock stripeFor(Address donor) {
		return stripes[Math.floorMod(donor.hashCode(), stripes.length)];
	}
}
