package io.clubone.donation.vo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.clubone.donation.exception.NotValidException;

class AddressTest {

	@Test
	void canonicalizesCaseAndPrefix() {
		Address upper = Address.of("0xABCDEF0123456789ABCDEF0123456789ABCDEF01");
		Address bare = Address.of("abcdef0123456789abcdef0123456789abcdef01");

		assertThat(upper).isEqualTo(bare);
		assertThat(upper.getValue()).isEqualTo("0xabcdef0123456789abcdef0123456789abcdef01");
	}

	@Test
	void zeroAddressIsSentinel() {
		assertThat(Address.of("0x0000000000000000000000000000000000000000").isZero()).isTrue();
		assertThat(Address.ZERO.isZero()).isTrue();
		assertThat(Address.of("0x0000000000000000000000000000000000000001").isZero()).isFalse();
	}

	@Test
	void rejectsMalformedInput() {
		assertThatThrownBy(() -> Address.of(null)).isInstanceOf(NotValidException.class);
		assertThatThrownBy(() -> Address.of("  ")).isInstanceOf(NotValidException.class);
		assertThatThrownBy(() -> Address.of("0x1234")).isInstanceOf(NotValidException.class);
		assertThatThrownBy(() -> Address.of("0xzz11111111111111111111111111111111111111"))
				.isInstanceOf(NotValidException.class);
	}

	@Test
	void serializesAsPlainString() throws Exception {
		ObjectMapper mapper = new ObjectMapper();
		Address address = Address.of("0x1111111111111111111111111111111111111111");

		String json = mapper.writeValueAsString(address);

		assertThat(json).isEqualTo("\"0x1111111111111111111111111111111111111111\"");
		assertThat(mapper.readValue(json, Address.class)).isEqualTo(address);
	}
}
