package io.clubone.fmart.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.clubone.fmart.config.FmartProperties;
import io.clubone.fmart.validator.RequestValidator;
import io.clubone.fmart.validator.ValidationErrors;

class IssueInvoiceParamsTest {

	private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

	// 2026-10-18 10:00 in Tokyo
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-18T01:00:00Z"), TOKYO);

	private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

	private static IssueInvoiceParams.IssueInvoiceParamsBuilder<?, ?> valid() {
		return IssueInvoiceParams.builder()
			.name("松本行弘")
			.nameKatakana("マツモトヒロユキ")
			.phoneNumber("0120-444-444")
			.amount(100)
			.expiry(NOW.plusDays(1));
	}

	@Test
	void empty_params_have_one_entry_per_field() {
		ValidationErrors errors = new IssueInvoiceParams().errors(CLOCK);

		assertThat(errors.asMap()).containsOnlyKeys(RequestValidator.NAME, RequestValidator.NAME_KATAKANA,
			RequestValidator.PHONE_NUMBER, RequestValidator.AMOUNT, RequestValidator.EXPIRY);
		assertThat(new IssueInvoiceParams().isValid(CLOCK)).isFalse();
	}

	@Test
	void well_formed_params_are_valid() {
		assertThat(valid().build().errors(CLOCK).isEmpty()).isTrue();
		assertThat(valid().build().isValid(CLOCK)).isTrue();
	}

	@ParameterizedTest
	@ValueSource(ints = {Integer.MIN_VALUE, -1, 0, 1000000, Integer.MAX_VALUE})
	void amount_outside_range_fails(int amount) {
		ValidationErrors errors = valid().amount(amount).build().errors(CLOCK);

		assertThat(errors.asMap()).containsOnlyKeys(RequestValidator.AMOUNT);
	}

	@ParameterizedTest
	@ValueSource(ints = {1, 999999})
	void amount_bounds_are_accepted(int amount) {
		assertThat(valid().amount(amount).build().isValid(CLOCK)).isTrue();
	}

	@Test
	void expiry_at_or_before_now_fails() {
		assertThat(valid().expiry(NOW).build().errors(CLOCK).get(RequestValidator.EXPIRY)).hasSize(1);
		assertThat(valid().expiry(NOW.minusDays(1)).build().errors(CLOCK).get(RequestValidator.EXPIRY)).hasSize(1);
	}

	@Test
	void expiry_more_than_60_days_ahead_fails() {
		assertThat(valid().expiry(NOW.plusDays(60)).build().isValid(CLOCK)).isTrue();
		assertThat(valid().expiry(NOW.plusDays(60).plusMinutes(1)).build().errors(CLOCK).get(RequestValidator.EXPIRY))
			.containsExactly("must not be after 2026-12-17 10:00:00");
	}

	@Test
	void expiry_is_checked_against_the_time_of_validation() {
		IssueInvoiceParams params = valid().expiry(NOW.plusHours(1)).build();
		Clock later = Clock.offset(CLOCK, Duration.ofHours(2));

		assertThat(params.isValid(CLOCK)).isTrue();
		assertThat(params.isValid(later)).isFalse();
	}

	@Test
	void name_and_phone_limits() {
		ValidationErrors errors = valid()
			.name("あ".repeat(41))
			.nameKatakana("ア".repeat(31))
			.phoneNumber("03-1234-56789")
			.build()
			.errors(CLOCK);

		assertThat(errors.get(RequestValidator.NAME)).containsExactly("must be at most 40 characters");
		assertThat(errors.get(RequestValidator.NAME_KATAKANA)).containsExactly("must be at most 30 characters");
		assertThat(errors.get(RequestValidator.PHONE_NUMBER)).containsExactly("invalid format");
	}

	@Test
	void form_params_carry_credentials_and_regist_type_1() {
		FmartProperties account = new FmartProperties("http://localhost/fmart", "issuer-0001", "secret-pass");

		assertThat(valid().build().toFormParams(account)).containsExactly(
			entry("login_user_id", "issuer-0001"),
			entry("login_password", "secret-pass"),
			entry("regist_type", "1"),
			entry("name", "松本行弘"),
			entry("kana", "マツモトヒロユキ"),
			entry("phone_no", "0120-444-444"),
			entry("payment", "100"),
			entry("date_of_expiry", "20261019"));
	}

	@Test
	void expiry_is_zero_padded() {
		FmartProperties account = new FmartProperties("http://localhost/fmart", "u", "p");
		IssueInvoiceParams params = valid().expiry(LocalDateTime.of(2027, 1, 5, 0, 0)).build();

		assertThat(params.toFormParams(account)).containsEntry("date_of_expiry", "20270105");
	}

	@Test
	void expiry_is_compared_in_the_clock_zone() {
		// 09:30 in Tokyo is already past, although it is later than 01:00 UTC
		IssueInvoiceParams params = valid().expiry(NOW.withHour(9).withMinute(30)).build();

		assertThat(params.errors(CLOCK).asMap()).containsOnlyKeys(RequestValidator.EXPIRY);
		assertThat(params.errors(Clock.fixed(CLOCK.instant(), ZoneId.of("UTC"))).isEmpty()).isTrue();
	}
}
