package io.clubone.fmart.helper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import io.clubone.fmart.config.FmartProperties;
import io.clubone.fmart.exception.InvalidRequestException;
import io.clubone.fmart.exception.UnauthorizedRequestException;
import io.clubone.fmart.response.DepositStatus;
import io.clubone.fmart.response.InvoiceStatus;

class InvoiceStatusNotificationParserTest {

	private final InvoiceStatusNotificationParser parser = new InvoiceStatusNotificationParser(
		new FmartProperties("http://localhost/fmart", "issuer-0001", "secret-pass"));

	private static Map<String, String> threeStatuses() {
		Map<String, String> form = new HashMap<>();
		form.put("login_user_id", "issuer-0001");
		form.put("login_password", "secret-pass");
		form.put("number_of_notify", "3");
		form.put("receipt_no_0000", "invoice-1");
		form.put("status_0000", "1");
		form.put("receipt_date_0000", "201502082010");
		form.put("payment_0000", "101");
		form.put("receipt_no_0001", "invoice-2");
		form.put("status_0001", "2");
		form.put("receipt_date_0001", "201502082011");
		form.put("payment_0001", "102");
		form.put("receipt_no_0002", "invoice-3");
		form.put("status_0002", "3");
		form.put("receipt_date_0002", "201502082012");
		form.put("payment_0002", "103");
		return form;
	}

	@Test
	void parses_every_indexed_group_in_order() {
		List<InvoiceStatus> statuses = parser.parseInvoiceStatuses(threeStatuses());

		assertThat(statuses).containsExactly(
			new InvoiceStatus("invoice-1", 101, DepositStatus.DEPOSIT_MADE, LocalDateTime.of(2015, 2, 8, 20, 10)),
			new InvoiceStatus("invoice-2", 102, DepositStatus.DEPOSIT_CANCELED, LocalDateTime.of(2015, 2, 8, 20, 11)),
			new InvoiceStatus("invoice-3", 103, DepositStatus.DEPOSIT_FINALIZED, LocalDateTime.of(2015, 2, 8, 20, 12)));
	}

	@Test
	void parses_servlet_request_parameters() {
		MockHttpServletRequest request = new MockHttpServletRequest("POST", "/fmart/notifications");
		threeStatuses().forEach(request::addParameter);

		assertThat(parser.parseInvoiceStatuses(request)).extracting(InvoiceStatus::getId)
			.containsExactly("invoice-1", "invoice-2", "invoice-3");
	}

	@Test
	void zero_notifications_is_an_empty_list() {
		Map<String, String> form = threeStatuses();
		form.put("number_of_notify", "0");

		assertThat(parser.parseInvoiceStatuses(form)).isEmpty();
	}

	@Test
	void wrong_credentials_are_unauthorized() {
		Map<String, String> form = threeStatuses();
		form.put("login_password", "invalid_password");

		assertThatThrownBy(() -> parser.parseInvoiceStatuses(form)).isInstanceOf(UnauthorizedRequestException.class);

		form.put("login_password", "secret-pass");
		form.put("login_user_id", "invalid_user_id");
		assertThatThrownBy(() -> parser.parseInvoiceStatuses(form)).isInstanceOf(UnauthorizedRequestException.class);
	}

	@Test
	void missing_credentials_are_unauthorized() {
		Map<String, String> form = threeStatuses();
		form.remove("login_user_id");
		form.remove("login_password");

		assertThatThrownBy(() -> parser.parseInvoiceStatuses(form)).isInstanceOf(UnauthorizedRequestException.class);
	}

	@Test
	void unknown_status_code_rejects_the_whole_batch() {
		Map<String, String> form = threeStatuses();
		form.put("status_0002", "4");

		assertThatThrownBy(() -> parser.parseInvoiceStatuses(form))
			.isInstanceOf(InvalidRequestException.class)
			.hasMessageContaining("status_0002");
	}

	@Test
	void missing_group_rejects_the_whole_batch() {
		Map<String, String> form = threeStatuses();
		form.put("number_of_notify", "4");

		assertThatThrownBy(() -> parser.parseInvoiceStatuses(form))
			.isInstanceOf(InvalidRequestException.class)
			.hasMessageContaining("receipt_no_0003");
	}

	@Test
	void malformed_values_are_invalid() {
		Map<String, String> badAmount = threeStatuses();
		badAmount.put("payment_0001", "10a");
		Map<String, String> badDate = threeStatuses();
		badDate.put("receipt_date_0000", "201502302010");
		Map<String, String> badCount = threeStatuses();
		badCount.put("number_of_notify", "three");
		Map<String, String> negativeCount = threeStatuses();
		negativeCount.put("number_of_notify", "-1");

		assertThatThrownBy(() -> parser.parseInvoiceStatuses(badAmount)).isInstanceOf(InvalidRequestException.class);
		assertThatThrownBy(() -> parser.parseInvoiceStatuses(badDate)).isInstanceOf(InvalidRequestException.class);
		assertThatThrownBy(() -> parser.parseInvoiceStatuses(badCount)).isInstanceOf(InvalidRequestException.class);
		assertThatThrownBy(() -> parser.parseInvoiceStatuses(negativeCount))
			.isInstanceOf(InvalidRequestException.class);
	}

	@Test
	void huge_count_without_groups_is_invalid() {
		Map<String, String> form = new HashMap<>();
		form.put("login_user_id", "issuer-0001");
		form.put("login_password", "secret-pass");
		form.put("number_of_notify", String.valueOf(Integer.MAX_VALUE));

		assertThatThrownBy(() -> parser.parseInvoiceStatuses(form))
			.isInstanceOf(InvalidRequestException.class)
			.hasMessageContaining("number_of_notify");
	}

	@Test
	void count_at_the_index_limit_still_needs_every_group() {
		Map<String, String> form = threeStatuses();
		form.put("number_of_notify", "10000");

		assertThatThrownBy(() -> parser.parseInvoiceStatuses(form))
			.isInstanceOf(InvalidRequestException.class)
			.hasMessageContaining("receipt_no_0003");
	}
}
