package io.clubone.fmart.helper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import io.clubone.fmart.config.FmartProperties;
import io.clubone.fmart.exception.InvalidRequestException;
import io.clubone.fmart.exception.UnauthorizedRequestException;
import io.clubone.fmart.response.DepositStatus;
import io.clubone.fmart.response.InvoiceStatus;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the status notifications FamilyMart posts back to the issuer. A
 * notification either parses completely or is rejected as a whole.
 */
@Component
@Slf4j
public class InvoiceStatusNotificationParser {

	public static final String LOGIN_USER_ID = "login_user_id";
	public static final String LOGIN_PASSWORD = "login_password";
	public static final String NUMBER_OF_NOTIFY = "number_of_notify";
	public static final String RECEIPT_NO = "receipt_no_%04d";
	public static final String PAYMENT = "payment_%04d";
	public static final String STATUS = "status_%04d";
	public static final String RECEIPT_DATE = "receipt_date_%04d";

	/** Group indices are rendered with four digits. */
	public static final int MAX_NOTIFY = 10000;

	private static final DateTimeFormatter RECEIPT_DATE_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmm")
		.withResolverStyle(ResolverStyle.STRICT);

	private final FmartProperties fmartProperties;

	public InvoiceStatusNotificationParser(FmartProperties fmartProperties) {
		this.fmartProperties = fmartProperties;
	}

	public List<InvoiceStatus> parseInvoiceStatuses(HttpServletRequest request) {
		return parse(request::getParameter);
	}

	public List<InvoiceStatus> parseInvoiceStatuses(Map<String, String> form) {
		return parse(form::get);
	}

	private List<InvoiceStatus> parse(UnaryOperator<String> formValue) {
		if (!matches(formValue.apply(LOGIN_USER_ID), fmartProperties.getUserId())
			|| !matches(formValue.apply(LOGIN_PASSWORD), fmartProperties.getUserPassword())) {
			log.warn("Rejected status notification for user id '{}'", formValue.apply(LOGIN_USER_ID));
			throw new UnauthorizedRequestException();
		}

		int count = parseInt(formValue.apply(NUMBER_OF_NOTIFY), NUMBER_OF_NOTIFY);
		if (count < 0) {
			throw new InvalidRequestException(NUMBER_OF_NOTIFY + " is negative");
		}
		if (count > MAX_NOTIFY) {
			throw new InvalidRequestException(NUMBER_OF_NOTIFY + " exceeds " + MAX_NOTIFY);
		}

		List<InvoiceStatus> statuses = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			statuses.add(parseInvoiceStatusAt(formValue, i));
		}
		log.debug("Parsed {} invoice statuses", statuses.size());
		return statuses;
	}

	private InvoiceStatus parseInvoiceStatusAt(UnaryOperator<String> formValue, int i) {
		String idField = String.format(RECEIPT_NO, i);
		String id = formValue.apply(idField);
		if (StringUtils.isEmpty(id)) {
			throw new InvalidRequestException(idField + " is missing");
		}

		String paymentField = String.format(PAYMENT, i);
		int amount = parseInt(formValue.apply(paymentField), paymentField);

		String statusField = String.format(STATUS, i);
		DepositStatus status = DepositStatus.fromCode(formValue.apply(statusField))
			.orElseThrow(() -> new InvalidRequestException(statusField + " is unknown"));

		String dateField = String.format(RECEIPT_DATE, i);
		LocalDateTime updatedAt;
		try {
			updatedAt = LocalDateTime.parse(Objects.toString(formValue.apply(dateField), ""), RECEIPT_DATE_FORMAT);
		} catch (DateTimeParseException e) {
			throw new InvalidRequestException(dateField + " is malformed", e);
		}

		return new InvoiceStatus(id, amount, status, updatedAt);
	}

	private static int parseInt(String value, String field) {
		try {
			return Integer.parseInt(Objects.toString(value, ""));
		} catch (NumberFormatException e) {
			throw new InvalidRequestException(field + " is not a number", e);
		}
	}

	private static boolean matches(String actual, String expected) {
		return MessageDigest.isEqual(Objects.toString(actual, "").getBytes(StandardCharsets.UTF_8),
			Objects.toString(expected, "").getBytes(StandardCharsets.UTF_8));
	}
}
