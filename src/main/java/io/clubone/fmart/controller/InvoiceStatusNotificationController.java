package io.clubone.fmart.controller;

import java.util.List;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.fmart.helper.InvoiceStatusNotificationParser;
import io.clubone.fmart.response.InvoiceStatus;
import io.clubone.fmart.response.InvoiceStatusNotificationEvent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/fmart")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "FamilyMart Notification", description = "Receives invoice deposit status notifications")
public class InvoiceStatusNotificationController {

	private final InvoiceStatusNotificationParser invoiceStatusNotificationParser;

	private final ApplicationEventPublisher eventPublisher;

	@Operation(summary = "Accept a deposit status notification")
	@PostMapping(value = "/notifications", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
	public ResponseEntity<String> receiveStatuses(HttpServletRequest request) {
		List<InvoiceStatus> statuses = invoiceStatusNotificationParser.parseInvoiceStatuses(request);
		log.info("Received {} invoice statuses", statuses.size());
		eventPublisher.publishEvent(new InvoiceStatusNotificationEvent(statuses));
		return ResponseEntity.ok(String.valueOf(statuses.size()));
	}
}
