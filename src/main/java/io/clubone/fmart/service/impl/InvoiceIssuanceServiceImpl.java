package io.clubone.fmart.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import io.clubone.fmart.codec.ShiftJisCodec;
import io.clubone.fmart.config.FmartProperties;
import io.clubone.fmart.exception.InvalidParamsException;
import io.clubone.fmart.exception.ServerErrorException;
import io.clubone.fmart.exception.TransportException;
import io.clubone.fmart.request.FormFields;
import io.clubone.fmart.request.InvoiceParams;
import io.clubone.fmart.request.IssueInvoiceParams;
import io.clubone.fmart.request.ModifyInvoiceParams;
import io.clubone.fmart.request.RegistType;
import io.clubone.fmart.service.InvoiceIssuanceService;
import io.clubone.fmart.validator.RequestValidator;
import io.clubone.fmart.validator.ValidationErrors;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class InvoiceIssuanceServiceImpl implements InvoiceIssuanceService {

	private static final String ACK_SEPARATOR = "\r\n";

	private final FmartProperties fmartProperties;

	private final RestTemplate restTemplate;

	private final ShiftJisCodec codec;

	private final Clock clock;

	@Autowired
	public InvoiceIssuanceServiceImpl(FmartProperties fmartProperties,
		@Qualifier("fmartRestTemplate") RestTemplate restTemplate, ShiftJisCodec codec,
		@Qualifier("fmartClock") Clock clock) {
		this.fmartProperties = fmartProperties;
		this.restTemplate = restTemplate;
		this.codec = codec;
		this.clock = clock;
	}

	public InvoiceIssuanceServiceImpl(FmartProperties fmartProperties, RestTemplate restTemplate) {
		this(fmartProperties, restTemplate, new ShiftJisCodec(fmartProperties.getCharset()),
			Clock.system(ZoneId.of(fmartProperties.getZoneId())));
	}

	@Override
	public String issueInvoice(IssueInvoiceParams params) {
		log.debug("inside issueInvoice() method start");
		String id = request(validated(params).toFormParams(fmartProperties));
		log.info("Issued invoice {}", id);
		return id;
	}

	@Override
	public String modifyInvoice(ModifyInvoiceParams params) {
		log.debug("inside modifyInvoice() method start, id={}", params.getId());
		String id = request(validated(params).toFormParams(fmartProperties));
		log.info("Modified invoice {}", id);
		return id;
	}

	@Override
	public String cancelInvoice(String id) {
		log.debug("inside cancelInvoice() method start, id={}", id);
		ValidationErrors errors = RequestValidator.validateId(id, LocalDateTime.now(clock));
		if (!errors.isEmpty()) {
			throw new InvalidParamsException(errors);
		}

		Map<String, String> params = new LinkedHashMap<>();
		params.put(FormFields.LOGIN_USER_ID, fmartProperties.getUserId());
		params.put(FormFields.LOGIN_PASSWORD, fmartProperties.getUserPassword());
		params.put(FormFields.REGIST_TYPE, RegistType.CANCEL.getCode());
		params.put(FormFields.RECEIPT_NO, id);

		String confirmed = request(params);
		log.info("Canceled invoice {}", confirmed);
		return confirmed;
	}

	@Override
	public void acknowledgeInvoiceStatuses(List<String> ids) {
		ValidationErrors errors = RequestValidator.validateIds(ids, LocalDateTime.now(clock));
		if (!errors.isEmpty()) {
			throw new InvalidParamsException(errors);
		}
		log.debug("inside acknowledgeInvoiceStatuses() method start, count={}", ids.size());

		byte[] body = codec.encodeText(String.join(ACK_SEPARATOR, ids));
		ResponseEntity<byte[]> response = post(body, codec.textMediaType());
		if (response.getStatusCode().value() != 200) {
			String text = decodeQuietly(response.getBody());
			log.error("Acknowledgement rejected. status={} body={}", response.getStatusCode().value(), text);
			throw new ServerErrorException(response.getStatusCode().value(), text);
		}
		log.info("Acknowledged {} invoice statuses", ids.size());
	}

	private <T extends InvoiceParams> T validated(T params) {
		ValidationErrors errors = params.errors(clock);
		if (!errors.isEmpty()) {
			log.warn("Rejected {} before sending: {}", params.getRegistType(), errors);
			throw new InvalidParamsException(errors);
		}
		return params;
	}

	/**
	 * Sends a form request and returns the single line of a successful response.
	 */
	private String request(Map<String, String> params) {
		ResponseEntity<byte[]> response = post(codec.encodeForm(params), codec.formMediaType());
		int status = response.getStatusCode().value();
		if (status != 200) {
			String text = decodeQuietly(response.getBody());
			log.error("Invoice API returned non 200. status={} body={}", status, text);
			throw new ServerErrorException(status, text);
		}

		String body = codec.decode(response.getBody());
		// one trailing line terminator still counts as a single line; an empty body carries no identifier
		String line = stripLineEnd(body);
		if (line.isEmpty() || line.indexOf('\n') >= 0) {
			log.error("Invoice API returned an error body: {}", body);
			throw new ServerErrorException(status, body);
		}
		return line;
	}

	private ResponseEntity<byte[]> post(byte[] body, MediaType contentType) {
		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(contentType);
		HttpEntity<byte[]> entity = new HttpEntity<>(body, headers);
		try {
			return restTemplate.exchange(fmartProperties.getEndpoint(), HttpMethod.POST, entity, byte[].class);
		} catch (ResourceAccessException e) {
			log.error("Could not reach invoice API at {}", fmartProperties.getEndpoint(), e);
			throw new TransportException(e.getMessage(), e);
		} catch (RestClientException e) {
			log.error("Invoice API call failed", e);
			throw new TransportException(e.getMessage(), e);
		}
	}

	// error bodies are reported as-is even when they are not valid in the charset
	private String decodeQuietly(byte[] body) {
		if (body == null) {
			return "";
		}
		return new String(body, codec.getCharset());
	}

	private static String stripLineEnd(String body) {
		if (body.endsWith("\r\n")) {
			return body.substring(0, body.length() - 2);
		}
		if (body.endsWith("\n")) {
			return body.substring(0, body.length() - 1);
		}
		return body;
	}
}
