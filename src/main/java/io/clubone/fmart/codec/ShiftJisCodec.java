package io.clubone.fmart.codec;

import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.springframework.http.MediaType;

import io.clubone.fmart.exception.EncodingException;

/**
 * Converts request payloads into the legacy Japanese charset the invoice API
 * accepts and decodes its responses. Characters outside the charset's
 * repertoire are reported, never replaced.
 */
public class ShiftJisCodec {

	public static final String DEFAULT_CHARSET = "Shift_JIS";

	private final Charset charset;

	public ShiftJisCodec() {
		this(DEFAULT_CHARSET);
	}

	public ShiftJisCodec(String charsetName) {
		this.charset = Charset.forName(charsetName);
	}

	public Charset getCharset() {
		return charset;
	}

	public MediaType formMediaType() {
		return new MediaType(MediaType.APPLICATION_FORM_URLENCODED, charset);
	}

	public MediaType textMediaType() {
		return new MediaType(MediaType.TEXT_PLAIN, charset);
	}

	/**
	 * Builds the {@code application/x-www-form-urlencoded} body of {@code params},
	 * percent-encoding every value over its bytes in the target charset.
	 */
	public byte[] encodeForm(Map<String, String> params) {
		String query = params.entrySet().stream()
			.map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
			.collect(Collectors.joining("&"));
		return encodeText(query);
	}

	public byte[] encodeText(String text) {
		try {
			ByteBuffer buffer = charset.newEncoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.encode(CharBuffer.wrap(Objects.toString(text, "")));
			return Arrays.copyOfRange(buffer.array(), buffer.position(), buffer.limit());
		} catch (CharacterCodingException e) {
			throw new EncodingException("could not encode text to " + charset.name(), e);
		}
	}

	public String decode(byte[] body) {
		if (body == null || body.length == 0) {
			return "";
		}
		try {
			return charset.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(body))
				.toString();
		} catch (CharacterCodingException e) {
			throw new EncodingException("could not decode response body from " + charset.name(), e);
		}
	}

	private String urlEncode(String value) {
		String text = Objects.toString(value, "");
		// URLEncoder substitutes unmappable characters, so reject them first
		encodeText(text);
		return URLEncoder.encode(text, charset);
	}
}
