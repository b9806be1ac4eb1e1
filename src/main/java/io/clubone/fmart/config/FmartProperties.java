package io.clubone.fmart.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Connection settings and credentials of one FamilyMart invoice issuer account.
 * An instance is handed to every client object that talks to the API, so two
 * clients with different accounts can live side by side.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Validated
@ConfigurationProperties(prefix = "fmart")
public class FmartProperties {

	/** URL of the FamilyMart invoice API. */
	@NotBlank
	private String endpoint;

	/** ID of the invoice issuer. */
	@NotNull
	private String userId = "";

	/** Password of the invoice issuer. */
	@NotNull
	private String userPassword = "";

	/** Charset the API speaks on the wire. */
	@NotBlank
	private String charset = "Shift_JIS";

	/** Zone used as "now" when validating expiry dates. */
	@NotBlank
	private String zoneId = "Asia/Tokyo";

	public FmartProperties(String endpoint, String userId, String userPassword) {
		this(endpoint, userId, userPassword, "Shift_JIS", "Asia/Tokyo");
	}
}
