package io.clubone.fmart.config;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import io.clubone.fmart.codec.ShiftJisCodec;

@Configuration
@EnableConfigurationProperties(FmartProperties.class)
public class FmartClientConfiguration {

	@Bean("fmartRestTemplate")
	public RestTemplate fmartRestTemplate() {
		return createRestTemplate();
	}

	@Bean("fmartClock")
	public Clock fmartClock(FmartProperties fmartProperties) {
		return Clock.system(ZoneId.of(fmartProperties.getZoneId()));
	}

	@Bean
	public ShiftJisCodec shiftJisCodec(FmartProperties fmartProperties) {
		return new ShiftJisCodec(fmartProperties.getCharset());
	}

	/**
	 * Status codes are interpreted by the invoice service itself, so the
	 * template must hand every response back instead of throwing on 4xx/5xx.
	 */
	public static RestTemplate createRestTemplate() {
		RestTemplate restTemplate = new RestTemplate();
		restTemplate.setErrorHandler(new DefaultResponseErrorHandler() {
			@Override
			public boolean hasError(ClientHttpResponse response) throws IOException {
				return false;
			}
		});
		return restTemplate;
	}
}
