package io.clubone.fmart;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@OpenAPIDefinition(info = @Info(title = "clubone FamilyMart Api", version = "1.0", description = "Receives FamilyMart invoice deposit status notifications"))
@Slf4j
public class FmartInvoiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(FmartInvoiceApplication.class, args);
		log.info("... FamilyMart invoice client started Successfully ...");
	}
}
