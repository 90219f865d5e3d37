package io.clubone.donation;

import java.time.Duration;
import java.util.Properties;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.info.BuildProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@ConfigurationPropertiesScan
@OpenAPIDefinition(info = @Info(title = "clubone Donation Api", version = "1.0", description = "Donation ledger and token registry"))
@Slf4j
public class DonationApplication {

	public static void main(String[] args) {
		SpringApplication.run(DonationApplication.class, args);
		log.info("... Donation ledger started Successfully ...");
	}

	@Bean
	public BuildProperties buildProperties() {
		return new BuildProperties(new Properties());
	}

	@Bean
	public WebMvcConfigurer corsConfigurer() {
		return new WebMvcConfigurer() {
			@Override
			public void addCorsMappings(CorsRegistry registry) {
				registry.addMapping("/**")
				.allowedOriginPatterns("*")
				.allowedMethods("GET", "POST", "PUT", "OPTIONS")
				.allowedHeaders("*")
				.allowCredentials(true);
			}
		};
	}

	@Bean("paymentRailRestTemplate")
	public RestTemplate getRestTemplate(RestTemplateBuilder builder,
			@Value("${payment.rail.connect-timeout:PT2S}") Duration connectTimeout,
			@Value("${payment.rail.read-timeout:PT5S}") Duration readTimeout) {
		// rail calls run under a donor lock, so they must not block indefinitely
		return builder.setConnectTimeout(connectTimeout).setReadTimeout(readTimeout).build();
	}
}
