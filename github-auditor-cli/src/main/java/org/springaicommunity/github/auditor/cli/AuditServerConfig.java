package org.springaicommunity.github.auditor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springaicommunity.github.auditor.AuditPermits;
import org.springaicommunity.github.auditor.AuditProperties;
import org.springaicommunity.github.auditor.ObjectMapperFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Spring configuration for the audit server.
 */
@Configuration
public class AuditServerConfig {

	@Bean
	@ConfigurationProperties(prefix = "auditor")
	public AuditProperties auditProperties() {
		return new AuditProperties();
	}

	// One pool per audit kind for the whole process
	@Bean
	public AuditPermits auditPermits(AuditProperties auditProperties) {
		return AuditPermits.withCeiling(auditProperties.getConcurrency());
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public AuditorFactory auditorFactory(AuditProperties auditProperties, AuditPermits auditPermits,
			ObjectMapper objectMapper) {
		return new AuditorFactory(auditProperties, auditPermits, objectMapper);
	}

	@Bean
	public WebMvcConfigurer corsConfigurer(
			@Value("${auditor.cors.allowed-origins:http://localhost:3000,http://127.0.0.1:3000}") String[] allowedOrigins) {
		return new WebMvcConfigurer() {
			@Override
			public void addCorsMappings(CorsRegistry registry) {
				registry.addMapping("/api/**")
					.allowedOrigins(allowedOrigins)
					.allowedMethods("*")
					.allowedHeaders("*")
					.allowCredentials(true);
			}
		};
	}

}
