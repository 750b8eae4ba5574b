package com.sentient.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

/**
 * CORS configuration for browser clients of the plan API.
 *
 * Defaults allow any origin without credentials; bearer tokens travel in the
 * Authorization header, not cookies. Set {@code app.cors.allowed-origins} to
 * an explicit list before enabling {@code app.cors.allow-credentials}.
 */
@Configuration
@Slf4j
public class CorsConfig {

    @Value("${app.cors.allowed-origins:*}")
    private List<String> allowedOrigins;

    @Value("${app.cors.allowed-methods:GET,POST,OPTIONS}")
    private List<String> allowedMethods;

    @Value("${app.cors.allowed-headers:Content-Type,Authorization}")
    private List<String> allowedHeaders;

    @Value("${app.cors.allow-credentials:false}")
    private boolean allowCredentials;

    @Value("${app.cors.max-age:3600}")
    private long maxAge;

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOrigins(allowedOrigins);
        config.setAllowedMethods(allowedMethods);
        config.setAllowedHeaders(allowedHeaders);
        config.setAllowCredentials(allowCredentials);
        config.setMaxAge(maxAge);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);

        log.info("CORS configured: origins={}, methods={}, allowCredentials={}",
                allowedOrigins, allowedMethods, allowCredentials);
        return new CorsFilter(source);
    }
}
