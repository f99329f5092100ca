package com.kreasipositif.cashbook.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.time.Duration;
import java.util.List;

/**
 * CORS for the browser-side renderer that uploads exports and prints the ledger.
 * Only the cash book endpoints are exposed; no cookies are involved.
 */
@Configuration
public class CorsConfig {

    private static final String API_PATHS = "/api/**";

    @Value("${cors.allowed-origins:*}")
    private List<String> allowedOrigins;

    @Bean
    public CorsFilter cashBookCorsFilter() {
        CorsConfiguration cashBookApi = new CorsConfiguration();
        cashBookApi.setAllowedOriginPatterns(allowedOrigins);
        cashBookApi.setAllowedMethods(List.of(
                HttpMethod.GET.name(), HttpMethod.POST.name(), HttpMethod.OPTIONS.name()));
        cashBookApi.setAllowedHeaders(List.of(HttpHeaders.CONTENT_TYPE, HttpHeaders.ACCEPT));
        cashBookApi.setAllowCredentials(false);
        cashBookApi.setMaxAge(Duration.ofMinutes(30));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(API_PATHS, cashBookApi);
        return new CorsFilter(source);
    }
}
