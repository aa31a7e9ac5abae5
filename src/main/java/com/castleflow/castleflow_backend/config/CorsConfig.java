package com.castleflow.castleflow_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;
import java.util.List;

@Configuration
public class CorsConfig {

    @Value("${app.cors.allowed-origins:http://localhost:3000}")
    private String allowedOrigins;

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration config = new CorsConfiguration();

        // Webhooks are called from anywhere, the editor only from the configured origins
        CorsConfiguration webhookConfig = new CorsConfiguration();
        webhookConfig.addAllowedOriginPattern("*");
        webhookConfig.addAllowedMethod("*");
        webhookConfig.addAllowedHeader("*");

        List<String> origins = Arrays.asList(allowedOrigins.split("\\s*,\\s*"));
        origins.forEach(config::addAllowedOriginPattern);
        config.addAllowedMethod("*");
        config.addAllowedHeader("*");
        config.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/webhooks/**", webhookConfig);
        source.registerCorsConfiguration("/**", config);

        return new CorsFilter(source);
    }
}
