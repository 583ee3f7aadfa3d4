package com.chanakya.vault.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
public class CorsConfig {

    private final VaultProperties properties;

    public CorsConfig(VaultProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CorsWebFilter corsWebFilter() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();

        // Viewers open the share link from any clinic system
        CorsConfiguration viewerConfig = new CorsConfiguration();
        viewerConfig.setAllowedOrigins(List.of("*"));
        viewerConfig.setAllowedMethods(List.of("GET", "OPTIONS"));
        viewerConfig.setAllowedHeaders(List.of("*"));
        source.registerCorsConfiguration("/api/timeline/**", viewerConfig);

        List<String> allowedOrigins = properties.cors() != null && properties.cors().allowedOrigins() != null
                ? properties.cors().allowedOrigins()
                : List.of("*");
        CorsConfiguration ownerConfig = new CorsConfiguration();
        ownerConfig.setAllowedOrigins(allowedOrigins);
        ownerConfig.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        ownerConfig.setAllowedHeaders(List.of("*"));
        ownerConfig.setAllowCredentials(!allowedOrigins.contains("*"));
        source.registerCorsConfiguration("/api/patients/**", ownerConfig);

        return new CorsWebFilter(source);
    }
}
