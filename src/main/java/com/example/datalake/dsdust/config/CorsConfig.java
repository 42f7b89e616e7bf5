package com.example.datalake.dsdust.config;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

@Configuration
public class CorsConfig implements WebFluxConfigurer {

    private final List<String> configuredOrigins;

    public CorsConfig(@Value("${cors.allowed-origins:}") String rawOrigins) {
        this.configuredOrigins = parseOrigins(rawOrigins);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (configuredOrigins.isEmpty()) {
            return;
        }
        registry.addMapping("/v1/**")
                .allowedOriginPatterns(configuredOrigins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Content-Disposition")
                .maxAge(3600);
    }

    static List<String> parseOrigins(String rawOrigins) {
        if (!StringUtils.hasText(rawOrigins)) {
            return List.of();
        }

        return Arrays.stream(rawOrigins.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .collect(Collectors.toList());
    }
}
