package com.github.dimitryivaniuta.tutoring.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Answers browser pre-flight requests on the API routes.
 *
 * <p>Plain {@code OPTIONS} requests without CORS headers still reach the handlers, which short-circuit them
 * to the same permissive response.</p>
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final AppProperties properties;

    public CorsConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        AppProperties.Cors cors = properties.getCors();
        registry.addMapping("/api/**")
                .allowedOriginPatterns(cors.getAllowOrigin())
                .allowedMethods("OPTIONS", "GET", "POST", "PUT")
                .allowedHeaders(cors.getAllowHeaders().split("\\s*,\\s*"))
                .allowCredentials(false)
                .maxAge(3600L);
    }
}
