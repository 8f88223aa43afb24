package com.warden.authservice.config;

import com.warden.authservice.infrastructure.web.EdgeAuthorityFilter;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration.
 *
 * <p>Browser clients on the local development servers may call the public API with cookies. The
 * internal API is never exposed cross-origin.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(EdgeAuthorityFilter.CORRELATION_ID_HEADER, "Retry-After")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
