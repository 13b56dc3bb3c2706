package com.warden.engine.config;

import com.warden.engine.domain.metrics.ApiMetricsStore;
import com.warden.engine.infrastructure.web.ApiMetricsFilter;
import java.time.Clock;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for local dashboards and the API metrics filter.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Local dashboard origins; production origins belong in environment configuration.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);
    }

    /** Runs right after the correlation filter so recorded calls carry the request's context. */
    @Bean
    public FilterRegistrationBean<ApiMetricsFilter> apiMetricsFilter(ApiMetricsStore store, Clock clock) {
        FilterRegistrationBean<ApiMetricsFilter> registration =
                new FilterRegistrationBean<>(new ApiMetricsFilter(store, clock));
        registration.addUrlPatterns("/api/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);
        return registration;
    }
}
